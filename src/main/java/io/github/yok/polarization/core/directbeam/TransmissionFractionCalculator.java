package io.github.yok.polarization.core.directbeam;

import com.google.common.base.Preconditions;
import java.util.Arrays;
import org.ejml.data.DMatrixRMaj;

/**
 * セルありの直接ビームとセルなしの直接ビームの比（透過率）を求めるクラスです。
 *
 * <p>
 * セルなしのデータが1行の場合は全時刻にブロードキャストします。
 * </p>
 */
public final class TransmissionFractionCalculator {

    /**
     * 透過率 {@code withCell / withoutCell} を求めます。
     *
     * @param withCell セルありの直接ビームです
     * @param withoutCell セルなしの直接ビームです
     * @return 透過率です（軸は withCell のもの）
     * @throws IllegalArgumentException 波長軸が一致しない、行数が合わない、または分母が 0 の場合に発生します
     */
    public BeamData compute(BeamData withCell, BeamData withoutCell) {
        Preconditions.checkNotNull(withCell, "withCell が null です。");
        Preconditions.checkNotNull(withoutCell, "withoutCell が null です。");
        Preconditions.checkArgument(Arrays.equals(withCell.wavelength(), withoutCell.wavelength()),
                "セルあり/なしで波長軸が一致しません。");
        Preconditions.checkArgument(
                withoutCell.rows() == 1 || withoutCell.rows() == withCell.rows(),
                "セルなしの行数は 1 またはセルありと同じである必要があります。withCell=%s, withoutCell=%s",
                withCell.rows(), withoutCell.rows());

        DMatrixRMaj out = new DMatrixRMaj(withCell.rows(), withCell.columns());
        for (int r = 0; r < withCell.rows(); r++) {
            int rr = withoutCell.rows() == 1 ? 0 : r;
            for (int c = 0; c < withCell.columns(); c++) {
                double denom = withoutCell.get(rr, c);
                if (denom == 0.0) {
                    throw new IllegalArgumentException(
                            "セルなしの直接ビームが 0 です。row=" + rr + ", col=" + c);
                }
                out.set(r, c, withCell.get(r, c) / denom);
            }
        }
        return withCell.withValues(out);
    }
}
