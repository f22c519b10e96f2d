package io.github.yok.polarization.core.correction;

import com.google.common.base.Preconditions;
import io.github.yok.polarization.core.model.ChannelData;
import io.github.yok.polarization.core.model.PlusMinus;
import io.github.yok.polarization.core.transmission.TransmissionFunction;

/**
 * 1つの偏極素子の補正係数 {diag, offDiag} です。
 *
 * <p>
 * 素子の転送行列 {@code [[T+, T-], [T-, T+]]} の逆行列の1行で、{@code diag = T+ / (T+^2 - T-^2)}、
 * {@code offDiag = -T- / (T+^2 - T-^2)} です。配列は測定チャネルと同じ長さです。
 * </p>
 */
public final class CorrectionCoefficients {

    /**
     * 分母が T+^2, T-^2 の大きい方に比べてこの比以下なら特異とみなします。
     */
    static final double SINGULARITY_RELATIVE_TOLERANCE = 1e-12;

    /**
     * 対角成分です。
     */
    private final double[] diag;

    /**
     * 非対角成分です。
     */
    private final double[] offDiag;

    /**
     * 補正係数を生成します。
     *
     * @param diag 対角成分です
     * @param offDiag 非対角成分です
     * @throws IllegalArgumentException 長さが一致しない場合に発生します
     */
    public CorrectionCoefficients(double[] diag, double[] offDiag) {
        Preconditions.checkNotNull(diag, "diag が null です。");
        Preconditions.checkNotNull(offDiag, "offDiag が null です。");
        Preconditions.checkArgument(diag.length == offDiag.length,
                "diag と offDiag の長さが一致しません。diag=%s, offDiag=%s", diag.length, offDiag.length);
        this.diag = diag.clone();
        this.offDiag = offDiag.clone();
    }

    /**
     * 測定チャネルの座標上で透過率関数を評価し、補正係数を求めます。
     *
     * @param channel 測定チャネルです（座標のみを使います）
     * @param transmission 偏極素子の透過率関数です
     * @return 補正係数です
     * @throws SingularCorrectionException T+^2 - T-^2 が 0 に近い、または有限でない要素がある場合に発生します
     */
    public static CorrectionCoefficients compute(ChannelData channel,
            TransmissionFunction transmission) {
        Preconditions.checkNotNull(channel, "channel が null です。");
        Preconditions.checkNotNull(transmission, "transmission が null です。");
        double[] plus = transmission.apply(channel, PlusMinus.PLUS);
        double[] minus = transmission.apply(channel, PlusMinus.MINUS);
        Preconditions.checkArgument(plus.length == channel.size() && minus.length == channel.size(),
                "透過率の長さがチャネルと一致しません。channel=%s, plus=%s, minus=%s", channel.size(),
                plus.length, minus.length);

        double[] diag = new double[plus.length];
        double[] offDiag = new double[plus.length];
        for (int i = 0; i < plus.length; i++) {
            double p2 = plus[i] * plus[i];
            double m2 = minus[i] * minus[i];
            double denom = p2 - m2;
            if (!Double.isFinite(denom)
                    || Math.abs(denom) <= SINGULARITY_RELATIVE_TOLERANCE * Math.max(p2, m2)) {
                throw new SingularCorrectionException("偏極素子の転送行列が特異です（偏極能が 0）。index=" + i
                        + ", T+=" + plus[i] + ", T-=" + minus[i]);
            }
            diag[i] = plus[i] / denom;
            offDiag[i] = -minus[i] / denom;
        }
        return new CorrectionCoefficients(diag, offDiag);
    }

    /**
     * 要素数を返します。
     *
     * @return 要素数です
     */
    public int size() {
        return diag.length;
    }

    /**
     * 対角成分のコピーを返します。
     *
     * @return 対角成分です
     */
    public double[] diag() {
        return diag.clone();
    }

    /**
     * 非対角成分のコピーを返します。
     *
     * @return 非対角成分です
     */
    public double[] offDiag() {
        return offDiag.clone();
    }
}
