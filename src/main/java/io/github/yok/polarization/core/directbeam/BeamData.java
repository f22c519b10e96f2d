package io.github.yok.polarization.core.directbeam;

import com.google.common.base.Preconditions;
import org.ejml.data.DMatrixRMaj;

/**
 * 時刻 × 波長の格子上のビーム強度（または透過率）を保持する不変クラスです。
 *
 * <p>
 * 値は行が時刻、列が波長の {@link DMatrixRMaj} で保持します。波長軸は列数と同じ長さ（ビン中心）か、
 * 1つ多い長さ（ビン境界）のどちらかです。時刻を持たないデータは1行で、時刻軸は null です。
 * </p>
 */
public final class BeamData {

    /**
     * 波長軸（Å）です。
     */
    private final double[] wavelength;

    /**
     * 時刻軸（s）です。時刻を持たない場合は null です。
     */
    private final double[] time;

    /**
     * 値（行: 時刻、列: 波長）です。
     */
    private final DMatrixRMaj values;

    /**
     * ビームデータを生成します。
     *
     * @param wavelength 波長軸（Å）です
     * @param time 時刻軸（s）です（null 可）
     * @param values 値（行: 時刻、列: 波長）です
     * @throws IllegalArgumentException 軸と値の形状が一致しない場合に発生します
     */
    public BeamData(double[] wavelength, double[] time, DMatrixRMaj values) {
        Preconditions.checkNotNull(wavelength, "wavelength が null です。");
        Preconditions.checkNotNull(values, "values が null です。");
        int cols = values.getNumCols();
        Preconditions.checkArgument(wavelength.length == cols || wavelength.length == cols + 1,
                "波長軸の長さは列数と同じか1つ多い必要があります。wavelength=%s, cols=%s", wavelength.length,
                cols);
        if (time == null) {
            Preconditions.checkArgument(values.getNumRows() == 1,
                    "時刻軸が無い場合は1行である必要があります。rows=%s", values.getNumRows());
        } else {
            Preconditions.checkArgument(time.length == values.getNumRows(),
                    "時刻軸の長さは行数と一致する必要があります。time=%s, rows=%s", time.length,
                    values.getNumRows());
        }
        this.wavelength = wavelength.clone();
        this.time = time == null ? null : time.clone();
        this.values = values.copy();
    }

    /**
     * 時刻を持たない1行のビームデータを生成します。
     *
     * @param wavelength 波長軸（Å）です
     * @param values 値です
     * @return ビームデータです
     */
    public static BeamData ofWavelength(double[] wavelength, double[] values) {
        DMatrixRMaj m = new DMatrixRMaj(1, values.length);
        for (int j = 0; j < values.length; j++) {
            m.set(0, j, values[j]);
        }
        return new BeamData(wavelength, null, m);
    }

    /**
     * 行数（時刻点数）を返します。
     *
     * @return 行数です
     */
    public int rows() {
        return values.getNumRows();
    }

    /**
     * 列数（波長点数）を返します。
     *
     * @return 列数です
     */
    public int columns() {
        return values.getNumCols();
    }

    /**
     * 値を返します。
     *
     * @param row 行（時刻）です
     * @param col 列（波長）です
     * @return 値です
     */
    public double get(int row, int col) {
        return values.get(row, col);
    }

    /**
     * 時刻を持つかどうかを返します。
     *
     * @return 持つ場合は true です
     */
    public boolean hasTime() {
        return time != null;
    }

    /**
     * 指定行の時刻を返します。
     *
     * @param row 行です
     * @return 時刻（s）です
     * @throws IllegalStateException 時刻を持たない場合に発生します
     */
    public double time(int row) {
        if (time == null) {
            throw new IllegalStateException("時刻座標を持たないデータです。");
        }
        return time[row];
    }

    /**
     * 波長軸がビン境界かどうかを返します。
     *
     * @return ビン境界の場合は true です
     */
    public boolean hasWavelengthEdges() {
        return wavelength.length == values.getNumCols() + 1;
    }

    /**
     * 波長軸のコピーを返します。
     *
     * @return 波長軸です
     */
    public double[] wavelength() {
        return wavelength.clone();
    }

    /**
     * 各列の代表波長を返します。ビン境界の場合は中点です。
     *
     * @return 代表波長（Å）です
     */
    public double[] wavelengthMidpoints() {
        if (!hasWavelengthEdges()) {
            return wavelength.clone();
        }
        double[] mid = new double[values.getNumCols()];
        for (int j = 0; j < mid.length; j++) {
            mid[j] = 0.5 * (wavelength[j] + wavelength[j + 1]);
        }
        return mid;
    }

    /**
     * 値のコピーを返します。
     *
     * @return 値の行列です
     */
    public DMatrixRMaj values() {
        return values.copy();
    }

    /**
     * 同じ軸で値を差し替えたデータを返します。
     *
     * @param newValues 新しい値です
     * @return ビームデータです
     */
    BeamData withValues(DMatrixRMaj newValues) {
        return new BeamData(wavelength, time, newValues);
    }
}
