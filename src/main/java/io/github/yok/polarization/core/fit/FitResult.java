package io.github.yok.polarization.core.fit;

import lombok.Value;

/**
 * 非線形最小二乗フィットの結果です。
 */
@Value
public class FitResult {

    /**
     * 推定したパラメータです。
     */
    double[] parameters;

    /**
     * パラメータの分散です（共分散の対角成分を残差の二乗和/(n-p) で尺度化したもの）。
     *
     * <p>
     * 共分散が求まらない場合は NaN です。
     * </p>
     */
    double[] variances;

    /**
     * 反復回数です。
     */
    int iterations;

    /**
     * 残差の二乗平均平方根です。
     */
    double rms;

    /**
     * フィットに使った観測点数です。
     */
    int observationCount;
}
