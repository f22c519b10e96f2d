package io.github.yok.polarization.core.transmission;

import lombok.Value;

/**
 * He3 偏極率の時間減衰 {@code P(t) = C * exp(-t / T1)} を表すクラスです。
 */
@Value
public class PolarizationDecayFunction {

    /**
     * 初期偏極率 C（無次元）です。
     */
    double c;

    /**
     * 減衰時間 T1（s）です。
     */
    double t1;

    /**
     * 減衰関数を生成します。
     *
     * @param c 初期偏極率（[-1, 1]）です
     * @param t1 減衰時間（s、正の値）です
     * @throws IllegalArgumentException 範囲外の場合に発生します
     */
    public PolarizationDecayFunction(double c, double t1) {
        if (!(Math.abs(c) <= 1.0)) {
            throw new IllegalArgumentException("C は [-1, 1] の範囲で指定してください: " + c);
        }
        if (!(t1 > 0.0) || Double.isInfinite(t1)) {
            throw new IllegalArgumentException("T1 は正の有限値を指定してください: " + t1);
        }
        this.c = c;
        this.t1 = t1;
    }

    /**
     * 時刻における偏極率を返します。
     *
     * @param time 時刻（s）です
     * @return 偏極率です
     */
    public double polarization(double time) {
        return c * Math.exp(-time / t1);
    }
}
