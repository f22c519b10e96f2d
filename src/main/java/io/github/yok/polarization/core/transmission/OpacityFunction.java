package io.github.yok.polarization.core.transmission;

import lombok.Value;

/**
 * He3 セルの不透明度（opacity）関数です。
 *
 * <p>
 * {@code O(λ) = opacity0 * λ} で、opacity0 は波長 1 Å における不透明度（1/Å）です。
 * </p>
 */
@Value
public class OpacityFunction {

    /**
     * 1 Å あたりの不透明度（1/Å）です。
     */
    double opacity0;

    /**
     * 不透明度関数を生成します。
     *
     * @param opacity0 1 Å あたりの不透明度（1/Å、有限値）です
     * @throws IllegalArgumentException 有限値でない場合に発生します
     */
    public OpacityFunction(double opacity0) {
        if (!Double.isFinite(opacity0)) {
            throw new IllegalArgumentException("opacity0 は有限値を指定してください: " + opacity0);
        }
        this.opacity0 = opacity0;
    }

    /**
     * 波長における不透明度を返します。
     *
     * @param wavelength 波長（Å）です
     * @return 不透明度です
     */
    public double opacity(double wavelength) {
        return opacity0 * wavelength;
    }
}
