package io.github.yok.polarization.core.transmission;

import lombok.Value;

/**
 * 波長の2次多項式 {@code a*λ^2 + b*λ + c}（λ は Å）で表したスーパーミラー効率です。
 */
@Value
public class SecondDegreePolynomialEfficiency implements SupermirrorEfficiencyFunction {

    /**
     * 2次の係数（1/Å^2）です。
     */
    double a;

    /**
     * 1次の係数（1/Å）です。
     */
    double b;

    /**
     * 定数項です。
     */
    double c;

    @Override
    public double efficiency(double wavelength) {
        return (a * wavelength + b) * wavelength + c;
    }
}
