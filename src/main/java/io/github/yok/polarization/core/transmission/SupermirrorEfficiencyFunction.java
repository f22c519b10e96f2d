package io.github.yok.polarization.core.transmission;

/**
 * スーパーミラーの偏極効率 ε(λ) を返すインタフェースです。
 */
public interface SupermirrorEfficiencyFunction {

    /**
     * 波長における効率を返します。
     *
     * @param wavelength 波長（Å）です
     * @return 効率です
     */
    double efficiency(double wavelength);
}
