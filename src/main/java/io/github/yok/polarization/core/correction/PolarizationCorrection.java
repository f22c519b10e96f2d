package io.github.yok.polarization.core.correction;

import lombok.Value;

/**
 * 1つの測定チャネルに掛ける4つの補正重みです。
 *
 * <p>
 * 各重みは、その測定チャネルが補正後の ++, +-, -+, -- のそれぞれに寄与する係数です。
 * </p>
 */
@Value
public class PolarizationCorrection {

    double[] upup;

    double[] updown;

    double[] downup;

    double[] downdown;
}
