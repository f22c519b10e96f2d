package io.github.yok.polarization.core.correction;

import lombok.Value;

/**
 * 検光子が無い場合に、1つの測定チャネルに掛ける2つの補正重みです。
 */
@Value
public class HalfPolarizedCorrection {

    double[] up;

    double[] down;
}
