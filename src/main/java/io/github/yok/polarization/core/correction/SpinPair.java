package io.github.yok.polarization.core.correction;

import lombok.Value;

/**
 * up/down の組の配列です。
 */
@Value
public class SpinPair {

    double[] up;

    double[] down;
}
