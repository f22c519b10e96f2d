package io.github.yok.polarization.core.model;

/**
 * 偏極素子の2つの固有チャネル（plus/minus）を表す列挙型です。
 *
 * <p>
 * plus は素子が優先的に透過させるスピン、minus は抑制するスピンです。
 * </p>
 */
public enum PlusMinus {

    /**
     * plus（符号 +1）です。
     */
    PLUS(1.0),

    /**
     * minus（符号 -1）です。
     */
    MINUS(-1.0);

    /**
     * 透過率モデルで偏極率に掛ける符号です。
     */
    private final double sign;

    PlusMinus(double sign) {
        this.sign = sign;
    }

    /**
     * 符号（+1 または -1）を返します。
     *
     * @return 符号です
     */
    public double sign() {
        return sign;
    }
}
