package io.github.yok.polarization.core.correction;

import lombok.Value;

/**
 * スピンフリッパーの効率 f（0 &lt; f &lt;= 1）です。
 *
 * <p>
 * f = 1 は理想的なフリッパーで、物理的なフリッパーが無い場合の既定値です。
 * </p>
 */
@Value
public class FlipperEfficiency {

    /**
     * 理想的なフリッパー（f = 1）です。
     */
    public static final FlipperEfficiency IDEAL = new FlipperEfficiency(1.0);

    /**
     * 効率です。
     */
    double value;

    /**
     * フリッパー効率を生成します。
     *
     * @param value 効率（0 &lt; f &lt;= 1）です
     * @throws IllegalArgumentException 範囲外の場合に発生します
     */
    public FlipperEfficiency(double value) {
        if (!(value > 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException("フリッパー効率は (0, 1] の範囲で指定してください: " + value);
        }
        this.value = value;
    }
}
