package io.github.yok.polarization.core.directbeam;

import lombok.Value;

/**
 * Q の範囲 [min, max)（1/Å）です。
 */
@Value
public class QRange {

    /**
     * 下限（1/Å）です。
     */
    double min;

    /**
     * 上限（1/Å）です。
     */
    double max;

    /**
     * Q の範囲を生成します。
     *
     * @param min 下限（1/Å）です
     * @param max 上限（1/Å）です
     * @throws IllegalArgumentException 有限値でない、または下限が上限より大きい場合に発生します
     */
    public QRange(double min, double max) {
        if (!Double.isFinite(min) || !Double.isFinite(max) || min > max) {
            throw new IllegalArgumentException("Q 範囲が不正です: [" + min + ", " + max + ")");
        }
        this.min = min;
        this.max = max;
    }

    /**
     * Q^2 が範囲 [min^2, max^2) に入るかどうかを返します。
     *
     * @param qSquared Q^2 です
     * @return 入る場合は true です
     */
    public boolean containsSquared(double qSquared) {
        return qSquared >= min * min && qSquared < max * max;
    }
}
