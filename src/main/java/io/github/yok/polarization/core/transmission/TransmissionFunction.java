package io.github.yok.polarization.core.transmission;

import io.github.yok.polarization.core.model.ChannelData;
import io.github.yok.polarization.core.model.PlusMinus;

/**
 * 偏極素子の透過率（plus/minus）を評価するインタフェースです。
 *
 * <p>
 * 実装は不変で、複数の測定チャネルから同時に評価されても安全でなければなりません。
 * 評価には測定データ自身の座標（波長・時刻）を使い、値は参照しません。
 * </p>
 */
public interface TransmissionFunction {

    /**
     * 測定データの座標上で透過率を評価します。
     *
     * @param data 座標を持つ測定データです
     * @param plusMinus 評価する固有チャネルです
     * @return 要素ごとの透過率です（長さは data の要素数）
     * @throws IllegalArgumentException 必要な座標が無い場合に発生します
     */
    double[] apply(ChannelData data, PlusMinus plusMinus);
}
