package io.github.yok.polarization.core.correction;

import io.github.yok.polarization.core.model.ChannelData;
import lombok.Value;

/**
 * 検光子が無い場合の補正後の2チャネル（up, down）の強度、またはその寄与です。
 */
@Value
public class HalfPolarizedCorrectedData {

    ChannelData up;

    ChannelData down;

    /**
     * チャネルごとの和を返します。
     *
     * @param other 加える寄与です
     * @return 和です
     */
    public HalfPolarizedCorrectedData plus(HalfPolarizedCorrectedData other) {
        return new HalfPolarizedCorrectedData(up.plus(other.up), down.plus(other.down));
    }
}
