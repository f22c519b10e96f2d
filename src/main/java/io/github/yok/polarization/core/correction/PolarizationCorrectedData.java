package io.github.yok.polarization.core.correction;

import com.google.common.base.Preconditions;
import io.github.yok.polarization.core.model.ChannelData;
import io.github.yok.polarization.core.model.SpinChannel;
import java.util.Collection;
import java.util.Iterator;
import lombok.Value;

/**
 * 補正後の4チャネル（++, +-, -+, --）の強度、またはその1測定チャネル分の寄与です。
 *
 * <p>
 * 4つの測定チャネルの寄与を {@link #plus(PolarizationCorrectedData)} で足し合わせると補正結果になります。
 * </p>
 */
@Value
public class PolarizationCorrectedData {

    ChannelData upup;

    ChannelData updown;

    ChannelData downup;

    ChannelData downdown;

    /**
     * 指定したチャネルの強度を返します。
     *
     * @param channel チャネルです
     * @return 強度です
     */
    public ChannelData get(SpinChannel channel) {
        if (channel.equals(SpinChannel.UP_UP)) {
            return upup;
        } else if (channel.equals(SpinChannel.UP_DOWN)) {
            return updown;
        } else if (channel.equals(SpinChannel.DOWN_UP)) {
            return downup;
        }
        return downdown;
    }

    /**
     * チャネルごとの和を返します。
     *
     * @param other 加える寄与です
     * @return 和です
     */
    public PolarizationCorrectedData plus(PolarizationCorrectedData other) {
        return new PolarizationCorrectedData(upup.plus(other.upup), updown.plus(other.updown),
                downup.plus(other.downup), downdown.plus(other.downdown));
    }

    /**
     * 寄与をすべて足し合わせます。
     *
     * @param contributions 寄与の一覧です（1件以上）
     * @return 和です
     * @throws IllegalArgumentException 一覧が空の場合に発生します
     */
    public static PolarizationCorrectedData sum(
            Collection<PolarizationCorrectedData> contributions) {
        Preconditions.checkArgument(contributions != null && !contributions.isEmpty(),
                "寄与がありません。");
        Iterator<PolarizationCorrectedData> it = contributions.iterator();
        PolarizationCorrectedData total = it.next();
        while (it.hasNext()) {
            total = total.plus(it.next());
        }
        return total;
    }
}
