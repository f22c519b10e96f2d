package io.github.yok.polarization.core.directbeam;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Value;

/**
 * 直接ビーム測定のイベント列と、その重みの単位です。
 *
 * <p>
 * 正規化済みデータの単位は無次元（空文字列）です。
 * </p>
 */
@Value
public class EventData {

    /**
     * イベント列です。
     */
    ImmutableList<NeutronEvent> events;

    /**
     * 重みの単位です（無次元は空文字列）。
     */
    String unit;

    /**
     * イベントデータを生成します。
     *
     * @param events イベント列です
     * @param unit 重みの単位です
     */
    public EventData(List<NeutronEvent> events, String unit) {
        this.events = ImmutableList.copyOf(events);
        this.unit = unit == null ? "" : unit;
    }

    /**
     * 正規化済み（無次元）かどうかを返します。
     *
     * @return 正規化済みの場合は true です
     */
    public boolean isNormalized() {
        return unit.isEmpty();
    }
}
