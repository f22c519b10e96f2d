package io.github.yok.polarization.core.directbeam;

import lombok.Value;

/**
 * 直接ビーム測定の1イベントです。
 */
@Value
public class NeutronEvent {

    /**
     * Qx（1/Å）です。
     */
    double qx;

    /**
     * Qy（1/Å）です。
     */
    double qy;

    /**
     * 波長（Å）です。
     */
    double wavelength;

    /**
     * 時刻（s）です。
     */
    double time;

    /**
     * 重み（正規化済み強度）です。
     */
    double weight;
}
