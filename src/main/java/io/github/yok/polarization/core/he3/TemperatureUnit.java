package io.github.yok.polarization.core.he3;

/**
 * 温度の単位です。
 *
 * <p>
 * 摂氏は相対的な尺度（原点がずれた尺度）なので、絶対温度が必要な計算に暗黙には使えません。
 * </p>
 */
public enum TemperatureUnit {

    KELVIN(true), CELSIUS(false);

    /**
     * 絶対温度の尺度かどうかです。
     */
    private final boolean absolute;

    TemperatureUnit(boolean absolute) {
        this.absolute = absolute;
    }

    /**
     * 絶対温度の尺度かどうかを返します。
     *
     * @return 絶対温度の場合は true です
     */
    public boolean isAbsolute() {
        return absolute;
    }
}
