package io.github.yok.polarization.core.he3;

import com.google.common.base.Preconditions;
import lombok.Value;

/**
 * 単位付きの温度です。
 */
@Value
public class Temperature {

    /**
     * 0 ℃ に対応する絶対温度（K）です。
     */
    private static final double ZERO_CELSIUS_IN_KELVIN = 273.15;

    /**
     * 値です。
     */
    double value;

    /**
     * 単位です。
     */
    TemperatureUnit unit;

    /**
     * 温度を生成します。
     *
     * @param value 値です
     * @param unit 単位です
     */
    public Temperature(double value, TemperatureUnit unit) {
        this.value = value;
        this.unit = Preconditions.checkNotNull(unit, "unit が null です。");
    }

    /**
     * ケルビンの温度を生成します。
     *
     * @param kelvin 温度（K）です
     * @return 温度です
     */
    public static Temperature kelvin(double kelvin) {
        return new Temperature(kelvin, TemperatureUnit.KELVIN);
    }

    /**
     * 絶対温度（K）を返します。
     *
     * @return 温度（K）です
     * @throws UnitMismatchException 単位が絶対温度の尺度でない場合に発生します
     */
    public double kelvinValue() {
        if (!unit.isAbsolute()) {
            throw new UnitMismatchException("絶対温度が必要ですが、相対尺度の単位が指定されました: " + value + " "
                    + unit + "（明示的に toKelvin() で換算してください）");
        }
        return value;
    }

    /**
     * 明示的にケルビンへ換算した温度を返します。
     *
     * @return ケルビンの温度です
     */
    public Temperature toKelvin() {
        if (unit == TemperatureUnit.KELVIN) {
            return this;
        }
        return kelvin(value + ZERO_CELSIUS_IN_KELVIN);
    }
}
