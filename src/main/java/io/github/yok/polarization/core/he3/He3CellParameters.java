package io.github.yok.polarization.core.he3;

import com.google.common.base.Preconditions;
import io.github.yok.polarization.core.transmission.OpacityFunction;
import lombok.Value;

/**
 * He3 セルの物理パラメータ（圧力・長さ・温度）です。
 *
 * <p>
 * 波長 1 Å の不透明度を {@code opacity0 = σ0 / (k_B * T) * p * L} で求めます。σ0 は He3 の 1 Å における中性子吸収断面積です。
 * </p>
 */
@Value
public class He3CellParameters {

    /**
     * 1 Å における He3 の吸収断面積（m^2/Å、2966 barn/Å）です。
     */
    private static final double ABSORPTION_CROSS_SECTION = 2966.0e-28;

    /**
     * ボルツマン定数（J/K）です。
     */
    private static final double BOLTZMANN_CONSTANT = 1.380649e-23;

    /**
     * 圧力です。
     */
    double pressure;

    /**
     * 圧力の単位です。
     */
    PressureUnit pressureUnit;

    /**
     * セル長です。
     */
    double length;

    /**
     * セル長の単位です。
     */
    LengthUnit lengthUnit;

    /**
     * 温度です。
     */
    Temperature temperature;

    /**
     * セルパラメータを生成します。
     *
     * @param pressure 圧力（正の値）です
     * @param pressureUnit 圧力の単位です
     * @param length セル長（正の値）です
     * @param lengthUnit セル長の単位です
     * @param temperature 温度です
     * @throws IllegalArgumentException 圧力・長さが正の有限値でない場合に発生します
     */
    public He3CellParameters(double pressure, PressureUnit pressureUnit, double length,
            LengthUnit lengthUnit, Temperature temperature) {
        Preconditions.checkArgument(pressure > 0.0 && Double.isFinite(pressure),
                "圧力は正の有限値である必要があります。p=%s", pressure);
        Preconditions.checkArgument(length > 0.0 && Double.isFinite(length),
                "セル長は正の有限値である必要があります。L=%s", length);
        this.pressure = pressure;
        this.pressureUnit = Preconditions.checkNotNull(pressureUnit, "pressureUnit が null です。");
        this.length = length;
        this.lengthUnit = Preconditions.checkNotNull(lengthUnit, "lengthUnit が null です。");
        this.temperature = Preconditions.checkNotNull(temperature, "temperature が null です。");
    }

    /**
     * 波長 1 Å における不透明度（1/Å）を返します。
     *
     * @return opacity0（1/Å）です
     * @throws UnitMismatchException 温度が絶対温度の尺度でない場合に発生します
     * @throws IllegalArgumentException 温度が正でない場合に発生します
     */
    public double opacity0() {
        double kelvin = temperature.kelvinValue();
        Preconditions.checkArgument(kelvin > 0.0, "絶対温度は正である必要があります。T=%s", kelvin);
        double numberDensity =
                pressureUnit.toPascal(pressure) / (BOLTZMANN_CONSTANT * kelvin);
        return ABSORPTION_CROSS_SECTION * numberDensity * lengthUnit.toMeter(length);
    }

    /**
     * セルパラメータから求めた不透明度関数を返します。
     *
     * @return 不透明度関数です
     */
    public OpacityFunction opacityFunction() {
        return new OpacityFunction(opacity0());
    }
}
