package io.github.yok.polarization.core.he3;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class He3CellParametersTest {

    @Test
    void opacityOfReferenceCell() {
        He3CellParameters cell = new He3CellParameters(1.0, PressureUnit.BAR, 1.0,
                LengthUnit.CENTIMETER, Temperature.kelvin(293.15));

        assertThat(cell.opacity0()).isCloseTo(0.07328, within(0.07328 * 1e-3));
        assertThat(cell.opacityFunction().opacity(2.0)).isCloseTo(2.0 * cell.opacity0(),
                within(1e-12));
    }

    @Test
    void opacityScalesWithPressureAndLength() {
        He3CellParameters base = new He3CellParameters(1.0, PressureUnit.BAR, 1.0,
                LengthUnit.CENTIMETER, Temperature.kelvin(300.0));
        He3CellParameters scaled = new He3CellParameters(2000.0, PressureUnit.MILLIBAR, 30.0,
                LengthUnit.MILLIMETER, Temperature.kelvin(300.0));

        assertThat(scaled.opacity0()).isCloseTo(6.0 * base.opacity0(), within(1e-12));
    }

    @Test
    void celsiusIsRejectedWithoutConversion() {
        He3CellParameters cell = new He3CellParameters(1.0, PressureUnit.BAR, 10.0,
                LengthUnit.CENTIMETER, new Temperature(20.0, TemperatureUnit.CELSIUS));

        assertThatThrownBy(cell::opacity0).isInstanceOf(UnitMismatchException.class);
    }

    @Test
    void celsiusConvertedToKelvinGivesSameOpacity() {
        He3CellParameters kelvin = new He3CellParameters(1.0, PressureUnit.BAR, 10.0,
                LengthUnit.CENTIMETER, Temperature.kelvin(293.15));
        He3CellParameters converted = new He3CellParameters(1.0, PressureUnit.BAR, 10.0,
                LengthUnit.CENTIMETER,
                new Temperature(20.0, TemperatureUnit.CELSIUS).toKelvin());

        assertThat(converted.opacity0()).isCloseTo(kelvin.opacity0(), within(1e-12));
    }

    @Test
    void rejectsNonPositivePressure() {
        assertThatThrownBy(() -> new He3CellParameters(0.0, PressureUnit.BAR, 10.0,
                LengthUnit.CENTIMETER, Temperature.kelvin(293.15)))
                        .isInstanceOf(IllegalArgumentException.class);
    }
}
