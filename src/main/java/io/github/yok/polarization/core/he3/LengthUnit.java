package io.github.yok.polarization.core.he3;

/**
 * 長さの単位です。
 */
public enum LengthUnit {

    METER(1.0), CENTIMETER(1.0e-2), MILLIMETER(1.0e-3);

    /**
     * 1 単位あたりの m です。
     */
    private final double meters;

    LengthUnit(double meters) {
        this.meters = meters;
    }

    /**
     * m に換算します。
     *
     * @param value この単位での値です
     * @return m での値です
     */
    public double toMeter(double value) {
        return value * meters;
    }
}
