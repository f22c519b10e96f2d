package io.github.yok.polarization.core.he3;

/**
 * 圧力の単位です。
 */
public enum PressureUnit {

    PASCAL(1.0), MILLIBAR(100.0), BAR(1.0e5), ATMOSPHERE(101_325.0);

    /**
     * 1 単位あたりの Pa です。
     */
    private final double pascals;

    PressureUnit(double pascals) {
        this.pascals = pascals;
    }

    /**
     * Pa に換算します。
     *
     * @param value この単位での値です
     * @return Pa での値です
     */
    public double toPascal(double value) {
        return value * pascals;
    }
}
