package io.github.yok.polarization.core.he3;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.github.yok.polarization.core.directbeam.BeamData;
import io.github.yok.polarization.core.fit.CurveFitter;
import io.github.yok.polarization.core.model.PlusMinus;
import io.github.yok.polarization.core.transmission.He3TransmissionFunction;
import io.github.yok.polarization.core.transmission.OpacityFunction;
import io.github.yok.polarization.core.transmission.PolarizationDecayFunction;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

/**
 * {@link He3TransmissionFitter} のテストです。
 *
 * <p>
 * 既知の (opacity0, C, T1) で合成した透過率から、パラメータが再現できることを確かめます。
 * </p>
 */
class He3TransmissionFitterTest {

    private static final double T_E = 0.9;

    private static final OpacityFunction OPACITY = new OpacityFunction(0.6);

    private static CurveFitter curveFitter() {
        return new CurveFitter(1000, 10_000, 1e-12, 1e-12);
    }

    private static double[] linspace(double from, double to, int n) {
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = from + (to - from) * i / (n - 1);
        }
        return out;
    }

    /**
     * 関数値を (時刻 × 波長) の格子に並べます。
     */
    private static BeamData grid(double[] wavelength, double[] time, Cell cell) {
        DMatrixRMaj m = new DMatrixRMaj(time.length, wavelength.length);
        for (int r = 0; r < time.length; r++) {
            for (int c = 0; c < wavelength.length; c++) {
                m.set(r, c, cell.value(time[r], wavelength[c]));
            }
        }
        return new BeamData(wavelength, time, m);
    }

    private interface Cell {
        double value(double time, double wavelength);
    }

    @Test
    void fitsOpacityFromDepolarizedCell() {
        double[] wl = linspace(0.5, 5.0, 40);
        double[] values = Arrays.stream(wl).map(l -> T_E * Math.exp(-0.6 * l)).toArray();
        He3TransmissionFitter fitter = new He3TransmissionFitter(curveFitter(), 0.8, 4e5);

        He3FitResult<OpacityFunction> r =
                fitter.fitOpacity(BeamData.ofWavelength(wl, values), T_E, 0.6 * 1.23);

        assertThat(r.getFunction().getOpacity0()).isCloseTo(0.6, within(0.6 * 1e-10));
        assertThat(r.getVariances()).hasSize(1);
    }

    @Test
    void fitsDecayFromUnpolarizedIncomingBeam() {
        He3TransmissionFunction truth =
                new He3TransmissionFunction(OPACITY, new PolarizationDecayFunction(0.9, 1234.0), T_E);
        BeamData data = grid(linspace(0.5, 5.0, 40), linspace(0.0, 10_000.0, 200),
                truth::unpolarizedTransmission);
        He3TransmissionFitter fitter = new He3TransmissionFitter(curveFitter(), 0.8, 1000.0);

        He3FitResult<He3TransmissionFunction> r =
                fitter.fitUnpolarizedIncoming(data, OPACITY, T_E);

        PolarizationDecayFunction decay = r.getFunction().getPolarizationFunction();
        assertThat(decay.getC()).isCloseTo(0.9, within(0.9 * 1e-10));
        assertThat(decay.getT1()).isCloseTo(1234.0, within(1234.0 * 1e-10));
        assertThat(r.getVariances()).hasSize(2);
    }

    @Test
    void fitsDecayFromNoisyUnpolarizedIncomingBeam() {
        He3TransmissionFunction truth =
                new He3TransmissionFunction(OPACITY, new PolarizationDecayFunction(0.9, 1234.0), T_E);
        Random random = new Random(1234L);
        BeamData data = grid(linspace(0.5, 5.0, 40), linspace(0.0, 10_000.0, 1000),
                (t, l) -> truth.unpolarizedTransmission(t, l) + 0.01 * random.nextGaussian());
        He3TransmissionFitter fitter = new He3TransmissionFitter(curveFitter(), 0.8, 1000.0);

        PolarizationDecayFunction decay =
                fitter.fitUnpolarizedIncoming(data, OPACITY, T_E).getFunction()
                        .getPolarizationFunction();

        assertThat(decay.getC()).isCloseTo(0.9, within(0.9 * 0.01));
        assertThat(decay.getT1()).isCloseTo(1234.0, within(1234.0 * 0.01));
    }

    @Test
    void fitsDecayJointlyFromPlusAndMinus() {
        He3TransmissionFunction truth =
                new He3TransmissionFunction(OPACITY, new PolarizationDecayFunction(0.7, 3.6e5), T_E);
        double[] wl = linspace(0.5, 5.0, 40);
        BeamData plus = grid(wl, linspace(0.0, 1e6, 200),
                (t, l) -> truth.transmission(t, l, PlusMinus.PLUS));
        BeamData minus = grid(wl, linspace(5e3, 1e6, 200),
                (t, l) -> truth.transmission(t, l, PlusMinus.MINUS));
        He3TransmissionFitter fitter = new He3TransmissionFitter(curveFitter(), 0.8, 4e5);

        He3FitResult<He3TransmissionFunction> r = fitter.fitPolarizedIncoming(
                List.of(new TaggedTransmissionFraction(PlusMinus.PLUS, plus),
                        new TaggedTransmissionFraction(PlusMinus.MINUS, minus)),
                OPACITY, T_E);

        PolarizationDecayFunction decay = r.getFunction().getPolarizationFunction();
        assertThat(decay.getC()).isCloseTo(0.7, within(0.7 * 1e-10));
        assertThat(decay.getT1()).isCloseTo(3.6e5, within(3.6e5 * 1e-10));
    }

    @Test
    void rejectsPlusOnlyData() {
        He3TransmissionFunction truth =
                new He3TransmissionFunction(OPACITY, new PolarizationDecayFunction(0.7, 3.6e5), T_E);
        BeamData plus = grid(linspace(0.5, 5.0, 40), linspace(0.0, 1e6, 100),
                (t, l) -> truth.transmission(t, l, PlusMinus.PLUS));
        He3TransmissionFitter fitter = new He3TransmissionFitter(curveFitter(), 0.8, 4e5);

        assertThatThrownBy(() -> fitter.fitPolarizedIncoming(
                List.of(new TaggedTransmissionFraction(PlusMinus.PLUS, plus),
                        new TaggedTransmissionFraction(PlusMinus.PLUS, plus)),
                OPACITY, T_E)).isInstanceOf(IllegalArgumentException.class)
                        .hasMessageContaining("MINUS");
    }

    @Test
    void rejectsMinusOnlyData() {
        BeamData minus = grid(new double[] {1.0, 2.0}, new double[] {10.0, 20.0}, (t, l) -> 0.1);
        He3TransmissionFitter fitter = new He3TransmissionFitter(curveFitter(), 0.8, 4e5);

        assertThatThrownBy(() -> fitter.fitPolarizedIncoming(
                List.of(new TaggedTransmissionFraction(PlusMinus.MINUS, minus)), OPACITY, T_E))
                        .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("PLUS");
    }

    @Test
    void missingTagNamesTheOffendingEntry() {
        BeamData data = grid(new double[] {1.0, 2.0}, new double[] {10.0, 20.0}, (t, l) -> 0.5);
        He3TransmissionFitter fitter = new He3TransmissionFitter(curveFitter(), 0.8, 4e5);

        assertThatThrownBy(() -> fitter.fitPolarizedIncoming(
                List.of(new TaggedTransmissionFraction(PlusMinus.PLUS, data),
                        new TaggedTransmissionFraction(null, data)),
                OPACITY, T_E)).isInstanceOf(IllegalArgumentException.class)
                        .hasMessageContaining("[1]").hasMessageContaining("plus/minus");
    }

    @Test
    void decayFitRequiresTime() {
        BeamData noTime = BeamData.ofWavelength(new double[] {1.0, 2.0, 3.0},
                new double[] {0.5, 0.4, 0.3});
        He3TransmissionFitter fitter = new He3TransmissionFitter(curveFitter(), 0.8, 4e5);

        assertThatThrownBy(() -> fitter.fitUnpolarizedIncoming(noTime, OPACITY, T_E))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> fitter.fitPolarizedIncoming(
                List.of(new TaggedTransmissionFraction(PlusMinus.MINUS, noTime)), OPACITY, T_E))
                        .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsEmptyInput() {
        He3TransmissionFitter fitter = new He3TransmissionFitter(curveFitter(), 0.8, 4e5);
        assertThatThrownBy(() -> fitter.fitPolarizedIncoming(List.of(), OPACITY, T_E))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
