package io.github.yok.polarization.core.fit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

/**
 * {@link CurveFitter} のテストです。
 */
class CurveFitterTest {

    /**
     * {@code a * exp(-b * x)} のモデルです。
     */
    private static final FitModel EXPONENTIAL = new FitModel() {

        @Override
        public int parameterCount() {
            return 2;
        }

        @Override
        public double value(double[] x, double[] p) {
            return p[0] * Math.exp(-p[1] * x[0]);
        }

        @Override
        public double[] gradient(double[] x, double[] p) {
            double e = Math.exp(-p[1] * x[0]);
            return new double[] {e, -p[0] * x[0] * e};
        }
    };

    private final CurveFitter fitter = new CurveFitter(1000, 10_000, 1e-12, 1e-12);

    private static double[][] grid(int n) {
        double[][] x = new double[n][];
        for (int i = 0; i < n; i++) {
            x[i] = new double[] {0.1 * i};
        }
        return x;
    }

    private static double[] observe(double[][] x, double a, double b) {
        double[] y = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            y[i] = a * Math.exp(-b * x[i][0]);
        }
        return y;
    }

    @Test
    void recoversParametersFromNoiselessData() {
        double[][] x = grid(50);
        FitResult r = fitter.fit(EXPONENTIAL, x, observe(x, 2.5, 0.8), new double[] {1.0, 0.3});

        assertThat(r.getParameters()[0]).isCloseTo(2.5, within(1e-8));
        assertThat(r.getParameters()[1]).isCloseTo(0.8, within(1e-8));
        assertThat(r.getObservationCount()).isEqualTo(50);
        assertThat(r.getRms()).isLessThan(1e-8);
    }

    @Test
    void skipsNonFiniteObservations() {
        double[][] x = grid(30);
        double[] y = observe(x, 2.5, 0.8);
        y[3] = Double.NaN;
        y[7] = Double.POSITIVE_INFINITY;

        FitResult r = fitter.fit(EXPONENTIAL, x, y, new double[] {1.0, 0.3});

        assertThat(r.getObservationCount()).isEqualTo(28);
        assertThat(r.getParameters()[1]).isCloseTo(0.8, within(1e-8));
    }

    @Test
    void reportsVariancesScaledByResidual() {
        double[][] x = grid(40);
        double[] y = observe(x, 2.5, 0.8);
        for (int i = 0; i < y.length; i++) {
            y[i] += (i % 2 == 0 ? 0.01 : -0.01);
        }

        FitResult r = fitter.fit(EXPONENTIAL, x, y, new double[] {2.0, 0.5});

        assertThat(r.getVariances()).hasSize(2);
        assertThat(r.getVariances()[0]).isPositive();
        assertThat(r.getVariances()[1]).isPositive();
    }

    @Test
    void rejectsTooFewObservations() {
        double[][] x = grid(2);
        assertThatThrownBy(() -> fitter.fit(EXPONENTIAL, x, observe(x, 1.0, 1.0),
                new double[] {1.0, 1.0})).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reportsNonConvergence() {
        CurveFitter oneStep = new CurveFitter(1, 10_000, 1e-15, 1e-15);
        double[][] x = grid(50);

        assertThatThrownBy(() -> oneStep.fit(EXPONENTIAL, x, observe(x, 2.5, 0.8),
                new double[] {100.0, 20.0})).isInstanceOf(FitConvergenceException.class);
    }
}
