package io.github.yok.polarization.core.directbeam;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * {@link DirectBeamCalculator} のテストです。
 */
class DirectBeamCalculatorTest {

    private static final double[] EDGES = {1.0, 2.0, 3.0};

    private static final QRange BEAM = new QRange(0.0, 0.1);

    private static final QRange BACKGROUND = new QRange(0.2, 0.3);

    private final DirectBeamCalculator calculator = new DirectBeamCalculator();

    private static NeutronEvent event(double q, double wavelength, double time, double weight) {
        return new NeutronEvent(q, 0.0, wavelength, time, weight);
    }

    @Test
    void subtractsMeanBackgroundPerWavelengthBin() {
        EventData data = new EventData(List.of(
                event(0.01, 1.2, 0.0, 4.0),
                event(0.05, 1.8, 0.0, 6.0),
                event(0.25, 1.5, 0.0, 1.0),
                event(0.02, 2.5, 0.0, 3.0),
                event(0.21, 2.1, 0.0, 1.0),
                event(0.29, 2.9, 0.0, 2.0),
                // 範囲外
                event(0.15, 1.5, 0.0, 100.0),
                event(0.01, 3.5, 0.0, 100.0)), "");

        BeamData beam = calculator.compute(data, EDGES, null, BEAM, BACKGROUND);

        assertThat(beam.hasTime()).isFalse();
        assertThat(beam.hasWavelengthEdges()).isTrue();
        assertThat(beam.get(0, 0)).isCloseTo(4.0, within(1e-12));
        assertThat(beam.get(0, 1)).isCloseTo(1.5, within(1e-12));
    }

    @Test
    void binsByTime() {
        EventData data = new EventData(List.of(
                event(0.01, 1.5, 5.0, 2.0),
                event(0.25, 1.5, 5.0, 1.0),
                event(0.01, 1.5, 15.0, 8.0),
                event(0.25, 1.5, 15.0, 2.0)), "");

        BeamData beam = calculator.compute(data, new double[] {1.0, 2.0},
                new double[] {0.0, 10.0, 20.0}, BEAM, BACKGROUND);

        assertThat(beam.rows()).isEqualTo(2);
        assertThat(beam.time(0)).isEqualTo(5.0);
        assertThat(beam.time(1)).isEqualTo(15.0);
        assertThat(beam.get(0, 0)).isCloseTo(1.0, within(1e-12));
        assertThat(beam.get(1, 0)).isCloseTo(6.0, within(1e-12));
    }

    @Test
    void emptyBinIsNaN() {
        EventData data = new EventData(List.of(event(0.01, 1.5, 0.0, 1.0),
                event(0.25, 1.5, 0.0, 0.5)), "");

        BeamData beam = calculator.compute(data, EDGES, null, BEAM, BACKGROUND);

        assertThat(beam.get(0, 0)).isCloseTo(0.5, within(1e-12));
        assertThat(beam.get(0, 1)).isNaN();
    }

    @Test
    void rejectsDataWithUnit() {
        EventData counts = new EventData(List.of(event(0.01, 1.5, 0.0, 1.0)), "counts");

        assertThatThrownBy(() -> calculator.compute(counts, EDGES, null, BEAM, BACKGROUND))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("正規化");
    }

    @Test
    void rejectsBackgroundInsideBeam() {
        EventData data = new EventData(List.of(), "");

        assertThatThrownBy(() -> calculator.compute(data, EDGES, null, new QRange(0.0, 0.25),
                BACKGROUND)).isInstanceOf(IllegalArgumentException.class)
                        .hasMessageContaining("バックグラウンド");
    }

    @Test
    void rejectsNegativeRange() {
        EventData data = new EventData(List.of(), "");

        assertThatThrownBy(() -> calculator.compute(data, EDGES, null, new QRange(-0.1, 0.1),
                BACKGROUND)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNonIncreasingEdges() {
        EventData data = new EventData(List.of(), "");

        assertThatThrownBy(() -> calculator.compute(data, new double[] {1.0, 1.0}, null, BEAM,
                BACKGROUND)).isInstanceOf(IllegalArgumentException.class);
    }
}
