package io.github.yok.polarization.core.transmission;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.google.common.collect.ImmutableMap;
import io.github.yok.polarization.core.model.ChannelData;
import io.github.yok.polarization.core.model.PlusMinus;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * スーパーミラーの透過率と効率関数のテストです。
 */
class SupermirrorTransmissionFunctionTest {

    private static ChannelData atWavelengths(double... wavelength) {
        return new ChannelData(new double[wavelength.length],
                ImmutableMap.of(ChannelData.WAVELENGTH, wavelength));
    }

    @Test
    void polynomialEfficiency() {
        SecondDegreePolynomialEfficiency eff = new SecondDegreePolynomialEfficiency(1.0, 2.0, 3.0);
        assertThat(eff.efficiency(0.0)).isEqualTo(3.0);
        assertThat(eff.efficiency(1.0)).isEqualTo(6.0);
        assertThat(eff.efficiency(2.0)).isEqualTo(11.0);
    }

    @Test
    void transmissionIsHalfOfOnePlusMinusEfficiency() {
        SupermirrorTransmissionFunction f = new SupermirrorTransmissionFunction(
                new SecondDegreePolynomialEfficiency(0.0, -0.01, 0.98));
        ChannelData data = atWavelengths(2.0, 8.0);

        double[] plus = f.apply(data, PlusMinus.PLUS);
        double[] minus = f.apply(data, PlusMinus.MINUS);

        assertThat(plus[0]).isCloseTo(0.98, within(1e-12));
        assertThat(minus[0]).isCloseTo(0.02, within(1e-12));
        assertThat(plus[1]).isCloseTo(0.95, within(1e-12));
        assertThat(minus[1]).isCloseTo(0.05, within(1e-12));
    }

    @Test
    void doesNotNeedTimeCoordinate() {
        SupermirrorTransmissionFunction f = new SupermirrorTransmissionFunction(
                new SecondDegreePolynomialEfficiency(0.0, 0.0, 0.9));
        assertThat(f.apply(atWavelengths(3.0), PlusMinus.PLUS)).containsExactly(0.95);
    }

    @Test
    void rejectsEfficiencyOutsideUnitInterval() {
        SupermirrorTransmissionFunction f = new SupermirrorTransmissionFunction(
                new SecondDegreePolynomialEfficiency(0.0, 0.0, 1.5));
        assertThatThrownBy(() -> f.apply(atWavelengths(1.0), PlusMinus.PLUS))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void lookupTableWithBinEdges() {
        EfficiencyLookupTable table = new EfficiencyLookupTable(new double[] {1.0, 2.0, 3.0},
                new double[] {0.9, 0.8});

        assertThat(table.isBinEdges()).isTrue();
        assertThat(table.efficiency(1.0)).isEqualTo(0.9);
        assertThat(table.efficiency(1.99)).isEqualTo(0.9);
        assertThat(table.efficiency(2.0)).isEqualTo(0.8);
        assertThatThrownBy(() -> table.efficiency(3.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> table.efficiency(0.5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void lookupTableWithPointsUsesPreviousPoint() {
        EfficiencyLookupTable table = new EfficiencyLookupTable(new double[] {1.0, 2.0, 4.0},
                new double[] {0.9, 0.8, 0.7});

        assertThat(table.isBinEdges()).isFalse();
        assertThat(table.efficiency(1.5)).isEqualTo(0.9);
        assertThat(table.efficiency(2.0)).isEqualTo(0.8);
        assertThat(table.efficiency(3.9)).isEqualTo(0.8);
        assertThat(table.efficiency(10.0)).isEqualTo(0.7);
        assertThatThrownBy(() -> table.efficiency(0.9))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void lookupTableRejectsNonIncreasingAxis() {
        assertThatThrownBy(() -> new EfficiencyLookupTable(new double[] {1.0, 1.0},
                new double[] {0.9, 0.8})).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void lookupTableFromCsvByColumnName() throws IOException {
        String csv = "lambda,eff,comment\n1.0,0.99,a\n2.0,0.97,b\n3.0,0.95,c\n";

        EfficiencyLookupTable table =
                EfficiencyLookupTable.fromCsv(new StringReader(csv), "lambda", "eff");

        assertThat(table.efficiency(2.5)).isEqualTo(0.97);
    }

    @Test
    void lookupTableFromCsvReportsMissingColumn() {
        String csv = "wavelength,efficiency\n1.0,0.99\n";
        assertThatThrownBy(() -> EfficiencyLookupTable.fromCsv(new StringReader(csv),
                "wavelength", "polarization")).isInstanceOf(IllegalArgumentException.class)
                        .hasMessageContaining("polarization");
    }

    @Test
    void lookupTableFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("supermirror.csv");
        Files.write(file, "wavelength,efficiency\n1.0,0.99\n5.0,0.9\n"
                .getBytes(StandardCharsets.UTF_8));

        SupermirrorTransmissionFunction f = new SupermirrorTransmissionFunction(
                EfficiencyLookupTable.fromFile(file, "wavelength", "efficiency"));

        assertThat(f.transmission(6.0, PlusMinus.MINUS)).isCloseTo(0.05, within(1e-12));
    }
}
