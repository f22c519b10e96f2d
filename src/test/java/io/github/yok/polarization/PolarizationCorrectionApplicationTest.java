package io.github.yok.polarization;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.yok.polarization.core.correction.PolarizationCorrectionEngine;
import io.github.yok.polarization.core.he3.He3CellCalibration;
import io.github.yok.polarization.core.model.PolarizingElement;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

/**
 * application.yml の構成でコンテキストが起動し、CLI が完走することを確かめます。
 */
@SpringBootTest
class PolarizationCorrectionApplicationTest {

    @Autowired
    private PolarizationCorrectionEngine engine;

    @Autowired
    private Map<PolarizingElement, He3CellCalibration> he3CellCalibrations;

    @Test
    void wiresSupermirrorPolarizerAndHe3Analyzer() {
        assertThat(engine.hasAnalyzer()).isTrue();
        assertThat(he3CellCalibrations).containsOnlyKeys(PolarizingElement.ANALYZER);
    }
}
