package io.github.yok.polarization.app;

import io.github.yok.polarization.core.correction.FlipperEfficiency;
import io.github.yok.polarization.core.correction.PolarizationCorrectionEngine;
import io.github.yok.polarization.core.fit.CurveFitter;
import io.github.yok.polarization.core.he3.He3CellCalibration;
import io.github.yok.polarization.core.he3.He3TransmissionFitter;
import io.github.yok.polarization.core.model.PolarizingElement;
import java.util.EnumMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 透過率関数・フィッタ・補正エンジンの Bean 定義を行う設定クラスです。
 */
@Configuration
@RequiredArgsConstructor
public class PolarizationConfiguration {

    /**
     * 偏極補正の設定値（polarization.*）です。
     */
    private final PolarizationProperties p;

    /**
     * 曲線フィットの実装を生成します。
     *
     * @return 曲線フィットの実装です
     */
    @Bean
    public CurveFitter curveFitter() {
        PolarizationProperties.Fit f = p.getFit();
        return new CurveFitter(f.getMaxIterations(), f.getMaxEvaluations(),
                f.getCostRelativeTolerance(), f.getParameterRelativeTolerance());
    }

    /**
     * He3 透過率のフィッタを生成します。
     *
     * @param curveFitter 曲線フィットの実装です
     * @return フィッタです
     */
    @Bean
    public He3TransmissionFitter he3TransmissionFitter(CurveFitter curveFitter) {
        return new He3TransmissionFitter(curveFitter, p.getFit().getInitialC(),
                p.getFit().getInitialT1());
    }

    /**
     * 透過率関数の生成ロジックを生成します。
     *
     * @return 生成ロジックです
     */
    @Bean
    public TransmissionFunctionFactory transmissionFunctionFactory() {
        return new TransmissionFunctionFactory();
    }

    /**
     * He3 セルとして設定された素子ごとの校正手順を生成します。
     *
     * @param fitter He3 透過率のフィッタです
     * @param factory 透過率関数の生成ロジックです
     * @return 素子から校正手順への対応です
     */
    @Bean
    public Map<PolarizingElement, He3CellCalibration> he3CellCalibrations(
            He3TransmissionFitter fitter, TransmissionFunctionFactory factory) {
        Map<PolarizingElement, He3CellCalibration> out = new EnumMap<>(PolarizingElement.class);
        putCalibration(out, PolarizingElement.POLARIZER, p.getPolarizer(), fitter, factory);
        putCalibration(out, PolarizingElement.ANALYZER, p.getAnalyzer(), fitter, factory);
        return out;
    }

    /**
     * 偏極補正エンジンを生成します。
     *
     * <p>
     * 検光子が無効な場合は半偏極構成のエンジンになります。
     * </p>
     *
     * @param factory 透過率関数の生成ロジックです
     * @return 補正エンジンです
     * @throws IllegalStateException 偏極子が無効に設定された場合に発生します
     */
    @Bean
    public PolarizationCorrectionEngine polarizationCorrectionEngine(
            TransmissionFunctionFactory factory) {
        PolarizationProperties.Element pol = p.getPolarizer();
        if (!pol.isEnabled()) {
            throw new IllegalStateException("polarizer.enabled は false にできません（偏極子は必須です）");
        }
        FlipperEfficiency polFlipper = new FlipperEfficiency(pol.getFlipperEfficiency());
        if (!p.getAnalyzer().isEnabled()) {
            return PolarizationCorrectionEngine.halfPolarized(factory.create("polarizer", pol),
                    polFlipper);
        }
        PolarizationProperties.Element ana = p.getAnalyzer();
        return new PolarizationCorrectionEngine(factory.create("polarizer", pol),
                factory.create("analyzer", ana), polFlipper,
                new FlipperEfficiency(ana.getFlipperEfficiency()));
    }

    private static void putCalibration(Map<PolarizingElement, He3CellCalibration> out,
            PolarizingElement element, PolarizationProperties.Element e,
            He3TransmissionFitter fitter, TransmissionFunctionFactory factory) {
        if (!e.isEnabled() || e.getModel() != PolarizationProperties.ElementModel.HE3) {
            return;
        }
        PolarizationProperties.He3 h = e.getHe3();
        out.put(element, new He3CellCalibration(fitter, factory.cellParameters(h),
                h.getTransmissionEmptyGlass(), h.getOpacitySource(), h.getIncomingBeam()));
    }
}
