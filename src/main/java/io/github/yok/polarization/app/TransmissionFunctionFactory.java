package io.github.yok.polarization.app;

import io.github.yok.polarization.core.he3.He3CellParameters;
import io.github.yok.polarization.core.he3.Temperature;
import io.github.yok.polarization.core.transmission.EfficiencyLookupTable;
import io.github.yok.polarization.core.transmission.He3TransmissionFunction;
import io.github.yok.polarization.core.transmission.PolarizationDecayFunction;
import io.github.yok.polarization.core.transmission.SecondDegreePolynomialEfficiency;
import io.github.yok.polarization.core.transmission.SupermirrorEfficiencyFunction;
import io.github.yok.polarization.core.transmission.SupermirrorTransmissionFunction;
import io.github.yok.polarization.core.transmission.TransmissionFunction;
import java.nio.file.Paths;
import lombok.extern.slf4j.Slf4j;

/**
 * 素子の設定値から透過率関数を生成するクラスです。
 *
 * <p>
 * He3 はセルパラメータから求めた不透明度と、設定した (C, T1) で透過率関数を組み立てます。
 * スーパーミラーは効率表（指定時）または2次多項式の効率を使います。
 * </p>
 */
@Slf4j
public final class TransmissionFunctionFactory {

    /**
     * 素子の設定から透過率関数を生成します。
     *
     * @param name ログ用の素子名です
     * @param element 素子の設定です
     * @return 透過率関数です
     * @throws IllegalArgumentException 設定値が不正な場合に発生します
     */
    public TransmissionFunction create(String name, PolarizationProperties.Element element) {
        if (element.getModel() == PolarizationProperties.ElementModel.HE3) {
            PolarizationProperties.He3 h = element.getHe3();
            He3CellParameters cell = cellParameters(h);
            He3TransmissionFunction f = new He3TransmissionFunction(cell.opacityFunction(),
                    new PolarizationDecayFunction(h.getC(), h.getT1()),
                    h.getTransmissionEmptyGlass());
            log.info("{}: He3 透過率関数を生成しました。opacity0={} 1/Å", name,
                    f.getOpacityFunction().getOpacity0());
            return f;
        }
        return new SupermirrorTransmissionFunction(efficiency(name, element.getSupermirror()));
    }

    /**
     * He3 の設定からセルパラメータを生成します。温度は明示的にケルビンへ換算します。
     *
     * @param h He3 の設定です
     * @return セルパラメータです
     */
    public He3CellParameters cellParameters(PolarizationProperties.He3 h) {
        Temperature temperature =
                new Temperature(h.getTemperature(), h.getTemperatureUnit()).toKelvin();
        return new He3CellParameters(h.getPressure(), h.getPressureUnit(), h.getLength(),
                h.getLengthUnit(), temperature);
    }

    private SupermirrorEfficiencyFunction efficiency(String name,
            PolarizationProperties.Supermirror s) {
        if (s.getLookupTable() != null && !s.getLookupTable().isEmpty()) {
            log.info("{}: スーパーミラー効率表を読み込みます。file={}", name, s.getLookupTable());
            return EfficiencyLookupTable.fromFile(Paths.get(s.getLookupTable()),
                    s.getWavelengthColumn(), s.getEfficiencyColumn());
        }
        return new SecondDegreePolynomialEfficiency(s.getA(), s.getB(), s.getC());
    }
}
