package io.github.yok.polarization.app;

import io.github.yok.polarization.core.correction.PolarizationCorrection;
import io.github.yok.polarization.core.correction.PolarizationCorrectionEngine;
import io.github.yok.polarization.core.he3.He3CellCalibration;
import io.github.yok.polarization.core.model.ChannelData;
import io.github.yok.polarization.core.model.PlusMinus;
import io.github.yok.polarization.core.model.PolarizingElement;
import io.github.yok.polarization.core.model.SpinChannel;
import io.github.yok.polarization.core.transmission.TransmissionFunction;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * 設定した偏極素子の透過率と補正重みを表示する CLI です。
 *
 * <p>
 * 表示波長ごとに、各素子の T+、T-、偏極能 (T+ - T-)/(T+ + T-) と、++ 測定チャネルの補正重みを出力します。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class PolarizationCliRunner implements CommandLineRunner {

    /**
     * 偏極補正の設定値（polarization.*）です。
     */
    private final PolarizationProperties properties;

    /**
     * 偏極補正エンジンです。
     */
    private final PolarizationCorrectionEngine engine;

    /**
     * He3 セルの校正手順です。
     */
    private final Map<PolarizingElement, He3CellCalibration> he3CellCalibrations;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== polarization-correction start ===");
        System.out.print(properties.toMultilineString());

        List<Double> wavelengths = properties.getReport().getWavelengths();
        if (wavelengths == null || wavelengths.isEmpty()) {
            throw new IllegalStateException("report.wavelengths は必須です（波長の一覧を指定してください）");
        }
        double[] lambda = new double[wavelengths.size()];
        for (int i = 0; i < lambda.length; i++) {
            Double w = wavelengths.get(i);
            if (w == null) {
                throw new IllegalStateException("report.wavelengths に null が含まれています");
            }
            lambda[i] = w;
        }
        double[] time = new double[] {properties.getReport().getTime()};
        ChannelData points =
                ChannelData.withWavelengthAndTime(new double[lambda.length], lambda, time);

        for (Map.Entry<PolarizingElement, He3CellCalibration> e : he3CellCalibrations.entrySet()) {
            He3CellCalibration c = e.getValue();
            System.out.println("He3 校正: " + e.getKey() + " opacity0="
                    + fmt5(c.getCellParameters().opacity0()) + " 1/Å, 不透明度="
                    + c.getOpacitySource() + ", 入射ビーム=" + c.getIncomingBeam());
        }

        printElement("polarizer", engine.getPolarizer(), points, lambda);
        if (engine.hasAnalyzer()) {
            printElement("analyzer", engine.getAnalyzer(), points, lambda);
            PolarizationCorrection upup =
                    engine.computePolarizationCorrection(points, SpinChannel.UP_UP);
            System.out.println("=== ++ 測定チャネルの補正重み ===");
            for (int i = 0; i < lambda.length; i++) {
                System.out.println("λ=" + fmt5(lambda[i]) + ": ++=" + fmt5(upup.getUpup()[i])
                        + ", +-=" + fmt5(upup.getUpdown()[i]) + ", -+="
                        + fmt5(upup.getDownup()[i]) + ", --=" + fmt5(upup.getDowndown()[i]));
            }
        } else {
            System.out.println("analyzer: 無効（半偏極構成）");
        }
    }

    private static void printElement(String name, TransmissionFunction f, ChannelData points,
            double[] lambda) {
        double[] plus = f.apply(points, PlusMinus.PLUS);
        double[] minus = f.apply(points, PlusMinus.MINUS);
        System.out.println("=== " + name + " の透過率 ===");
        for (int i = 0; i < lambda.length; i++) {
            double power = (plus[i] - minus[i]) / (plus[i] + minus[i]);
            System.out.println("λ=" + fmt5(lambda[i]) + ": T+=" + fmt5(plus[i]) + ", T-="
                    + fmt5(minus[i]) + ", 偏極能=" + fmt5(power));
        }
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}
