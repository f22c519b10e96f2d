package io.github.yok.polarization.core.correction;

import com.google.common.base.Preconditions;
import io.github.yok.polarization.core.model.ChannelData;
import io.github.yok.polarization.core.model.PolarizingElement;
import io.github.yok.polarization.core.model.Spin;
import io.github.yok.polarization.core.model.SpinChannel;
import io.github.yok.polarization.core.transmission.TransmissionFunction;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 偏極子と検光子の透過率・フリッパー効率から、測定チャネルの偏極補正を行うクラスです。
 *
 * <p>
 * 全体の転送行列は偏極子と検光子の 2x2 行列のクロネッカー積なので、逆行列も素子ごとに分離できます。
 * 4x4 行列は作らず、測定チャネルごとに4つの補正重みを求め、その寄与を足し合わせて補正結果を得ます。
 * </p>
 *
 * <p>
 * 検光子の無い構成（{@link #halfPolarized}）では偏極子だけの2チャネルの補正になります。
 * インスタンスは不変で、複数のチャネルから同時に使えます。
 * </p>
 */
@Slf4j
@Getter
public final class PolarizationCorrectionEngine {

    /**
     * 偏極子の透過率関数です。
     */
    private final TransmissionFunction polarizer;

    /**
     * 検光子の透過率関数です（検光子が無い場合は null）。
     */
    private final TransmissionFunction analyzer;

    /**
     * 偏極子側のフリッパー効率です。
     */
    private final FlipperEfficiency polarizerFlipper;

    /**
     * 検光子側のフリッパー効率です。
     */
    private final FlipperEfficiency analyzerFlipper;

    /**
     * 偏極子と検光子を持つ構成の補正エンジンを生成します。
     *
     * @param polarizer 偏極子の透過率関数です
     * @param analyzer 検光子の透過率関数です
     * @param polarizerFlipper 偏極子側のフリッパー効率です
     * @param analyzerFlipper 検光子側のフリッパー効率です
     * @throws NullPointerException 引数が null の場合に発生します
     */
    public PolarizationCorrectionEngine(TransmissionFunction polarizer,
            TransmissionFunction analyzer, FlipperEfficiency polarizerFlipper,
            FlipperEfficiency analyzerFlipper) {
        this.polarizer = Preconditions.checkNotNull(polarizer, "polarizer が null です。");
        this.analyzer = Preconditions.checkNotNull(analyzer, "analyzer が null です。");
        this.polarizerFlipper =
                Preconditions.checkNotNull(polarizerFlipper, "polarizerFlipper が null です。");
        this.analyzerFlipper =
                Preconditions.checkNotNull(analyzerFlipper, "analyzerFlipper が null です。");
    }

    private PolarizationCorrectionEngine(TransmissionFunction polarizer,
            FlipperEfficiency polarizerFlipper) {
        this.polarizer = Preconditions.checkNotNull(polarizer, "polarizer が null です。");
        this.analyzer = null;
        this.polarizerFlipper =
                Preconditions.checkNotNull(polarizerFlipper, "polarizerFlipper が null です。");
        this.analyzerFlipper = FlipperEfficiency.IDEAL;
    }

    /**
     * 検光子の無い構成の補正エンジンを生成します。
     *
     * @param polarizer 偏極子の透過率関数です
     * @param polarizerFlipper 偏極子側のフリッパー効率です
     * @return 補正エンジンです
     */
    public static PolarizationCorrectionEngine halfPolarized(TransmissionFunction polarizer,
            FlipperEfficiency polarizerFlipper) {
        return new PolarizationCorrectionEngine(polarizer, polarizerFlipper);
    }

    /**
     * 検光子を持つかどうかを返します。
     *
     * @return 持つ場合は true です
     */
    public boolean hasAnalyzer() {
        return analyzer != null;
    }

    /**
     * 測定チャネルの座標上で、指定した素子の補正係数を求めます。
     *
     * @param channel 測定チャネルです
     * @param element 偏極素子です
     * @return 補正係数です
     * @throws IllegalStateException 検光子が無い構成で検光子を指定した場合に発生します
     * @throws SingularCorrectionException 素子の転送行列が特異な場合に発生します
     */
    public CorrectionCoefficients computeCorrectionCoefficients(ChannelData channel,
            PolarizingElement element) {
        Preconditions.checkNotNull(element, "element が null です。");
        return CorrectionCoefficients.compute(channel, transmissionOf(element));
    }

    /**
     * 1つの測定チャネルについて、補正後の4チャネルへの補正重みを求めます。
     *
     * @param channel 測定チャネルのデータです（座標のみを使います）
     * @param spinChannel 測定チャネルの (偏極子スピン, 検光子スピン) です
     * @return 補正重みです
     * @throws IllegalStateException 検光子が無い構成の場合に発生します
     * @throws SingularCorrectionException 素子の転送行列が特異な場合に発生します
     */
    public PolarizationCorrection computePolarizationCorrection(ChannelData channel,
            SpinChannel spinChannel) {
        Preconditions.checkNotNull(spinChannel, "spinChannel が null です。");
        CorrectionCoefficients a = computeCorrectionCoefficients(channel, PolarizingElement.ANALYZER);
        CorrectionCoefficients p =
                computeCorrectionCoefficients(channel, PolarizingElement.POLARIZER);

        // 1) 検光子側のフリッパー
        SpinPair analyzerPair = FlipperModel.of(analyzerFlipper,
                spinChannel.spinOf(PolarizingElement.ANALYZER))
                .fromLeft(a.diag(), a.offDiag());

        // 2) 外積
        double[] pDiag = p.diag();
        double[] pOff = p.offDiag();
        double[] aUp = analyzerPair.getUp();
        double[] aDown = analyzerPair.getDown();
        int n = pDiag.length;
        double[] upup = new double[n];
        double[] updown = new double[n];
        double[] downup = new double[n];
        double[] downdown = new double[n];
        for (int i = 0; i < n; i++) {
            upup[i] = pDiag[i] * aUp[i];
            updown[i] = pDiag[i] * aDown[i];
            downup[i] = pOff[i] * aUp[i];
            downdown[i] = pOff[i] * aDown[i];
        }

        // 3) 偏極子側のフリッパー（偏極子軸に沿った組ごと）
        FlipperModel polarizerModel =
                FlipperModel.of(polarizerFlipper, spinChannel.spinOf(PolarizingElement.POLARIZER));
        SpinPair analyzerUp = polarizerModel.fromRight(upup, downup);
        SpinPair analyzerDown = polarizerModel.fromRight(updown, downdown);

        log.debug("補正重みを計算しました。channel={}、要素数={}", spinChannel.label(), n);
        return new PolarizationCorrection(analyzerUp.getUp(), analyzerDown.getUp(),
                analyzerUp.getDown(), analyzerDown.getDown());
    }

    /**
     * 測定チャネルの強度に4つの補正重みを掛け、補正後の4チャネルへの寄与を返します。
     *
     * @param channel 測定チャネルのデータです
     * @param correction 補正重みです
     * @return 寄与です
     */
    public PolarizationCorrectedData computePolarizationCorrectedData(ChannelData channel,
            PolarizationCorrection correction) {
        Preconditions.checkNotNull(channel, "channel が null です。");
        Preconditions.checkNotNull(correction, "correction が null です。");
        return new PolarizationCorrectedData(channel.times(correction.getUpup()),
                channel.times(correction.getUpdown()), channel.times(correction.getDownup()),
                channel.times(correction.getDowndown()));
    }

    /**
     * 4つの測定チャネルをすべて補正し、寄与を足し合わせた結果を返します。
     *
     * @param channels 測定チャネルのデータです（4チャネルすべてが必要）
     * @return 補正結果です
     * @throws IllegalArgumentException チャネルが欠けている場合に発生します
     */
    public PolarizationCorrectedData correct(Map<SpinChannel, ChannelData> channels) {
        Preconditions.checkNotNull(channels, "channels が null です。");
        List<PolarizationCorrectedData> contributions = new ArrayList<>(4);
        for (SpinChannel sc : SpinChannel.all()) {
            ChannelData data = channels.get(sc);
            Preconditions.checkArgument(data != null, "測定チャネル %s がありません。", sc.label());
            contributions.add(
                    computePolarizationCorrectedData(data, computePolarizationCorrection(data, sc)));
        }
        return PolarizationCorrectedData.sum(contributions);
    }

    /**
     * 検光子の無い構成で、1つの測定チャネルの補正重み {up, down} を求めます。
     *
     * @param channel 測定チャネルのデータです（座標のみを使います）
     * @param polarizerSpin 測定時の偏極子スピンです
     * @return 補正重みです
     * @throws SingularCorrectionException 偏極子の転送行列が特異な場合に発生します
     */
    public HalfPolarizedCorrection computeHalfPolarizedCorrection(ChannelData channel,
            Spin polarizerSpin) {
        Preconditions.checkNotNull(polarizerSpin, "polarizerSpin が null です。");
        CorrectionCoefficients p =
                computeCorrectionCoefficients(channel, PolarizingElement.POLARIZER);
        SpinPair pair = FlipperModel.of(polarizerFlipper, polarizerSpin).fromRight(p.diag(),
                p.offDiag());
        return new HalfPolarizedCorrection(pair.getUp(), pair.getDown());
    }

    /**
     * 検光子の無い構成で、測定チャネルの強度に補正重みを掛けた寄与を返します。
     *
     * @param channel 測定チャネルのデータです
     * @param correction 補正重みです
     * @return 寄与です
     */
    public HalfPolarizedCorrectedData computeHalfPolarizedCorrectedData(ChannelData channel,
            HalfPolarizedCorrection correction) {
        Preconditions.checkNotNull(channel, "channel が null です。");
        Preconditions.checkNotNull(correction, "correction が null です。");
        return new HalfPolarizedCorrectedData(channel.times(correction.getUp()),
                channel.times(correction.getDown()));
    }

    /**
     * 検光子の無い構成で、up/down の測定チャネルを補正し、寄与を足し合わせた結果を返します。
     *
     * @param channels 測定チャネルのデータです（UP と DOWN が必要）
     * @return 補正結果です
     * @throws IllegalArgumentException チャネルが欠けている場合に発生します
     */
    public HalfPolarizedCorrectedData correctHalfPolarized(Map<Spin, ChannelData> channels) {
        Preconditions.checkNotNull(channels, "channels が null です。");
        HalfPolarizedCorrectedData total = null;
        for (Spin spin : Spin.values()) {
            ChannelData data = channels.get(spin);
            Preconditions.checkArgument(data != null, "測定チャネル %s がありません。", spin);
            HalfPolarizedCorrectedData contribution = computeHalfPolarizedCorrectedData(data,
                    computeHalfPolarizedCorrection(data, spin));
            total = total == null ? contribution : total.plus(contribution);
        }
        return total;
    }

    private TransmissionFunction transmissionOf(PolarizingElement element) {
        if (element == PolarizingElement.POLARIZER) {
            return polarizer;
        }
        if (analyzer == null) {
            throw new IllegalStateException("検光子の無い構成では検光子の補正係数は求められません。");
        }
        return analyzer;
    }
}
