package io.github.yok.polarization.core.he3;

import com.google.common.base.Preconditions;
import io.github.yok.polarization.core.directbeam.BeamData;
import io.github.yok.polarization.core.transmission.He3TransmissionFunction;
import io.github.yok.polarization.core.transmission.OpacityFunction;
import java.util.List;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

/**
 * 1つの He3 セルについて、設定に応じて不透明度と透過率関数を求める手順をまとめたクラスです。
 *
 * <p>
 * 不透明度は {@link OpacitySource#IN_SITU} ならセルパラメータから、{@link OpacitySource#EX_SITU}
 * なら減偏極セルの透過率からフィットします（セルパラメータの値を初期値に使います）。
 * 減衰 (C, T1) は入射ビームの偏極状態に応じたモデルでフィットします。
 * </p>
 */
@Slf4j
@Getter
@ToString
public final class He3CellCalibration {

    /**
     * フィッタです。
     */
    @ToString.Exclude
    private final He3TransmissionFitter fitter;

    /**
     * セルパラメータです。
     */
    private final He3CellParameters cellParameters;

    /**
     * 空ガラスの透過率 T_E です。
     */
    private final double transmissionEmptyGlass;

    /**
     * 不透明度の求め方です。
     */
    private final OpacitySource opacitySource;

    /**
     * 校正測定時の入射ビームの偏極状態です。
     */
    private final IncomingBeam incomingBeam;

    /**
     * 校正手順を生成します。
     *
     * @param fitter フィッタです
     * @param cellParameters セルパラメータです
     * @param transmissionEmptyGlass 空ガラスの透過率 T_E です
     * @param opacitySource 不透明度の求め方です
     * @param incomingBeam 入射ビームの偏極状態です
     * @throws NullPointerException 引数が null の場合に発生します
     */
    public He3CellCalibration(He3TransmissionFitter fitter, He3CellParameters cellParameters,
            double transmissionEmptyGlass, OpacitySource opacitySource,
            IncomingBeam incomingBeam) {
        this.fitter = Preconditions.checkNotNull(fitter, "fitter が null です。");
        this.cellParameters = Preconditions.checkNotNull(cellParameters, "cellParameters が null です。");
        this.transmissionEmptyGlass = transmissionEmptyGlass;
        this.opacitySource = Preconditions.checkNotNull(opacitySource, "opacitySource が null です。");
        this.incomingBeam = Preconditions.checkNotNull(incomingBeam, "incomingBeam が null です。");
    }

    /**
     * 不透明度関数を求めます。
     *
     * @param depolarizedTransmissionFraction 減偏極セルの透過率です（IN_SITU の場合は null 可）
     * @return 不透明度関数です
     * @throws IllegalArgumentException EX_SITU なのに透過率が無い場合に発生します
     */
    public OpacityFunction opacityFunction(BeamData depolarizedTransmissionFraction) {
        double estimate = cellParameters.opacity0();
        if (opacitySource == OpacitySource.IN_SITU) {
            log.info("セルパラメータから不透明度を求めました。opacity0={}", estimate);
            return new OpacityFunction(estimate);
        }
        Preconditions.checkArgument(depolarizedTransmissionFraction != null,
                "EX_SITU では減偏極セルの透過率が必要です。");
        return fitter.fitOpacity(depolarizedTransmissionFraction, transmissionEmptyGlass, estimate)
                .getFunction();
    }

    /**
     * 不透明度と減衰をまとめて求め、透過率関数を返します。
     *
     * <p>
     * {@link IncomingBeam#UNPOLARIZED} ではデータは1件で、タグは参照しません。
     * {@link IncomingBeam#POLARIZED} では全データに plus/minus のタグが必要で、plus と minus の両方が揃っている必要があります。
     * </p>
     *
     * @param depolarizedTransmissionFraction 減偏極セルの透過率です（IN_SITU の場合は null 可）
     * @param transmissionFractions 校正測定の透過率です
     * @return フィット結果です
     * @throws IllegalArgumentException データの件数やタグが設定と一致しない場合に発生します
     */
    public He3FitResult<He3TransmissionFunction> calibrate(
            BeamData depolarizedTransmissionFraction,
            List<TaggedTransmissionFraction> transmissionFractions) {
        Preconditions.checkNotNull(transmissionFractions, "transmissionFractions が null です。");
        OpacityFunction opacity = opacityFunction(depolarizedTransmissionFraction);
        if (incomingBeam == IncomingBeam.UNPOLARIZED) {
            Preconditions.checkArgument(transmissionFractions.size() == 1,
                    "非偏極入射の校正では透過率データは1件です。件数=%s", transmissionFractions.size());
            return fitter.fitUnpolarizedIncoming(
                    transmissionFractions.get(0).getTransmissionFraction(), opacity,
                    transmissionEmptyGlass);
        }
        return fitter.fitPolarizedIncoming(transmissionFractions, opacity, transmissionEmptyGlass);
    }
}
