package io.github.yok.polarization.core.transmission;

import com.google.common.base.Preconditions;
import io.github.yok.polarization.core.model.ChannelData;
import io.github.yok.polarization.core.model.PlusMinus;
import lombok.Value;

/**
 * He3 セルの透過率関数です。
 *
 * <p>
 * {@code T(t, λ, ±) = T_E * exp(-O(λ) * (1 ± P(t)))} を評価します。T_E は空ガラスの透過率です。
 * 評価には {@link ChannelData#WAVELENGTH} と {@link ChannelData#TIME} の座標が必要です。
 * </p>
 */
@Value
public class He3TransmissionFunction implements TransmissionFunction {

    /**
     * 不透明度関数です。
     */
    OpacityFunction opacityFunction;

    /**
     * 偏極率の減衰関数です。
     */
    PolarizationDecayFunction polarizationFunction;

    /**
     * 空ガラスの透過率 T_E です。
     */
    double transmissionEmptyGlass;

    /**
     * He3 透過率関数を生成します。
     *
     * @param opacityFunction 不透明度関数です
     * @param polarizationFunction 偏極率の減衰関数です
     * @param transmissionEmptyGlass 空ガラスの透過率（正の有限値）です
     * @throws NullPointerException 関数が null の場合に発生します
     * @throws IllegalArgumentException 透過率が正の有限値でない場合に発生します
     */
    public He3TransmissionFunction(OpacityFunction opacityFunction,
            PolarizationDecayFunction polarizationFunction, double transmissionEmptyGlass) {
        this.opacityFunction =
                Preconditions.checkNotNull(opacityFunction, "opacityFunction が null です。");
        this.polarizationFunction = Preconditions.checkNotNull(polarizationFunction,
                "polarizationFunction が null です。");
        Preconditions.checkArgument(
                transmissionEmptyGlass > 0.0 && Double.isFinite(transmissionEmptyGlass),
                "空ガラスの透過率は正の有限値である必要があります。T_E=%s", transmissionEmptyGlass);
        this.transmissionEmptyGlass = transmissionEmptyGlass;
    }

    /**
     * 1点における透過率を返します。
     *
     * @param time 時刻（s）です
     * @param wavelength 波長（Å）です
     * @param plusMinus 固有チャネルです
     * @return 透過率です
     */
    public double transmission(double time, double wavelength, PlusMinus plusMinus) {
        double opacity = opacityFunction.opacity(wavelength);
        double polarization = plusMinus.sign() * polarizationFunction.polarization(time);
        return transmissionEmptyGlass * Math.exp(-opacity * (1.0 + polarization));
    }

    /**
     * 非偏極の入射ビームに対する透過率 {@code T_E * exp(-O) * cosh(O * P)} を返します。
     *
     * @param time 時刻（s）です
     * @param wavelength 波長（Å）です
     * @return 透過率です
     */
    public double unpolarizedTransmission(double time, double wavelength) {
        double opacity = opacityFunction.opacity(wavelength);
        double polarization = polarizationFunction.polarization(time);
        return transmissionEmptyGlass * Math.exp(-opacity) * Math.cosh(opacity * polarization);
    }

    @Override
    public double[] apply(ChannelData data, PlusMinus plusMinus) {
        Preconditions.checkNotNull(plusMinus, "plusMinus が null です。");
        if (!data.hasCoordinate(ChannelData.TIME)) {
            throw new IllegalArgumentException("He3 透過率の評価には時刻座標が必要です。座標="
                    + data.coordinateNames());
        }
        double[] wavelength = data.coordinate(ChannelData.WAVELENGTH);
        double[] time = data.coordinate(ChannelData.TIME);
        double[] out = new double[data.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = transmission(time[i], wavelength[i], plusMinus);
        }
        return out;
    }
}
