package io.github.yok.polarization.core.transmission;

import com.google.common.base.Preconditions;
import io.github.yok.polarization.core.model.ChannelData;
import io.github.yok.polarization.core.model.PlusMinus;
import lombok.Value;

/**
 * スーパーミラーの透過率関数 {@code T(λ, ±) = 0.5 * (1 ± ε(λ))} です。
 *
 * <p>
 * スーパーミラーは静的なデバイスなので時刻には依存しません。
 * </p>
 */
@Value
public class SupermirrorTransmissionFunction implements TransmissionFunction {

    /**
     * 偏極効率 ε(λ) です。
     */
    SupermirrorEfficiencyFunction efficiencyFunction;

    /**
     * スーパーミラー透過率関数を生成します。
     *
     * @param efficiencyFunction 偏極効率です
     * @throws NullPointerException null の場合に発生します
     */
    public SupermirrorTransmissionFunction(SupermirrorEfficiencyFunction efficiencyFunction) {
        this.efficiencyFunction =
                Preconditions.checkNotNull(efficiencyFunction, "efficiencyFunction が null です。");
    }

    /**
     * 1点における透過率を返します。
     *
     * @param wavelength 波長（Å）です
     * @param plusMinus 固有チャネルです
     * @return 透過率です
     * @throws IllegalArgumentException 効率が [-1, 1] の範囲外の場合に発生します
     */
    public double transmission(double wavelength, PlusMinus plusMinus) {
        double eps = efficiencyFunction.efficiency(wavelength);
        if (!(Math.abs(eps) <= 1.0)) {
            throw new IllegalArgumentException(
                    "スーパーミラー効率は [-1, 1] の範囲である必要があります。λ=" + wavelength + ", ε=" + eps);
        }
        return 0.5 * (1.0 + plusMinus.sign() * eps);
    }

    @Override
    public double[] apply(ChannelData data, PlusMinus plusMinus) {
        Preconditions.checkNotNull(plusMinus, "plusMinus が null です。");
        double[] wavelength = data.coordinate(ChannelData.WAVELENGTH);
        double[] out = new double[wavelength.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = transmission(wavelength[i], plusMinus);
        }
        return out;
    }
}
