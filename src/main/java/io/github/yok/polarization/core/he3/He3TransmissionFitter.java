package io.github.yok.polarization.core.he3;

import com.google.common.base.Preconditions;
import io.github.yok.polarization.core.directbeam.BeamData;
import io.github.yok.polarization.core.fit.CurveFitter;
import io.github.yok.polarization.core.fit.FitConvergenceException;
import io.github.yok.polarization.core.fit.FitModel;
import io.github.yok.polarization.core.fit.FitResult;
import io.github.yok.polarization.core.model.PlusMinus;
import io.github.yok.polarization.core.transmission.He3TransmissionFunction;
import io.github.yok.polarization.core.transmission.OpacityFunction;
import io.github.yok.polarization.core.transmission.PolarizationDecayFunction;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 直接ビームの透過率データに He3 セルのモデルをフィットするクラスです。
 *
 * <p>
 * 以下の3つのフィットを提供します。
 * </p>
 * <ul>
 * <li>不透明度: {@code T_E * exp(-opacity0 * λ)} を opacity0 についてフィットします。</li>
 * <li>非偏極入射: {@code T_E * exp(-O) * cosh(O * P(t))} を (C, T1) についてフィットします。</li>
 * <li>偏極入射: {@code T_E * exp(-O * (1 ± P(t)))} を plus/minus のタグ付きデータ全体で (C, T1) についてフィットします。</li>
 * </ul>
 *
 * <p>
 * 波長がビン境界で与えられた場合はビン中点でフィットします。フィットが収束しない場合や、物理的に不正なパラメータ
 * （|C| &gt; 1、T1 &lt;= 0、opacity0 &lt;= 0）が得られた場合は {@link FitConvergenceException} を送出し、初期値を返すことはしません。
 * </p>
 */
@Slf4j
@Getter
public final class He3TransmissionFitter {

    /**
     * 曲線フィットの実装です。
     */
    private final CurveFitter curveFitter;

    /**
     * 初期偏極率 C の初期値です。
     */
    private final double initialC;

    /**
     * 減衰時間 T1（s）の初期値です。
     */
    private final double initialT1;

    /**
     * フィッタを生成します。
     *
     * @param curveFitter 曲線フィットの実装です
     * @param initialC 初期偏極率 C の初期値です
     * @param initialT1 減衰時間 T1（s）の初期値です
     * @throws IllegalArgumentException 初期値が範囲外の場合に発生します
     */
    public He3TransmissionFitter(CurveFitter curveFitter, double initialC, double initialT1) {
        this.curveFitter = Preconditions.checkNotNull(curveFitter, "curveFitter が null です。");
        Preconditions.checkArgument(Math.abs(initialC) <= 1.0, "C の初期値は [-1, 1] の範囲です。C=%s",
                initialC);
        Preconditions.checkArgument(initialT1 > 0.0, "T1 の初期値は正の値です。T1=%s", initialT1);
        this.initialC = initialC;
        this.initialT1 = initialT1;
    }

    /**
     * 減偏極したセルの透過率から不透明度関数をフィットします。
     *
     * @param transmissionFraction 減偏極セルの透過率です（時刻はあってもなくてもよい）
     * @param transmissionEmptyGlass 空ガラスの透過率 T_E です
     * @param opacity0InitialGuess opacity0 の初期値（通常はセルパラメータから求めた値）です
     * @return フィット結果です
     * @throws FitConvergenceException 収束しない、または opacity0 が正でない場合に発生します
     */
    public He3FitResult<OpacityFunction> fitOpacity(BeamData transmissionFraction,
            double transmissionEmptyGlass, double opacity0InitialGuess) {
        Preconditions.checkNotNull(transmissionFraction, "transmissionFraction が null です。");
        checkEmptyGlass(transmissionEmptyGlass);

        double[] lambda = transmissionFraction.wavelengthMidpoints();
        List<double[]> xs = new ArrayList<>();
        List<Double> ys = new ArrayList<>();
        for (int r = 0; r < transmissionFraction.rows(); r++) {
            for (int c = 0; c < transmissionFraction.columns(); c++) {
                xs.add(new double[] {lambda[c]});
                ys.add(transmissionFraction.get(r, c));
            }
        }

        log.info("不透明度のフィットを開始します。T_E={}、opacity0 初期値={}", fmt5(transmissionEmptyGlass),
                fmt5(opacity0InitialGuess));
        FitResult fit = curveFitter.fit(new OpacityModel(transmissionEmptyGlass),
                xs.toArray(new double[0][]), toArray(ys), new double[] {opacity0InitialGuess});

        double opacity0 = fit.getParameters()[0];
        if (!(opacity0 > 0.0)) {
            throw new FitConvergenceException("フィットした opacity0 が正ではありません: " + opacity0);
        }
        log.info("不透明度のフィットが完了しました。opacity0={}、分散={}", fmt5(opacity0),
                fit.getVariances()[0]);
        return new He3FitResult<>(new OpacityFunction(opacity0), fit.getVariances(),
                fit.getIterations());
    }

    /**
     * 非偏極ビーム入射で測った透過率から、偏極率の減衰 (C, T1) をフィットします。
     *
     * @param transmissionFraction 透過率です（時刻座標が必要）
     * @param opacityFunction 不透明度関数です
     * @param transmissionEmptyGlass 空ガラスの透過率 T_E です
     * @return フィット結果（分散は C, T1 の順）です
     * @throws IllegalArgumentException 時刻座標が無い場合に発生します
     * @throws FitConvergenceException 収束しない、またはパラメータが範囲外の場合に発生します
     */
    public He3FitResult<He3TransmissionFunction> fitUnpolarizedIncoming(
            BeamData transmissionFraction, OpacityFunction opacityFunction,
            double transmissionEmptyGlass) {
        Preconditions.checkNotNull(transmissionFraction, "transmissionFraction が null です。");
        Preconditions.checkNotNull(opacityFunction, "opacityFunction が null です。");
        checkEmptyGlass(transmissionEmptyGlass);
        Preconditions.checkArgument(transmissionFraction.hasTime(),
                "偏極率の減衰フィットには時刻座標が必要です。");

        List<double[]> xs = new ArrayList<>();
        List<Double> ys = new ArrayList<>();
        collect(transmissionFraction, 0.0, xs, ys);

        log.info("非偏極入射モデルで (C, T1) のフィットを開始します。初期値 C={}、T1={}", fmt5(initialC),
                fmt5(initialT1));
        FitResult fit = curveFitter.fit(
                new UnpolarizedIncomingModel(opacityFunction, transmissionEmptyGlass),
                xs.toArray(new double[0][]), toArray(ys), new double[] {initialC, initialT1});
        return toTransmissionResult(fit, opacityFunction, transmissionEmptyGlass);
    }

    /**
     * 偏極ビーム入射で測った plus/minus タグ付きの透過率から、偏極率の減衰 (C, T1) を全データ同時にフィットします。
     *
     * @param transmissionFractions タグ付きの透過率の一覧です（各データに時刻座標が必要）
     * @param opacityFunction 不透明度関数です
     * @param transmissionEmptyGlass 空ガラスの透過率 T_E です
     * @return フィット結果（分散は C, T1 の順）です
     * @throws IllegalArgumentException 一覧が空、タグが無い、時刻座標が無いデータがある、または plus/minus の一方が無い場合に発生します
     * @throws FitConvergenceException 収束しない、またはパラメータが範囲外の場合に発生します
     */
    public He3FitResult<He3TransmissionFunction> fitPolarizedIncoming(
            List<TaggedTransmissionFraction> transmissionFractions,
            OpacityFunction opacityFunction, double transmissionEmptyGlass) {
        Preconditions.checkNotNull(transmissionFractions, "transmissionFractions が null です。");
        Preconditions.checkNotNull(opacityFunction, "opacityFunction が null です。");
        Preconditions.checkArgument(!transmissionFractions.isEmpty(), "透過率データがありません。");
        checkEmptyGlass(transmissionEmptyGlass);

        List<double[]> xs = new ArrayList<>();
        List<Double> ys = new ArrayList<>();
        Set<PlusMinus> seen = EnumSet.noneOf(PlusMinus.class);
        for (int i = 0; i < transmissionFractions.size(); i++) {
            TaggedTransmissionFraction tagged = transmissionFractions.get(i);
            Preconditions.checkArgument(tagged != null && tagged.getTransmissionFraction() != null,
                    "透過率データ[%s] が null です。", i);
            BeamData data = tagged.getTransmissionFraction();
            if (tagged.getPlusMinus() == null) {
                String when = data.hasTime() ? "（先頭時刻 t=" + fmt5(data.time(0)) + " s）" : "";
                throw new IllegalArgumentException(
                        "偏極入射フィットの透過率データ[" + i + "]" + when + " に plus/minus のタグがありません。");
            }
            Preconditions.checkArgument(data.hasTime(), "透過率データ[%s]（%s）に時刻座標がありません。", i,
                    tagged.getPlusMinus());
            collect(data, tagged.getPlusMinus().sign(), xs, ys);
            seen.add(tagged.getPlusMinus());
        }
        for (PlusMinus pm : PlusMinus.values()) {
            Preconditions.checkArgument(seen.contains(pm),
                    "偏極入射フィットには plus と minus の両方の透過率データが必要です。%s のデータがありません。", pm);
        }

        log.info("偏極入射モデルで (C, T1) のフィットを開始します。データ数={}、初期値 C={}、T1={}",
                transmissionFractions.size(), fmt5(initialC), fmt5(initialT1));
        FitResult fit = curveFitter.fit(
                new PolarizedIncomingModel(opacityFunction, transmissionEmptyGlass),
                xs.toArray(new double[0][]), toArray(ys), new double[] {initialC, initialT1});
        return toTransmissionResult(fit, opacityFunction, transmissionEmptyGlass);
    }

    private He3FitResult<He3TransmissionFunction> toTransmissionResult(FitResult fit,
            OpacityFunction opacityFunction, double transmissionEmptyGlass) {
        double c = fit.getParameters()[0];
        double t1 = fit.getParameters()[1];
        if (!(Math.abs(c) <= 1.0)) {
            throw new FitConvergenceException("フィットした C が [-1, 1] の範囲外です: " + c);
        }
        if (!(t1 > 0.0)) {
            throw new FitConvergenceException("フィットした T1 が正ではありません: " + t1);
        }
        log.info("(C, T1) のフィットが完了しました。C={}、T1={}、反復回数={}", fmt5(c), fmt5(t1),
                fit.getIterations());
        He3TransmissionFunction function = new He3TransmissionFunction(opacityFunction,
                new PolarizationDecayFunction(c, t1), transmissionEmptyGlass);
        return new He3FitResult<>(function, fit.getVariances(), fit.getIterations());
    }

    /**
     * 格子の全点を (λ, t, sign) の観測点として追加します。
     */
    private static void collect(BeamData data, double sign, List<double[]> xs, List<Double> ys) {
        double[] lambda = data.wavelengthMidpoints();
        for (int r = 0; r < data.rows(); r++) {
            double t = data.time(r);
            for (int c = 0; c < data.columns(); c++) {
                xs.add(new double[] {lambda[c], t, sign});
                ys.add(data.get(r, c));
            }
        }
    }

    private static void checkEmptyGlass(double transmissionEmptyGlass) {
        Preconditions.checkArgument(
                transmissionEmptyGlass > 0.0 && Double.isFinite(transmissionEmptyGlass),
                "空ガラスの透過率は正の有限値である必要があります。T_E=%s", transmissionEmptyGlass);
    }

    private static double[] toArray(List<Double> list) {
        double[] out = new double[list.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = list.get(i);
        }
        return out;
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

    /**
     * {@code T_E * exp(-opacity0 * λ)}、x = (λ)、p = (opacity0) のモデルです。
     */
    private static final class OpacityModel implements FitModel {

        private final double transmissionEmptyGlass;

        OpacityModel(double transmissionEmptyGlass) {
            this.transmissionEmptyGlass = transmissionEmptyGlass;
        }

        @Override
        public int parameterCount() {
            return 1;
        }

        @Override
        public double value(double[] x, double[] p) {
            return transmissionEmptyGlass * Math.exp(-p[0] * x[0]);
        }

        @Override
        public double[] gradient(double[] x, double[] p) {
            return new double[] {-x[0] * value(x, p)};
        }
    }

    /**
     * {@code T_E * exp(-O) * cosh(O * P)}、x = (λ, t, -)、p = (C, T1) のモデルです。
     */
    private static final class UnpolarizedIncomingModel implements FitModel {

        private final OpacityFunction opacityFunction;

        private final double transmissionEmptyGlass;

        UnpolarizedIncomingModel(OpacityFunction opacityFunction, double transmissionEmptyGlass) {
            this.opacityFunction = opacityFunction;
            this.transmissionEmptyGlass = transmissionEmptyGlass;
        }

        @Override
        public int parameterCount() {
            return 2;
        }

        @Override
        public double value(double[] x, double[] p) {
            double o = opacityFunction.opacity(x[0]);
            double pol = p[0] * Math.exp(-x[1] / p[1]);
            return transmissionEmptyGlass * Math.exp(-o) * Math.cosh(o * pol);
        }

        @Override
        public double[] gradient(double[] x, double[] p) {
            double o = opacityFunction.opacity(x[0]);
            double decay = Math.exp(-x[1] / p[1]);
            double pol = p[0] * decay;
            // ∂f/∂P
            double dfdp = transmissionEmptyGlass * Math.exp(-o) * Math.sinh(o * pol) * o;
            return new double[] {dfdp * decay, dfdp * pol * x[1] / (p[1] * p[1])};
        }
    }

    /**
     * {@code T_E * exp(-O * (1 + s * P))}、x = (λ, t, s)、p = (C, T1) のモデルです。
     */
    private static final class PolarizedIncomingModel implements FitModel {

        private final OpacityFunction opacityFunction;

        private final double transmissionEmptyGlass;

        PolarizedIncomingModel(OpacityFunction opacityFunction, double transmissionEmptyGlass) {
            this.opacityFunction = opacityFunction;
            this.transmissionEmptyGlass = transmissionEmptyGlass;
        }

        @Override
        public int parameterCount() {
            return 2;
        }

        @Override
        public double value(double[] x, double[] p) {
            double o = opacityFunction.opacity(x[0]);
            double pol = p[0] * Math.exp(-x[1] / p[1]);
            return transmissionEmptyGlass * Math.exp(-o * (1.0 + x[2] * pol));
        }

        @Override
        public double[] gradient(double[] x, double[] p) {
            double o = opacityFunction.opacity(x[0]);
            double decay = Math.exp(-x[1] / p[1]);
            double pol = p[0] * decay;
            double f = transmissionEmptyGlass * Math.exp(-o * (1.0 + x[2] * pol));
            double dfdp = -o * x[2] * f;
            return new double[] {dfdp * decay, dfdp * pol * x[1] / (p[1] * p[1])};
        }
    }
}
