package io.github.yok.polarization.core.fit;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;

/**
 * Levenberg-Marquardt 法による非線形最小二乗フィットを行うクラスです。
 *
 * <p>
 * 解析的な勾配を {@link FitModel} から受け取り、観測値のうち有限でない点は除外してフィットします。
 * 各呼び出しはソルバ状態を自前で持つため、異なるフィットを並行して実行できます。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public final class CurveFitter {

    /**
     * 反復回数の上限です。
     */
    private final int maxIterations;

    /**
     * 関数評価回数の上限です。
     */
    private final int maxEvaluations;

    /**
     * コスト（残差ノルム）の相対許容誤差です。
     */
    private final double costRelativeTolerance;

    /**
     * パラメータの相対許容誤差です。
     */
    private final double parameterRelativeTolerance;

    /**
     * 共分散計算で特異とみなす閾値です。
     */
    private final double covarianceSingularityThreshold = 1e-14;

    /**
     * 観測点にモデルをフィットします。
     *
     * @param model モデル関数です
     * @param x 観測点の独立変数です（x[i] が i 番目の点）
     * @param y 観測値です
     * @param initialGuess パラメータの初期値です
     * @return フィット結果です
     * @throws NullPointerException 引数が null の場合に発生します
     * @throws IllegalArgumentException 長さが一致しない、または有効な観測点がパラメータ数以下の場合に発生します
     * @throws FitConvergenceException 収束しない、または結果が有限でない場合に発生します
     */
    public FitResult fit(FitModel model, double[][] x, double[] y, double[] initialGuess) {
        Preconditions.checkNotNull(model, "model が null です。");
        Preconditions.checkNotNull(x, "x が null です。");
        Preconditions.checkNotNull(y, "y が null です。");
        Preconditions.checkNotNull(initialGuess, "initialGuess が null です。");
        Preconditions.checkArgument(x.length == y.length, "x と y の長さが一致しません。x=%s, y=%s",
                x.length, y.length);
        Preconditions.checkArgument(initialGuess.length == model.parameterCount(),
                "初期値の長さがパラメータ数と一致しません。expected=%s, actual=%s", model.parameterCount(),
                initialGuess.length);
        Preconditions.checkArgument(maxIterations > 0, "反復回数の上限は正の値である必要があります。max=%s",
                maxIterations);

        // 1) 有限でない観測点を除外
        List<double[]> xs = new ArrayList<>(x.length);
        List<Double> ys = new ArrayList<>(y.length);
        int skipped = 0;
        for (int i = 0; i < y.length; i++) {
            if (Double.isFinite(y[i]) && allFinite(x[i])) {
                xs.add(x[i]);
                ys.add(y[i]);
            } else {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.warn("有限でない観測点を {} 点除外しました（全 {} 点）。", skipped, y.length);
        }
        final int n = ys.size();
        final int p = model.parameterCount();
        Preconditions.checkArgument(n > p, "有効な観測点数がパラメータ数以下です。n=%s, p=%s", n, p);

        final double[][] points = xs.toArray(new double[0][]);
        double[] target = new double[n];
        for (int i = 0; i < n; i++) {
            target[i] = ys.get(i);
        }

        // 2) モデルとヤコビアン
        MultivariateJacobianFunction jacobian = point -> {
            double[] params = point.toArray();
            RealVector value = new ArrayRealVector(n);
            RealMatrix jac = new Array2DRowRealMatrix(n, p);
            for (int i = 0; i < n; i++) {
                value.setEntry(i, model.value(points[i], params));
                double[] grad = model.gradient(points[i], params);
                for (int k = 0; k < p; k++) {
                    jac.setEntry(i, k, grad[k]);
                }
            }
            return new Pair<>(value, jac);
        };

        LeastSquaresOptimizer optimizer = new LevenbergMarquardtOptimizer()
                .withCostRelativeTolerance(costRelativeTolerance)
                .withParameterRelativeTolerance(parameterRelativeTolerance);

        LeastSquaresProblem problem = new LeastSquaresBuilder().start(initialGuess)
                .target(target).model(jacobian).lazyEvaluation(false)
                .maxEvaluations(maxEvaluations).maxIterations(maxIterations).build();

        log.info("フィットを開始します。観測点数={}、初期値={}", n, fmtArray(initialGuess));

        // 3) 最適化
        LeastSquaresOptimizer.Optimum optimum;
        try {
            optimum = optimizer.optimize(problem);
        } catch (MathIllegalStateException | MathIllegalArgumentException e) {
            throw new FitConvergenceException("フィットが収束しませんでした。初期値="
                    + fmtArray(initialGuess) + ", 原因=" + e.getMessage(), e);
        }

        double[] result = optimum.getPoint().toArray();
        double cost = optimum.getCost();
        if (!allFinite(result) || !Double.isFinite(cost)) {
            throw new FitConvergenceException(
                    "フィット結果が有限ではありません。パラメータ=" + fmtArray(result) + ", cost=" + cost);
        }

        // 4) 分散 = 共分散の対角 * 残差二乗和 / (n - p)
        double[] variances = new double[p];
        try {
            RealMatrix covariance = optimum.getCovariances(covarianceSingularityThreshold);
            double scale = cost * cost / (n - p);
            for (int k = 0; k < p; k++) {
                variances[k] = covariance.getEntry(k, k) * scale;
            }
        } catch (MathIllegalArgumentException e) {
            log.warn("共分散を計算できませんでした。分散は NaN とします。原因={}", e.getMessage());
            Arrays.fill(variances, Double.NaN);
        }

        log.info("フィットが完了しました。パラメータ={}、反復回数={}、RMS={}", fmtArray(result),
                optimum.getIterations(), fmt5(optimum.getRMS()));

        return new FitResult(result, variances, optimum.getIterations(), optimum.getRMS(), n);
    }

    private static boolean allFinite(double[] values) {
        for (double v : values) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }

    private static String fmtArray(double[] values) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(String.format(Locale.ROOT, "%.6g", values[i]));
        }
        return sb.append(']').toString();
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
