package io.github.yok.polarization.core.fit;

/**
 * 非線形最小二乗フィットのモデル関数を表すインタフェースです。
 *
 * <p>
 * 独立変数 x（1点あたり複数の成分を持てます）とパラメータ p から、モデル値と p についての勾配を返します。
 * </p>
 */
public interface FitModel {

    /**
     * パラメータ数を返します。
     *
     * @return パラメータ数です
     */
    int parameterCount();

    /**
     * モデル値を返します。
     *
     * @param x 独立変数です
     * @param parameters パラメータです
     * @return モデル値です
     */
    double value(double[] x, double[] parameters);

    /**
     * パラメータについての勾配（∂f/∂p_k）を返します。
     *
     * @param x 独立変数です
     * @param parameters パラメータです
     * @return 勾配です（長さはパラメータ数）
     */
    double[] gradient(double[] x, double[] parameters);
}
