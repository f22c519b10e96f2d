package io.github.yok.polarization.core.fit;

/**
 * 非線形最小二乗フィットが収束しない、または物理的に不正なパラメータを返した場合の例外です。
 */
public class FitConvergenceException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public FitConvergenceException(String message) {
        super(message);
    }

    /**
     * 原因付きの例外を生成します。
     *
     * @param message メッセージです
     * @param cause 原因です
     */
    public FitConvergenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
