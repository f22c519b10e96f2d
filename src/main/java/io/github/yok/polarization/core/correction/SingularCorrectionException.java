package io.github.yok.polarization.core.correction;

/**
 * 偏極素子の転送行列が特異（偏極能が 0）で補正係数を定義できない場合の例外です。
 */
public class SingularCorrectionException extends ArithmeticException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public SingularCorrectionException(String message) {
        super(message);
    }
}
