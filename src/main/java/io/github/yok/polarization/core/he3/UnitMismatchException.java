package io.github.yok.polarization.core.he3;

/**
 * 単位が要求される尺度と一致しない場合の例外です。
 */
public class UnitMismatchException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public UnitMismatchException(String message) {
        super(message);
    }
}
