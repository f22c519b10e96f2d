package io.github.yok.polarization.core.he3;

/**
 * 不透明度の求め方です。
 */
public enum OpacitySource {

    /**
     * セルパラメータから閉じた式で求めます。
     */
    IN_SITU,

    /**
     * 減偏極したセルの直接ビームからフィットします（セルパラメータは初期値に使います）。
     */
    EX_SITU
}
