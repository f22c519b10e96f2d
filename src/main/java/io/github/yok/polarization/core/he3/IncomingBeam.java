package io.github.yok.polarization.core.he3;

/**
 * 校正測定時にセルへ入射するビームの偏極状態です。
 */
public enum IncomingBeam {

    /**
     * 非偏極ビームです（偏極子セルの校正）。
     */
    UNPOLARIZED,

    /**
     * 偏極ビームです（検光子セルの校正、plus/minus のタグが必要）。
     */
    POLARIZED
}
