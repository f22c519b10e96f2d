package io.github.yok.polarization.core.model;

/**
 * 偏極素子の種別を表す列挙型です。
 *
 * <p>
 * 値そのものは状態を持たず、どの物理デバイスに属する量かを識別するタグとして使用します。
 * </p>
 */
public enum PolarizingElement {

    /**
     * 試料の上流に置かれる偏極子（polarizer）です。
     */
    POLARIZER,

    /**
     * 試料の下流に置かれる検光子（analyzer）です。
     */
    ANALYZER
}
