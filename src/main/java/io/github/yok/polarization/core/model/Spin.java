package io.github.yok.polarization.core.model;

/**
 * 測定時のスピン状態（フリッパーの状態）を表す列挙型です。
 */
public enum Spin {

    /**
     * Up（フリッパー off）です。
     */
    UP,

    /**
     * Down（フリッパー on）です。
     */
    DOWN
}
