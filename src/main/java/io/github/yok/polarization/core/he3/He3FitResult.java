package io.github.yok.polarization.core.he3;

import lombok.Value;

/**
 * He3 モデルのフィット結果です。
 *
 * <p>
 * 下流では点推定（{@link #getFunction()}）だけを使い、分散は参考値として保持します。
 * </p>
 *
 * @param <T> フィットで得た関数の型です
 */
@Value
public class He3FitResult<T> {

    /**
     * フィットで得た関数です。
     */
    T function;

    /**
     * パラメータの分散です（順序はフィットしたパラメータの順）。
     */
    double[] variances;

    /**
     * 反復回数です。
     */
    int iterations;
}
