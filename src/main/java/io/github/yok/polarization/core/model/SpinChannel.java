package io.github.yok.polarization.core.model;

import java.util.List;
import lombok.Value;

/**
 * 偏極子スピンと検光子スピンの組で表される測定チャネルです。
 *
 * <p>
 * 4つのチャネルは ++, +-, -+, -- の順（{@link #all()}）で扱います。
 * </p>
 */
@Value
public class SpinChannel {

    /**
     * ++ チャネルです。
     */
    public static final SpinChannel UP_UP = new SpinChannel(Spin.UP, Spin.UP);

    /**
     * +- チャネルです。
     */
    public static final SpinChannel UP_DOWN = new SpinChannel(Spin.UP, Spin.DOWN);

    /**
     * -+ チャネルです。
     */
    public static final SpinChannel DOWN_UP = new SpinChannel(Spin.DOWN, Spin.UP);

    /**
     * -- チャネルです。
     */
    public static final SpinChannel DOWN_DOWN = new SpinChannel(Spin.DOWN, Spin.DOWN);

    /**
     * 偏極子側のスピンです。
     */
    Spin polarizer;

    /**
     * 検光子側のスピンです。
     */
    Spin analyzer;

    /**
     * 4つのチャネルを ++, +-, -+, -- の順で返します。
     *
     * @return チャネル一覧です
     */
    public static List<SpinChannel> all() {
        return List.of(UP_UP, UP_DOWN, DOWN_UP, DOWN_DOWN);
    }

    /**
     * 指定した素子側のスピンを返します。
     *
     * @param element 偏極素子です
     * @return スピンです
     */
    public Spin spinOf(PolarizingElement element) {
        return element == PolarizingElement.POLARIZER ? polarizer : analyzer;
    }

    /**
     * "+-" のような短い表記を返します。
     *
     * @return 表記です
     */
    public String label() {
        return symbol(polarizer) + symbol(analyzer);
    }

    private static String symbol(Spin spin) {
        return spin == Spin.UP ? "+" : "-";
    }
}
