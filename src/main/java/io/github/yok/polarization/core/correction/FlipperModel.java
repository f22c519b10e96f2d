package io.github.yok.polarization.core.correction;

import com.google.common.base.Preconditions;
import io.github.yok.polarization.core.model.Spin;
import lombok.Value;

/**
 * 偏極素子の後ろに置かれた非理想スピンフリッパーのモデルとその逆変換です。
 *
 * <p>
 * 効率 f のフリッパーの順方向の混合行列は {@code F = [[1, 0], [1 - f, f]]} で、
 * {@code down_out = (1 - f) * up_in + f * down_in} となります。{@code swap} は Down（フリッパー on）の測定に対応します。
 * このクラスは F の逆行列 {@code [[1, 0], [-(1 - f) / f, 1 / f]]} を、補正積のどちら側に素子があるかに応じて適用します。
 * f = 1 のときは式がそのまま恒等変換（Down では入れ替えのみ）になるため、特別な分岐はありません。
 * </p>
 */
@Value
public class FlipperModel {

    /**
     * フリッパー効率です。
     */
    FlipperEfficiency efficiency;

    /**
     * Down（フリッパー on）の測定を表すかどうかです。
     */
    boolean swap;

    /**
     * 測定スピンに対応するフリッパーモデルを返します。
     *
     * @param efficiency フリッパー効率です
     * @param spin 測定スピンです
     * @return フリッパーモデルです
     */
    public static FlipperModel of(FlipperEfficiency efficiency, Spin spin) {
        Preconditions.checkNotNull(efficiency, "efficiency が null です。");
        Preconditions.checkNotNull(spin, "spin が null です。");
        return new FlipperModel(efficiency, spin == Spin.DOWN);
    }

    /**
     * 左から掛かる側（検光子）の逆変換を適用します。
     *
     * <p>
     * swap の場合は先に (up, down) を入れ替え、{@code (up, (down - (1 - f) * up) / f)} を返します。
     * </p>
     *
     * @param up up 成分です
     * @param down down 成分です
     * @return 変換後の組です
     */
    public SpinPair fromLeft(double[] up, double[] down) {
        checkSameLength(up, down);
        double[] u = swap ? down : up;
        double[] d = swap ? up : down;
        double f = efficiency.getValue();
        double[] outUp = u.clone();
        double[] outDown = new double[d.length];
        for (int i = 0; i < d.length; i++) {
            outDown[i] = (d[i] - (1.0 - f) * u[i]) / f;
        }
        return new SpinPair(outUp, outDown);
    }

    /**
     * 右から掛かる側（偏極子）の逆変換を適用します。
     *
     * <p>
     * 入力は偏極子軸に沿った組 (up, down) です。swap の場合は {@code (down / f, up / f)}、
     * そうでなければ {@code (up - g * down, down - g * up)}（{@code g = (1 - f) / f}）を返します。
     * </p>
     *
     * @param up up 成分です
     * @param down down 成分です
     * @return 変換後の組です
     */
    public SpinPair fromRight(double[] up, double[] down) {
        checkSameLength(up, down);
        double f = efficiency.getValue();
        double[] outUp = new double[up.length];
        double[] outDown = new double[up.length];
        if (swap) {
            for (int i = 0; i < up.length; i++) {
                outUp[i] = down[i] / f;
                outDown[i] = up[i] / f;
            }
        } else {
            double g = (1.0 - f) / f;
            for (int i = 0; i < up.length; i++) {
                outUp[i] = up[i] - g * down[i];
                outDown[i] = down[i] - g * up[i];
            }
        }
        return new SpinPair(outUp, outDown);
    }

    private static void checkSameLength(double[] up, double[] down) {
        Preconditions.checkNotNull(up, "up が null です。");
        Preconditions.checkNotNull(down, "down が null です。");
        Preconditions.checkArgument(up.length == down.length, "up と down の長さが一致しません。up=%s, down=%s",
                up.length, down.length);
    }
}
