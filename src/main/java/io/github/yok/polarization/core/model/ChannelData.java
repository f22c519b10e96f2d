package io.github.yok.polarization.core.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.Map;
import java.util.Set;

/**
 * 1つの測定チャネルの強度配列と、その座標（波長・時刻など）を保持する不変クラスです。
 *
 * <p>
 * 座標配列の長さは値と同じか 1 でなければなりません。長さ 1 の座標は全要素にブロードキャストされます。
 * </p>
 */
public final class ChannelData {

    /**
     * 波長座標（Å）の名前です。
     */
    public static final String WAVELENGTH = "wavelength";

    /**
     * 時刻座標（s）の名前です。
     */
    public static final String TIME = "time";

    /**
     * 強度値です。
     */
    private final double[] values;

    /**
     * 座標名から座標配列への対応です。
     */
    private final ImmutableMap<String, double[]> coordinates;

    /**
     * チャネルデータを生成します。
     *
     * @param values 強度値です
     * @param coordinates 座標名から座標配列への対応です
     * @throws NullPointerException 引数が null の場合に発生します
     * @throws IllegalArgumentException 座標配列の長さが値と一致せず 1 でもない場合に発生します
     */
    public ChannelData(double[] values, Map<String, double[]> coordinates) {
        Preconditions.checkNotNull(values, "values が null です。");
        Preconditions.checkNotNull(coordinates, "coordinates が null です。");
        this.values = values.clone();
        ImmutableMap.Builder<String, double[]> builder = ImmutableMap.builder();
        for (Map.Entry<String, double[]> e : coordinates.entrySet()) {
            double[] coord = Preconditions.checkNotNull(e.getValue(), "座標 %s が null です。",
                    e.getKey());
            Preconditions.checkArgument(coord.length == 1 || coord.length == values.length,
                    "座標 %s の長さは 1 または値の長さ (%s) と一致する必要があります。length=%s", e.getKey(),
                    values.length, coord.length);
            builder.put(e.getKey(), coord.clone());
        }
        this.coordinates = builder.build();
    }

    /**
     * 座標を持たないチャネルデータを生成します。
     *
     * @param values 強度値です
     * @return チャネルデータです
     */
    public static ChannelData of(double... values) {
        return new ChannelData(values, ImmutableMap.of());
    }

    /**
     * 波長と時刻の座標を持つチャネルデータを生成します。
     *
     * @param values 強度値です
     * @param wavelength 波長（Å）です
     * @param time 時刻（s）です
     * @return チャネルデータです
     */
    public static ChannelData withWavelengthAndTime(double[] values, double[] wavelength,
            double[] time) {
        return new ChannelData(values, ImmutableMap.of(WAVELENGTH, wavelength, TIME, time));
    }

    /**
     * 要素数を返します。
     *
     * @return 要素数です
     */
    public int size() {
        return values.length;
    }

    /**
     * 強度値のコピーを返します。
     *
     * @return 強度値です
     */
    public double[] values() {
        return values.clone();
    }

    /**
     * 指定位置の強度値を返します。
     *
     * @param index 位置です
     * @return 強度値です
     */
    public double value(int index) {
        return values[index];
    }

    /**
     * 座標を持つかどうかを返します。
     *
     * @param name 座標名です
     * @return 持つ場合は true です
     */
    public boolean hasCoordinate(String name) {
        return coordinates.containsKey(name);
    }

    /**
     * 座標名の一覧を返します。
     *
     * @return 座標名です
     */
    public Set<String> coordinateNames() {
        return coordinates.keySet();
    }

    /**
     * 値と同じ長さにブロードキャストした座標配列を返します。
     *
     * @param name 座標名です
     * @return 座標配列です
     * @throws IllegalArgumentException 座標が存在しない場合に発生します
     */
    public double[] coordinate(String name) {
        double[] coord = coordinates.get(name);
        Preconditions.checkArgument(coord != null, "座標 %s がありません。座標=%s", name,
                coordinates.keySet());
        if (coord.length == values.length) {
            return coord.clone();
        }
        double[] expanded = new double[values.length];
        Arrays.fill(expanded, coord[0]);
        return expanded;
    }

    /**
     * 要素ごとに係数を掛けたデータを返します。
     *
     * @param factors 係数です（長さは値と同じ）
     * @return チャネルデータです
     */
    public ChannelData times(double[] factors) {
        Preconditions.checkArgument(factors.length == values.length,
                "係数の長さが一致しません。expected=%s, actual=%s", values.length, factors.length);
        double[] out = new double[values.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = values[i] * factors[i];
        }
        return new ChannelData(out, coordinates);
    }

    /**
     * 要素ごとの和を返します。座標はこのデータのものを引き継ぎます。
     *
     * @param other 加えるデータです
     * @return チャネルデータです
     */
    public ChannelData plus(ChannelData other) {
        Preconditions.checkArgument(other.values.length == values.length,
                "値の長さが一致しません。expected=%s, actual=%s", values.length, other.values.length);
        double[] out = new double[values.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = values[i] + other.values[i];
        }
        return new ChannelData(out, coordinates);
    }

    @Override
    public String toString() {
        return "ChannelData(size=" + values.length + ", coordinates=" + coordinates.keySet() + ")";
    }
}
