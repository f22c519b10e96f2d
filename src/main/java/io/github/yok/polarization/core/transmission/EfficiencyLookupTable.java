package io.github.yok.polarization.core.transmission;

import com.google.common.base.Preconditions;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * 波長ごとの効率を表引きするスーパーミラー効率です。
 *
 * <p>
 * 波長軸が効率より1つ多い場合はビン境界（ヒストグラム）として扱い、{@code edges[i] <= λ < edges[i+1]} のビンの値を返します。
 * 同じ長さの場合は点データとして扱い、λ 以下で最大の波長点の値（previous）を返します。
 * </p>
 */
public final class EfficiencyLookupTable implements SupermirrorEfficiencyFunction {

    /**
     * 波長軸（Å、狭義単調増加）です。
     */
    private final double[] wavelengths;

    /**
     * 効率です。
     */
    private final double[] efficiencies;

    /**
     * 波長軸がビン境界かどうかです。
     */
    private final boolean binEdges;

    /**
     * 表引き効率を生成します。
     *
     * @param wavelengths 波長軸（Å）です
     * @param efficiencies 効率です
     * @throws IllegalArgumentException 長さの組合せが不正、または波長軸が単調増加でない場合に発生します
     */
    public EfficiencyLookupTable(double[] wavelengths, double[] efficiencies) {
        Preconditions.checkNotNull(wavelengths, "wavelengths が null です。");
        Preconditions.checkNotNull(efficiencies, "efficiencies が null です。");
        Preconditions.checkArgument(efficiencies.length > 0, "効率表が空です。");
        Preconditions.checkArgument(
                wavelengths.length == efficiencies.length
                        || wavelengths.length == efficiencies.length + 1,
                "波長軸の長さは効率と同じか1つ多い必要があります。wavelengths=%s, efficiencies=%s",
                wavelengths.length, efficiencies.length);
        for (int i = 1; i < wavelengths.length; i++) {
            Preconditions.checkArgument(wavelengths[i] > wavelengths[i - 1],
                    "波長軸は狭義単調増加である必要があります。index=%s", i);
        }
        this.wavelengths = wavelengths.clone();
        this.efficiencies = efficiencies.clone();
        this.binEdges = wavelengths.length == efficiencies.length + 1;
    }

    /**
     * CSV から効率表を読み込みます。
     *
     * <p>
     * 先頭行をヘッダとして扱い、列名で波長（Å）と効率の列を選びます。
     * </p>
     *
     * @param reader CSV の入力です
     * @param wavelengthColumn 波長列の名前です
     * @param efficiencyColumn 効率列の名前です
     * @return 効率表です
     * @throws IOException 読み込みに失敗した場合に発生します
     * @throws IllegalArgumentException 列が存在しない、または値が数値でない場合に発生します
     */
    public static EfficiencyLookupTable fromCsv(Reader reader, String wavelengthColumn,
            String efficiencyColumn) throws IOException {
        CSVFormat format = CSVFormat.Builder.create(CSVFormat.DEFAULT).setHeader()
                .setSkipHeaderRecord(true).setTrim(true).setIgnoreEmptyLines(true).build();
        List<Double> wl = new ArrayList<>();
        List<Double> eff = new ArrayList<>();
        try (CSVParser parser = format.parse(reader)) {
            for (String column : Arrays.asList(wavelengthColumn, efficiencyColumn)) {
                Preconditions.checkArgument(parser.getHeaderMap().containsKey(column),
                        "CSV に列 %s がありません。列=%s", column, parser.getHeaderNames());
            }
            for (CSVRecord record : parser) {
                wl.add(parseNumber(record, wavelengthColumn));
                eff.add(parseNumber(record, efficiencyColumn));
            }
        }
        return new EfficiencyLookupTable(toArray(wl), toArray(eff));
    }

    /**
     * CSV ファイルから効率表を読み込みます。
     *
     * @param path CSV ファイルです
     * @param wavelengthColumn 波長列の名前です
     * @param efficiencyColumn 効率列の名前です
     * @return 効率表です
     * @throws IllegalStateException 読み込みに失敗した場合に発生します
     */
    public static EfficiencyLookupTable fromFile(Path path, String wavelengthColumn,
            String efficiencyColumn) {
        try (Reader r = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return fromCsv(r, wavelengthColumn, efficiencyColumn);
        } catch (IOException e) {
            throw new IllegalStateException("効率表の読み込みに失敗しました: " + path, e);
        }
    }

    @Override
    public double efficiency(double wavelength) {
        if (binEdges) {
            int last = wavelengths.length - 1;
            if (!(wavelength >= wavelengths[0] && wavelength < wavelengths[last])) {
                throw new IllegalArgumentException("波長が効率表の範囲外です: " + wavelength + " (範囲=["
                        + wavelengths[0] + ", " + wavelengths[last] + "))");
            }
        } else if (!(wavelength >= wavelengths[0])) {
            throw new IllegalArgumentException(
                    "波長が効率表の範囲外です: " + wavelength + " (最小=" + wavelengths[0] + ")");
        }
        // wavelength 以下で最大の点
        int pos = Arrays.binarySearch(wavelengths, wavelength);
        int index = pos >= 0 ? pos : -pos - 2;
        return efficiencies[Math.min(index, efficiencies.length - 1)];
    }

    /**
     * 波長軸がビン境界かどうかを返します。
     *
     * @return ビン境界の場合は true です
     */
    public boolean isBinEdges() {
        return binEdges;
    }

    private static double parseNumber(CSVRecord record, String column) {
        String raw = record.get(column);
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("CSV のレコード " + record.getRecordNumber() + " の列 "
                    + column + " が数値ではありません: " + raw, e);
        }
    }

    private static double[] toArray(List<Double> list) {
        double[] out = new double[list.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = list.get(i);
        }
        return out;
    }
}
