package io.github.yok.polarization.app;

import io.github.yok.polarization.core.he3.IncomingBeam;
import io.github.yok.polarization.core.he3.LengthUnit;
import io.github.yok.polarization.core.he3.OpacitySource;
import io.github.yok.polarization.core.he3.PressureUnit;
import io.github.yok.polarization.core.he3.TemperatureUnit;
import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 偏極補正の設定値（polarization.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、透過率関数と補正エンジンの組み立てに使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "polarization")
public class PolarizationProperties {

    /**
     * 偏極子の設定です。
     */
    @Valid
    private Element polarizer = new Element();

    /**
     * 検光子の設定です。
     */
    @Valid
    private Element analyzer = new Element();

    /**
     * フィットの設定です。
     */
    @Valid
    private Fit fit = new Fit();

    /**
     * 起動時に透過率を表示する点の設定です。
     */
    @Valid
    private Report report = new Report();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "polarization")
    public String toMultilineString() {
        String nl = System.lineSeparator();
        StringBuilder sb = new StringBuilder(256).append(nl);
        appendElement(sb, nl, "polarizer", getPolarizer());
        appendElement(sb, nl, "analyzer", getAnalyzer());

        Fit f = getFit();
        appendSection(sb, nl, "fit",
                // initialC: 初期偏極率 C の初期値
                "initialC", f.getInitialC(),
                // initialT1: 減衰時間 T1 の初期値（s）
                "initialT1", f.getInitialT1(),
                "maxIterations", f.getMaxIterations(),
                "maxEvaluations", f.getMaxEvaluations(),
                "costRelativeTolerance", f.getCostRelativeTolerance(),
                "parameterRelativeTolerance", f.getParameterRelativeTolerance());

        Report r = getReport();
        appendSection(sb, nl, "report",
                "wavelengths", r.getWavelengths(),
                "time", r.getTime());
        return sb.toString();
    }

    private static void appendElement(StringBuilder sb, String nl, String name, Element e) {
        if (!e.isEnabled()) {
            appendSection(sb, nl, name, "enabled", false);
            return;
        }
        if (e.getModel() == ElementModel.HE3) {
            He3 h = e.getHe3();
            appendSection(sb, nl, name,
                    "model", e.getModel(),
                    "flipperEfficiency", e.getFlipperEfficiency(),
                    "he3.pressure", h.getPressure() + " " + h.getPressureUnit(),
                    "he3.length", h.getLength() + " " + h.getLengthUnit(),
                    "he3.temperature", h.getTemperature() + " " + h.getTemperatureUnit(),
                    "he3.transmissionEmptyGlass", h.getTransmissionEmptyGlass(),
                    "he3.opacitySource", h.getOpacitySource(),
                    "he3.incomingBeam", h.getIncomingBeam(),
                    "he3.c", h.getC(),
                    "he3.t1", h.getT1());
        } else {
            Supermirror s = e.getSupermirror();
            appendSection(sb, nl, name,
                    "model", e.getModel(),
                    "flipperEfficiency", e.getFlipperEfficiency(),
                    "supermirror.a", s.getA(),
                    "supermirror.b", s.getB(),
                    "supermirror.c", s.getC(),
                    "supermirror.lookupTable", s.getLookupTable());
        }
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    /**
     * 偏極素子のモデルです。
     */
    public enum ElementModel {
        HE3, SUPERMIRROR
    }

    @Data
    public static class Element {

        /**
         * 素子を使うかどうかです（検光子のみ false を指定でき、false は半偏極構成です）。
         */
        private boolean enabled = true;

        /**
         * 素子のモデルです。
         */
        @NotNull
        private ElementModel model = ElementModel.HE3;

        /**
         * フリッパー効率です（フリッパーが無い場合は 1.0）。
         */
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax("1.0")
        private double flipperEfficiency = 1.0;

        /**
         * He3 セルの設定です。
         */
        @Valid
        private He3 he3 = new He3();

        /**
         * スーパーミラーの設定です。
         */
        @Valid
        private Supermirror supermirror = new Supermirror();
    }

    @Data
    public static class He3 {

        /**
         * 圧力です。
         */
        @Positive
        private double pressure = 1.0;

        /**
         * 圧力の単位です。
         */
        @NotNull
        private PressureUnit pressureUnit = PressureUnit.BAR;

        /**
         * セル長です。
         */
        @Positive
        private double length = 10.0;

        /**
         * セル長の単位です。
         */
        @NotNull
        private LengthUnit lengthUnit = LengthUnit.CENTIMETER;

        /**
         * 温度です。
         */
        private double temperature = 293.15;

        /**
         * 温度の単位です（CELSIUS の場合は起動時にケルビンへ換算します）。
         */
        @NotNull
        private TemperatureUnit temperatureUnit = TemperatureUnit.KELVIN;

        /**
         * 空ガラスの透過率 T_E です。
         */
        @Positive
        private double transmissionEmptyGlass = 0.9;

        /**
         * 不透明度の求め方です。
         */
        @NotNull
        private OpacitySource opacitySource = OpacitySource.IN_SITU;

        /**
         * 校正測定時の入射ビームの偏極状態です。
         */
        @NotNull
        private IncomingBeam incomingBeam = IncomingBeam.UNPOLARIZED;

        /**
         * 初期偏極率 C です。
         */
        @DecimalMin("-1.0")
        @DecimalMax("1.0")
        private double c = 0.7;

        /**
         * 減衰時間 T1（s）です。
         */
        @Positive
        private double t1 = 360_000.0;
    }

    @Data
    public static class Supermirror {

        /**
         * 2次の係数（1/Å^2）です。
         */
        private double a;

        /**
         * 1次の係数（1/Å）です。
         */
        private double b;

        /**
         * 定数項です。
         */
        private double c = 0.95;

        /**
         * 効率表の CSV ファイルです。指定した場合は多項式より優先します。
         */
        private String lookupTable;

        /**
         * 効率表の波長列（Å）の名前です。
         */
        private String wavelengthColumn = "wavelength";

        /**
         * 効率表の効率列の名前です。
         */
        private String efficiencyColumn = "efficiency";
    }

    @Data
    public static class Fit {

        /**
         * 初期偏極率 C の初期値です。
         */
        @DecimalMin("-1.0")
        @DecimalMax("1.0")
        private double initialC = 0.8;

        /**
         * 減衰時間 T1（s）の初期値です。
         */
        @Positive
        private double initialT1 = 400_000.0;

        /**
         * 反復回数の上限です。
         */
        @Positive
        private int maxIterations = 1000;

        /**
         * 関数評価回数の上限です。
         */
        @Positive
        private int maxEvaluations = 10_000;

        /**
         * コストの相対許容誤差です。
         */
        @Positive
        private double costRelativeTolerance = 1e-12;

        /**
         * パラメータの相対許容誤差です。
         */
        @Positive
        private double parameterRelativeTolerance = 1e-12;
    }

    @Data
    public static class Report {

        /**
         * 透過率を表示する波長（Å）の一覧です。
         */
        @NotEmpty
        private List<Double> wavelengths = List.of(2.0, 4.0, 6.0);

        /**
         * 透過率を表示する時刻（s）です。
         */
        private double time = 0.0;
    }
}
