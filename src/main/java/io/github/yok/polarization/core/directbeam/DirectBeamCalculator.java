package io.github.yok.polarization.core.directbeam;

import com.google.common.base.Preconditions;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;

/**
 * 正規化済みの直接ビームイベントから、バックグラウンドを差し引いた直接ビーム強度を求めるクラスです。
 *
 * <p>
 * イベントを時刻 × 波長のビンに振り分け、ビンごとに「ビーム領域の平均重み − バックグラウンド領域の平均重み」を返します。
 * 領域は Q^2 = Qx^2 + Qy^2 に対する半開区間で判定し、回転対称を仮定します。イベントが無い領域の平均は NaN です。
 * </p>
 */
@Slf4j
public final class DirectBeamCalculator {

    /**
     * バックグラウンドを差し引いた直接ビーム強度を求めます。
     *
     * @param data 正規化済みのイベントデータです
     * @param wavelengthEdges 波長ビン境界（Å、単調増加）です
     * @param timeEdges 時刻ビン境界（s、単調増加）です。null の場合は時刻で分けません
     * @param beamRange 直接ビーム領域です
     * @param backgroundRange バックグラウンド領域です
     * @return 直接ビーム強度（波長はビン境界、時刻はビン中心）です
     * @throws IllegalArgumentException 正規化されていない、範囲が重なる、または範囲が負の場合に発生します
     */
    public BeamData compute(EventData data, double[] wavelengthEdges, double[] timeEdges,
            QRange beamRange, QRange backgroundRange) {
        Preconditions.checkNotNull(data, "data が null です。");
        Preconditions.checkNotNull(beamRange, "beamRange が null です。");
        Preconditions.checkNotNull(backgroundRange, "backgroundRange が null です。");
        if (!data.isNormalized()) {
            throw new IllegalArgumentException("入力データは正規化済み（無次元）である必要があります。unit=" + data.getUnit());
        }
        if (beamRange.getMax() > backgroundRange.getMin()) {
            throw new IllegalArgumentException("バックグラウンド範囲は直接ビーム範囲より後ろにある必要があります。beam="
                    + beamRange + ", background=" + backgroundRange);
        }
        if (beamRange.getMin() < 0.0) {
            throw new IllegalArgumentException("Q 範囲は正である必要があります。beam=" + beamRange);
        }
        checkEdges(wavelengthEdges, "wavelengthEdges");
        if (timeEdges != null) {
            checkEdges(timeEdges, "timeEdges");
        }

        int cols = wavelengthEdges.length - 1;
        int rows = timeEdges == null ? 1 : timeEdges.length - 1;
        DMatrixRMaj beamSum = new DMatrixRMaj(rows, cols);
        DMatrixRMaj beamCount = new DMatrixRMaj(rows, cols);
        DMatrixRMaj bgSum = new DMatrixRMaj(rows, cols);
        DMatrixRMaj bgCount = new DMatrixRMaj(rows, cols);

        int outside = 0;
        for (NeutronEvent e : data.getEvents()) {
            int col = binIndex(wavelengthEdges, e.getWavelength());
            int row = timeEdges == null ? 0 : binIndex(timeEdges, e.getTime());
            if (col < 0 || row < 0) {
                outside++;
                continue;
            }
            double q2 = e.getQx() * e.getQx() + e.getQy() * e.getQy();
            if (beamRange.containsSquared(q2)) {
                beamSum.add(row, col, e.getWeight());
                beamCount.add(row, col, 1.0);
            } else if (backgroundRange.containsSquared(q2)) {
                bgSum.add(row, col, e.getWeight());
                bgCount.add(row, col, 1.0);
            }
        }
        log.debug("直接ビームを計算しました。イベント数={}、ビン外={}、格子={}x{}", data.getEvents().size(), outside,
                rows, cols);

        DMatrixRMaj result = new DMatrixRMaj(rows, cols);
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                double beam = beamSum.get(r, c) / beamCount.get(r, c);
                double bg = bgSum.get(r, c) / bgCount.get(r, c);
                result.set(r, c, beam - bg);
            }
        }

        double[] timeCenters = null;
        if (timeEdges != null) {
            timeCenters = new double[rows];
            for (int r = 0; r < rows; r++) {
                timeCenters[r] = 0.5 * (timeEdges[r] + timeEdges[r + 1]);
            }
        }
        return new BeamData(wavelengthEdges, timeCenters, result);
    }

    private static void checkEdges(double[] edges, String name) {
        Preconditions.checkNotNull(edges, "%s が null です。", name);
        Preconditions.checkArgument(edges.length >= 2, "%s は2点以上必要です。length=%s", name,
                edges.length);
        for (int i = 1; i < edges.length; i++) {
            Preconditions.checkArgument(edges[i] > edges[i - 1], "%s は狭義単調増加である必要があります。index=%s",
                    name, i);
        }
    }

    /**
     * edges[i] <= v < edges[i+1] となる i を返します。範囲外は -1 です。
     */
    private static int binIndex(double[] edges, double v) {
        if (!(v >= edges[0] && v < edges[edges.length - 1])) {
            return -1;
        }
        int lo = 0;
        int hi = edges.length - 1;
        while (hi - lo > 1) {
            int mid = (lo + hi) >>> 1;
            if (edges[mid] <= v) {
                lo = mid;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}
