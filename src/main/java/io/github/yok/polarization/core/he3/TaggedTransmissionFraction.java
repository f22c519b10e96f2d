package io.github.yok.polarization.core.he3;

import io.github.yok.polarization.core.directbeam.BeamData;
import io.github.yok.polarization.core.model.PlusMinus;
import lombok.Value;

/**
 * plus/minus のタグを付けた透過率データです。
 *
 * <p>
 * 偏極ビーム入射の校正で、どの固有チャネルを測ったかを表します。タグが未設定の場合は null です。
 * </p>
 */
@Value
public class TaggedTransmissionFraction {

    /**
     * 固有チャネルのタグです（未設定は null）。
     */
    PlusMinus plusMinus;

    /**
     * 透過率データです。
     */
    BeamData transmissionFraction;
}
