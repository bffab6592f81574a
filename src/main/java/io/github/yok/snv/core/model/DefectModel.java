package io.github.yok.snv.core.model;

import io.github.yok.snv.core.geometry.FieldVector;
import io.github.yok.snv.core.parameter.Manifold;
import org.ejml.data.ZMatrixRMaj;

/**
 * 磁場と歪みの有無から多様体ごとのハミルトニアンを構築するモデルを表すインタフェースです。
 *
 * <p>
 * 欠陥の種類（結合定数・摂動項の組み合わせ）を差し替えるための境界です。
 * </p>
 */
public interface DefectModel {

    /**
     * 1 つの多様体の状態数を返します。
     *
     * @return 状態数です
     */
    int manifoldDimension();

    /**
     * 多様体ブロック（Hermite 行列）を構築して返します。
     *
     * @param manifold 多様体です
     * @param field 磁場ベクトル（対称軸座標）です
     * @param strainEnabled 歪み応答項を含めるかどうかです
     * @return 多様体ブロックです
     */
    ZMatrixRMaj buildManifold(Manifold manifold, FieldVector field, boolean strainEnabled);

    /**
     * 励起ブロックを [0, n)、基底ブロックを [n, 2n) に置いたブロック対角行列を返します。
     *
     * @param field 磁場ベクトル（対称軸座標）です
     * @param strainEnabled 歪み応答項を含めるかどうかです
     * @return 2n×2n の合成ハミルトニアンです
     */
    ZMatrixRMaj buildComposite(FieldVector field, boolean strainEnabled);
}
