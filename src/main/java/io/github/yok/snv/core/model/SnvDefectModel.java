package io.github.yok.snv.core.model;

import io.github.yok.snv.core.geometry.FieldVector;
import io.github.yok.snv.core.linearalgebra.ComplexMatrices;
import io.github.yok.snv.core.parameter.Manifold;
import io.github.yok.snv.core.parameter.ManifoldParameters;
import io.github.yok.snv.core.parameter.MaterialParameters;
import lombok.Getter;
import org.ejml.data.ZMatrixRMaj;
import org.ejml.dense.row.CommonOps_ZDRM;

/**
 * 群 IV 空孔（SnV）中心のハミルトニアンモデルです。
 *
 * <p>
 * 各多様体のブロックは H = H_SO + H_JT + H_ZL(B) + H_ZS(B) (+ H_strain) とし、 励起多様体には対角にゼロフォノン線エネルギーを加えます。
 * </p>
 */
@Getter
public final class SnvDefectModel implements DefectModel {

    /**
     * 物質パラメータです。
     */
    private final MaterialParameters parameters;

    /**
     * モデルを生成します。
     *
     * @param parameters 物質パラメータです（null 不可）
     * @throws IllegalArgumentException parameters が null の場合に発生します
     */
    public SnvDefectModel(MaterialParameters parameters) {
        if (parameters == null) {
            throw new IllegalArgumentException("parameters は null 不可です");
        }
        this.parameters = parameters;
    }

    /**
     * 1 つの多様体の状態数（4）を返します。
     *
     * @return 状態数です
     */
    @Override
    public int manifoldDimension() {
        return PerturbationTerms.DIM;
    }

    /**
     * 多様体ブロック（4×4 Hermite 行列）を構築して返します。
     *
     * @param manifold 多様体です（null 不可）
     * @param field 磁場ベクトル（対称軸座標、null 不可）です
     * @param strainEnabled 歪み応答項を含めるかどうかです
     * @return 多様体ブロックです
     * @throws IllegalArgumentException manifold または field が null の場合に発生します
     */
    @Override
    public ZMatrixRMaj buildManifold(Manifold manifold, FieldVector field, boolean strainEnabled) {
        if (field == null) {
            throw new IllegalArgumentException("field は null 不可です");
        }
        ManifoldParameters p = parameters.manifold(manifold);

        ZMatrixRMaj block = PerturbationTerms.spinOrbit(p.getSpinOrbit());
        CommonOps_ZDRM.add(block, PerturbationTerms.jahnTeller(p.getJahnTellerX(),
                p.getJahnTellerY()), block);
        CommonOps_ZDRM.add(block, PerturbationTerms.orbitalZeeman(field, parameters.getGammaL(),
                p.getOrbitalZeemanFactor()), block);
        CommonOps_ZDRM.add(block, PerturbationTerms.spinZeeman(field, parameters.getGammaS()),
                block);
        if (strainEnabled) {
            CommonOps_ZDRM.add(block, PerturbationTerms.strain(p.getStrainAlpha(),
                    p.getStrainBeta(), p.getStrainDelta()), block);
        }

        if (manifold == Manifold.EXCITED) {
            double zpl = parameters.getZeroPhononLine();
            for (int i = 0; i < block.numRows; i++) {
                block.set(i, i, block.getReal(i, i) + zpl, block.getImag(i, i));
            }
        }
        return block;
    }

    /**
     * 励起ブロックを [0,4)、基底ブロックを [4,8) に置いた 8×8 ブロック対角行列を返します。
     *
     * @param field 磁場ベクトル（対称軸座標）です
     * @param strainEnabled 歪み応答項を含めるかどうかです
     * @return 合成ハミルトニアンです
     */
    @Override
    public ZMatrixRMaj buildComposite(FieldVector field, boolean strainEnabled) {
        int n = manifoldDimension();
        ZMatrixRMaj composite = new ZMatrixRMaj(2 * n, 2 * n);
        ComplexMatrices.insert(buildManifold(Manifold.EXCITED, field, strainEnabled), composite,
                0, 0);
        ComplexMatrices.insert(buildManifold(Manifold.GROUND, field, strainEnabled), composite, n,
                n);
        return composite;
    }
}
