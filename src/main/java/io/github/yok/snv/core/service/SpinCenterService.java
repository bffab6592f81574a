package io.github.yok.snv.core.service;

import static com.google.common.base.Preconditions.*;

import io.github.yok.snv.core.basis.BasisExpander;
import io.github.yok.snv.core.geometry.CoordinateFrame;
import io.github.yok.snv.core.geometry.CoordinateTransform;
import io.github.yok.snv.core.geometry.FieldVector;
import io.github.yok.snv.core.model.DefectModel;
import io.github.yok.snv.core.solver.Polarization;
import io.github.yok.snv.core.solver.SystemAssembler;
import io.github.yok.snv.core.solver.SystemResult;
import lombok.Getter;
import org.ejml.data.DMatrixRMaj;
import org.ejml.data.ZMatrixRMaj;

/**
 * スピン中心の演算子（ハミルトニアン・エネルギー・双極子・拡大演算子）を提供する公開窓口です。
 *
 * <p>
 * 合成ハミルトニアン以外の演算は歪み応答項なしで計算します。 方向ベクトルは、{@link #compositeHamiltonian} が格子座標、それ以外は対称軸座標で受け取ります。
 * 角度指定の演算は磁場を x–z 面内 (cos φ, 0, sin φ) に限ります。
 * </p>
 */
@Getter
public final class SpinCenterService {

    /**
     * 多様体ブロックを構築するモデルです。
     */
    private final DefectModel model;

    /**
     * 系の組み立て器です。
     */
    private final SystemAssembler assembler;

    /**
     * 引数省略時の既定値です。
     */
    private final OperatorDefaults defaults;

    /**
     * 公開窓口を生成します。
     *
     * @param model モデルです（null 不可）
     * @param assembler 組み立て器です（null 不可）
     * @param defaults 既定値です（null 不可）
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    public SpinCenterService(DefectModel model, SystemAssembler assembler,
            OperatorDefaults defaults) {
        checkArgument(model != null, "model は null 不可です");
        checkArgument(assembler != null, "assembler は null 不可です");
        checkArgument(defaults != null, "defaults は null 不可です");
        this.model = model;
        this.assembler = assembler;
        this.defaults = defaults;
    }

    /**
     * 既定方向 [0,0,1]（格子座標）の磁場で合成ハミルトニアンを返します。
     *
     * @param fieldMagnitude 磁場の大きさです
     * @param strainEnabled 歪み応答項を含めるかどうかです
     * @return 8×8 の合成ハミルトニアン（励起ブロックが先頭）です
     */
    public ZMatrixRMaj compositeHamiltonian(double fieldMagnitude, boolean strainEnabled) {
        return compositeHamiltonian(fieldMagnitude, strainEnabled, defaults.getFieldDirection());
    }

    /**
     * 格子座標で与えた方向の磁場で合成ハミルトニアンを返します。
     *
     * @param fieldMagnitude 磁場の大きさです
     * @param strainEnabled 歪み応答項を含めるかどうかです
     * @param latticeDirection 磁場の方向（格子座標）です
     * @return 8×8 の合成ハミルトニアンです
     */
    public ZMatrixRMaj compositeHamiltonian(double fieldMagnitude, boolean strainEnabled,
            double[] latticeDirection) {
        return compositeHamiltonian(fieldMagnitude, strainEnabled, latticeDirection,
                CoordinateFrame.LATTICE);
    }

    /**
     * 指定した座標系で与えた方向の磁場で合成ハミルトニアンを返します。
     *
     * @param fieldMagnitude 磁場の大きさです
     * @param strainEnabled 歪み応答項を含めるかどうかです
     * @param direction 磁場の方向です
     * @param frame direction の座標系です（null 不可）
     * @return 8×8 の合成ハミルトニアンです
     */
    public ZMatrixRMaj compositeHamiltonian(double fieldMagnitude, boolean strainEnabled,
            double[] direction, CoordinateFrame frame) {
        if (frame == null) {
            throw new IllegalArgumentException("frame は null 不可です");
        }
        FieldVector field =
                CoordinateTransform.normalizeAndScale(fieldMagnitude, frame.toSymmetry(direction));
        return model.buildComposite(field, strainEnabled);
    }

    /**
     * 既定方向の磁場で系を組み立てます。
     *
     * @param fieldMagnitude 磁場の大きさです
     * @param strainEnabled 歪み応答項を含めるかどうかです
     * @return 組み立て結果です
     */
    public SystemResult assembleSystem(double fieldMagnitude, boolean strainEnabled) {
        return assembleSystem(fieldMagnitude, strainEnabled, defaults.getFieldDirection());
    }

    /**
     * 対称軸座標で与えた方向の磁場で系を組み立てます。
     *
     * @param fieldMagnitude 磁場の大きさです
     * @param strainEnabled 歪み応答項を含めるかどうかです
     * @param fieldDirection 磁場の方向（対称軸座標）です
     * @return 組み立て結果です
     */
    public SystemResult assembleSystem(double fieldMagnitude, boolean strainEnabled,
            double[] fieldDirection) {
        return assembler.assemble(fieldMagnitude, fieldDirection, strainEnabled);
    }

    /**
     * 対称軸 z 方向の磁場で、多様体あたり 2 準位に縮約した系を組み立てます。
     *
     * @param fieldMagnitude 磁場の大きさです
     * @param strainEnabled 歪み応答項を含めるかどうかです
     * @return 縮約系の組み立て結果です
     */
    public SystemResult assembleReducedSystem(double fieldMagnitude, boolean strainEnabled) {
        return assembler.assembleReduced(fieldMagnitude, strainEnabled);
    }

    /**
     * 既定の磁場での固有エネルギー（基底 → 励起）を返します。
     *
     * @return 長さ 8 のエネルギー配列です
     */
    public double[] energies() {
        return energies(defaults.getFieldMagnitude(), defaults.getFieldDirection());
    }

    /**
     * 固有エネルギー（基底 → 励起）を返します。
     *
     * @param fieldMagnitude 磁場の大きさです
     * @param fieldDirection 磁場の方向（対称軸座標）です
     * @return 長さ 8 のエネルギー配列です
     */
    public double[] energies(double fieldMagnitude, double[] fieldDirection) {
        return system(fieldMagnitude, fieldDirection, false).energies();
    }

    /**
     * 電子固有エネルギーを並べた dim×dim の対角行列を返します。
     *
     * @param fieldMagnitude 磁場の大きさです
     * @param fieldDirection 磁場の方向（対称軸座標）です
     * @param reduced true なら多様体あたり 2 準位（dim=4）、false なら全準位（dim=8）です
     * @return 対角行列です
     */
    public DMatrixRMaj electronicEnergyOperator(double fieldMagnitude, double[] fieldDirection,
            boolean reduced) {
        return BasisExpander
                .electronicEnergyOperator(system(fieldMagnitude, fieldDirection, reduced).energies());
    }

    /**
     * 既定の磁場での合成双極子行列を返します。
     *
     * @param polarization 偏光です
     * @return 8×8 の行列です
     */
    public ZMatrixRMaj dipoleMatrix(Polarization polarization) {
        return dipoleMatrix(polarization, defaults.getFieldMagnitude(),
                defaults.getFieldDirection());
    }

    /**
     * 合成双極子行列 w_x P_x + w_y P_y + w_z P_z を返します。
     *
     * @param polarization 偏光です
     * @param fieldMagnitude 磁場の大きさです
     * @param fieldDirection 磁場の方向（対称軸座標）です
     * @return 8×8 の行列です
     */
    public ZMatrixRMaj dipoleMatrix(Polarization polarization, double fieldMagnitude,
            double[] fieldDirection) {
        return system(fieldMagnitude, fieldDirection, false).dipole(polarization);
    }

    /**
     * x–z 面内の角度 φ で与えた磁場での合成双極子行列を返します。
     *
     * @param polarization 偏光です
     * @param phi 対称軸 x から z へ測った角度 [rad] です
     * @param fieldMagnitude 磁場の大きさです
     * @return 8×8 の行列です
     */
    public ZMatrixRMaj dipoleMatrixByAngle(Polarization polarization, double phi,
            double fieldMagnitude) {
        return dipoleMatrix(polarization, fieldMagnitude, inPlaneDirection(phi));
    }

    /**
     * 既定の磁場での拡大エネルギー演算子（全準位）を返します。
     *
     * @return 16×16 の実対角行列です
     */
    public DMatrixRMaj enlargedEnergyOperator() {
        return enlargedEnergyOperator(defaults.getFieldMagnitude(), defaults.getFieldDirection(),
                false);
    }

    /**
     * 拡大エネルギー演算子を返します。
     *
     * @param fieldMagnitude 磁場の大きさです
     * @param fieldDirection 磁場の方向（対称軸座標）です
     * @param reduced true なら縮約系（dim=4）から作ります
     * @return (2·dim)×(2·dim) の実対角行列です
     */
    public DMatrixRMaj enlargedEnergyOperator(double fieldMagnitude, double[] fieldDirection,
            boolean reduced) {
        return BasisExpander.energyOperator(system(fieldMagnitude, fieldDirection, reduced));
    }

    /**
     * 既定の磁場での拡大結合演算子を返します。
     *
     * @param polarization 偏光です
     * @return 16×16 の複素行列です
     */
    public ZMatrixRMaj enlargedCouplingOperator(Polarization polarization) {
        return enlargedCouplingOperator(polarization, defaults.getFieldMagnitude(),
                defaults.getFieldDirection());
    }

    /**
     * 拡大結合演算子を返します。
     *
     * @param polarization 偏光です
     * @param fieldMagnitude 磁場の大きさです
     * @param fieldDirection 磁場の方向（対称軸座標）です
     * @return 16×16 の複素行列です
     */
    public ZMatrixRMaj enlargedCouplingOperator(Polarization polarization, double fieldMagnitude,
            double[] fieldDirection) {
        return BasisExpander.couplingOperator(system(fieldMagnitude, fieldDirection, false),
                polarization);
    }

    /**
     * x–z 面内の角度 φ で与えた磁場での拡大結合演算子を返します。
     *
     * @param polarization 偏光です
     * @param phi 対称軸 x から z へ測った角度 [rad] です
     * @param fieldMagnitude 磁場の大きさです
     * @return 16×16 の複素行列です
     */
    public ZMatrixRMaj enlargedCouplingOperatorByAngle(Polarization polarization, double phi,
            double fieldMagnitude) {
        return enlargedCouplingOperator(polarization, fieldMagnitude, inPlaneDirection(phi));
    }

    /**
     * 歪みなしの系（完全または縮約）を組み立てます。
     */
    private SystemResult system(double fieldMagnitude, double[] fieldDirection, boolean reduced) {
        if (!reduced) {
            return assembler.assemble(fieldMagnitude, fieldDirection, false);
        }
        FieldVector field = CoordinateTransform.normalizeAndScale(fieldMagnitude, fieldDirection);
        return assembler.reduce(field, false);
    }

    /**
     * x–z 面内の方向 (cos φ, 0, sin φ) を返します。y 成分は常に 0 です。
     */
    private static double[] inPlaneDirection(double phi) {
        if (!Double.isFinite(phi)) {
            throw new IllegalArgumentException("phi は有限値を指定してください: " + phi);
        }
        return new double[] {Math.cos(phi), 0.0, Math.sin(phi)};
    }
}
