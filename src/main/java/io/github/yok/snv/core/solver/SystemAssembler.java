package io.github.yok.snv.core.solver;

import static com.google.common.base.Preconditions.*;

import io.github.yok.snv.core.geometry.CoordinateTransform;
import io.github.yok.snv.core.geometry.FieldVector;
import io.github.yok.snv.core.linearalgebra.ComplexMatrices;
import io.github.yok.snv.core.model.DefectModel;
import io.github.yok.snv.core.model.DipoleOperators;
import io.github.yok.snv.core.parameter.Manifold;
import java.util.Locale;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.ZMatrixRMaj;

/**
 * 磁場から系（固有エネルギー・固有ベクトル・合成双極子演算子）を組み立てるクラスです。
 *
 * <p>
 * 多様体ブロック構築 → 対角化 → 双極子変換 → 合成演算子の配置、の順に処理します。 状態を持たないため、異なる磁場の呼び出しは並列に実行できます。
 * </p>
 */
@Getter
@Slf4j
public final class SystemAssembler {

    /**
     * 縮約系で用いる磁場方向（対称軸 z）です。
     */
    private static final double[] REDUCED_FIELD_DIRECTION = {0.0, 0.0, 1.0};

    /**
     * 多様体ブロックを構築するモデルです。
     */
    private final DefectModel model;

    /**
     * 対角化と双極子変換を行うコンポーネントです。
     */
    private final ManifoldDiagonalizer diagonalizer;

    /**
     * 固有値間隔がこれを下回ったら縮退に近いとみなす閾値（rad·THz）です。
     */
    private final double degeneracyGapThreshold;

    /**
     * 組み立て器を生成します。
     *
     * @param model 多様体ブロックを構築するモデルです（null 不可）
     * @param diagonalizer 対角化器です（null 不可）
     * @param degeneracyGapThreshold 縮退判定の閾値です（0 以上）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public SystemAssembler(DefectModel model, ManifoldDiagonalizer diagonalizer,
            double degeneracyGapThreshold) {
        checkArgument(model != null, "model は null 不可です");
        checkArgument(diagonalizer != null, "diagonalizer は null 不可です");
        checkArgument(degeneracyGapThreshold >= 0.0 && !Double.isInfinite(degeneracyGapThreshold),
                "degeneracyGapThreshold は 0 以上の有限値が必要です: %s", degeneracyGapThreshold);
        this.model = model;
        this.diagonalizer = diagonalizer;
        this.degeneracyGapThreshold = degeneracyGapThreshold;
    }

    /**
     * 磁場の大きさと方向（対称軸座標）から系を組み立てます。
     *
     * @param fieldMagnitude 磁場の大きさです
     * @param fieldDirection 磁場の方向（長さ 3、零ベクトル不可）です
     * @param strainEnabled 歪み応答項を含めるかどうかです
     * @return 組み立て結果です
     * @throws IllegalArgumentException 方向ベクトルが不正な場合に発生します
     */
    public SystemResult assemble(double fieldMagnitude, double[] fieldDirection,
            boolean strainEnabled) {
        FieldVector field = CoordinateTransform.normalizeAndScale(fieldMagnitude, fieldDirection);
        return assemble(field, strainEnabled);
    }

    /**
     * 磁場ベクトル（対称軸座標）から系を組み立てます。
     *
     * @param field 磁場ベクトルです（null 不可）
     * @param strainEnabled 歪み応答項を含めるかどうかです
     * @return 組み立て結果です
     */
    public SystemResult assemble(FieldVector field, boolean strainEnabled) {
        ManifoldSolution solution = solve(field, strainEnabled);
        return toResult(solution, solution.minimumGap(), field);
    }

    /**
     * 対称軸 z 方向の磁場で、多様体あたり 2 準位に縮約した系を組み立てます。
     *
     * <p>
     * 完全解を求めてから偶数番目の固有対だけを残すため、エネルギーは完全系の偶数番目と一致します。
     * </p>
     *
     * @param fieldMagnitude 磁場の大きさです
     * @param strainEnabled 歪み応答項を含めるかどうかです
     * @return 4×4 の合成演算子を持つ組み立て結果です
     */
    public SystemResult assembleReduced(double fieldMagnitude, boolean strainEnabled) {
        FieldVector field =
                CoordinateTransform.normalizeAndScale(fieldMagnitude, REDUCED_FIELD_DIRECTION);
        return reduce(field, strainEnabled);
    }

    /**
     * 任意の磁場ベクトルについて、完全解を縮約した系を組み立てます。
     *
     * @param field 磁場ベクトル（対称軸座標）です
     * @param strainEnabled 歪み応答項を含めるかどうかです
     * @return 縮約系の組み立て結果です
     */
    public SystemResult reduce(FieldVector field, boolean strainEnabled) {
        ManifoldSolution full = solve(field, strainEnabled);
        return toResult(full.reduced(), full.minimumGap(), field);
    }

    /**
     * 両多様体のブロックを構築して対角化します。
     *
     * @param field 磁場ベクトルです
     * @param strainEnabled 歪み応答項を含めるかどうかです
     * @return 完全解です
     */
    private ManifoldSolution solve(FieldVector field, boolean strainEnabled) {
        checkArgument(field != null, "field は null 不可です");
        ZMatrixRMaj groundBlock = model.buildManifold(Manifold.GROUND, field, strainEnabled);
        ZMatrixRMaj excitedBlock = model.buildManifold(Manifold.EXCITED, field, strainEnabled);
        return diagonalizer.solve(groundBlock, excitedBlock);
    }

    /**
     * 解から合成双極子演算子を配置して結果にまとめます。
     *
     * @param solution 完全解または縮約解です
     * @param minimumGap 完全解の最小固有値間隔です
     * @param field 磁場ベクトル（ログ用）です
     * @return 組み立て結果です
     */
    private SystemResult toResult(ManifoldSolution solution, double minimumGap,
            FieldVector field) {
        int m = solution.getGround().size();
        DipoleOperators composite = solution.getTransitions().map(g -> compose(g, m));

        boolean nearDegenerate = minimumGap < degeneracyGapThreshold;
        if (nearDegenerate) {
            log.warn("固有値が縮退に近いため、固有ベクトルは縮退部分空間内で一意ではありません。最小間隔={}、閾値={}、B=({}, {}, {})",
                    fmt(minimumGap), fmt(degeneracyGapThreshold), fmt(field.getX()),
                    fmt(field.getY()), fmt(field.getZ()));
        }
        log.debug("系を組み立てました。dim={}、B=({}, {}, {})、最小固有値間隔={}", 2 * m, fmt(field.getX()),
                fmt(field.getY()), fmt(field.getZ()), fmt(minimumGap));

        return new SystemResult(solution.getGround().getEigenvalues(),
                solution.getExcited().getEigenvalues(), solution.getGround().getEigenvectors(),
                solution.getExcited().getEigenvectors(), composite, minimumGap, nearDegenerate);
    }

    /**
     * m×m の遷移行列 G から 2m×2m の Hermite 合成演算子 [[0, G], [G†, 0]] を作ります。
     *
     * @param transition 遷移行列 G です
     * @param m 多様体あたりの状態数です
     * @return 合成演算子です
     */
    private static ZMatrixRMaj compose(ZMatrixRMaj transition, int m) {
        ZMatrixRMaj out = new ZMatrixRMaj(2 * m, 2 * m);
        ComplexMatrices.insert(transition, out, 0, m);
        ComplexMatrices.insert(ComplexMatrices.dagger(transition), out, m, 0);
        return out;
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.6g", v);
    }
}
