package io.github.yok.snv.core.solver;

import static com.google.common.base.Preconditions.*;

import io.github.yok.snv.core.linearalgebra.ComplexMatrices;
import io.github.yok.snv.core.linearalgebra.EigenDecompositionBackend;
import io.github.yok.snv.core.linearalgebra.EigenDecompositionBackend.EigenDecompositionResult;
import io.github.yok.snv.core.model.DipoleOperators;
import lombok.Getter;
import org.ejml.data.ZMatrixRMaj;

/**
 * 多様体ブロックを対角化し、双極子演算子を固有基底へ変換するクラスです。
 *
 * <p>
 * 縮約版（偶数番目の固有対のみ）はすべて完全版の結果からの射影として計算します。
 * </p>
 */
public final class ManifoldDiagonalizer {

    /**
     * 固有分解バックエンドです。
     */
    @Getter
    private final EigenDecompositionBackend eigenBackend;

    /**
     * 固定基底での生の双極子行列です。
     */
    private final DipoleOperators rawDipoles;

    /**
     * 対角化器を生成します。
     *
     * @param eigenBackend 固有分解バックエンドです（null 不可）
     * @param rawDipoles 固定基底での双極子行列です（null 不可）
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    public ManifoldDiagonalizer(EigenDecompositionBackend eigenBackend,
            DipoleOperators rawDipoles) {
        checkArgument(eigenBackend != null, "eigenBackend は null 不可です");
        checkArgument(rawDipoles != null, "rawDipoles は null 不可です");
        this.eigenBackend = eigenBackend;
        this.rawDipoles = rawDipoles;
    }

    /**
     * 固定基底での生の双極子行列の複製を返します。
     *
     * <p>
     * 内部の行列は全呼び出しで共有するため、呼び出し側には複製だけを渡します。
     * </p>
     *
     * @return 双極子行列の複製です
     */
    public DipoleOperators getRawDipoles() {
        return rawDipoles.map(ZMatrixRMaj::copy);
    }

    /**
     * 多様体ブロックを対角化し、固有値昇順の結果を返します。
     *
     * @param block 多様体ブロック（Hermite 行列）です
     * @return 固有分解結果です
     */
    public EigenDecompositionResult diagonalize(ZMatrixRMaj block) {
        return eigenBackend.decomposeHermitianAndSort(block);
    }

    /**
     * 多様体ブロックを対角化し、偶数番目の固有対だけを返します。
     *
     * @param block 多様体ブロック（Hermite 行列）です
     * @return 射影した固有分解結果です
     */
    public EigenDecompositionResult diagonalizeReduced(ZMatrixRMaj block) {
        return diagonalize(block).evenIndexed();
    }

    /**
     * 各偏光軸の双極子行列 D を V_g† D V_u へ変換します。
     *
     * @param raw 固定基底での双極子行列です
     * @param groundVectors 基底多様体の固有ベクトル行列 V_g です
     * @param excitedVectors 励起多様体の固有ベクトル行列 V_u です
     * @return 固有基底での遷移行列です
     */
    public static DipoleOperators transformDipole(DipoleOperators raw, ZMatrixRMaj groundVectors,
            ZMatrixRMaj excitedVectors) {
        if (raw == null || groundVectors == null || excitedVectors == null) {
            throw new IllegalArgumentException("raw, groundVectors, excitedVectors は null 不可です");
        }
        return raw.map(d -> ComplexMatrices.sandwich(groundVectors, d, excitedVectors));
    }

    /**
     * {@link #transformDipole} の結果から偶数番目の行・列だけを取り出します。
     *
     * @param raw 固定基底での双極子行列です
     * @param groundVectors 基底多様体の固有ベクトル行列（完全版）です
     * @param excitedVectors 励起多様体の固有ベクトル行列（完全版）です
     * @return 射影した遷移行列です
     */
    public static DipoleOperators transformDipoleReduced(DipoleOperators raw,
            ZMatrixRMaj groundVectors, ZMatrixRMaj excitedVectors) {
        return transformDipole(raw, groundVectors, excitedVectors)
                .map(ComplexMatrices::evenRowsAndColumns);
    }

    /**
     * 両多様体を対角化し、双極子演算子を固有基底へ変換します。
     *
     * @param groundBlock 基底多様体ブロックです
     * @param excitedBlock 励起多様体ブロックです
     * @return 完全解です
     */
    public ManifoldSolution solve(ZMatrixRMaj groundBlock, ZMatrixRMaj excitedBlock) {
        EigenDecompositionResult ground = diagonalize(groundBlock);
        EigenDecompositionResult excited = diagonalize(excitedBlock);
        DipoleOperators transitions =
                transformDipole(rawDipoles, ground.getEigenvectors(), excited.getEigenvectors());
        return new ManifoldSolution(ground, excited, transitions);
    }
}
