package io.github.yok.snv.core.solver;

import io.github.yok.snv.core.linearalgebra.ComplexMatrices;
import io.github.yok.snv.core.linearalgebra.EigenDecompositionBackend.EigenDecompositionResult;
import io.github.yok.snv.core.model.DipoleOperators;
import lombok.Value;

/**
 * 基底・励起の両多様体を対角化し、双極子演算子を固有基底へ変換した結果です。
 */
@Value
public class ManifoldSolution {

    /**
     * 基底多様体の固有分解結果です。
     */
    EigenDecompositionResult ground;

    /**
     * 励起多様体の固有分解結果です。
     */
    EigenDecompositionResult excited;

    /**
     * 固有基底での遷移行列 V_g† D V_u（行: 基底固有状態、列: 励起固有状態）です。
     */
    DipoleOperators transitions;

    /**
     * 両多様体の固有値間隔の最小値を返します。
     *
     * @return 最小の固有値間隔です
     */
    public double minimumGap() {
        return Math.min(ground.minimumGap(), excited.minimumGap());
    }

    /**
     * 各多様体で偶数番目の固有対だけを残した縮約解を返します。
     *
     * <p>
     * 完全解からの射影として作るため、縮約解と完全解が食い違うことはありません。
     * </p>
     *
     * @return 縮約解です
     */
    public ManifoldSolution reduced() {
        return new ManifoldSolution(ground.evenIndexed(), excited.evenIndexed(),
                transitions.map(ComplexMatrices::evenRowsAndColumns));
    }
}
