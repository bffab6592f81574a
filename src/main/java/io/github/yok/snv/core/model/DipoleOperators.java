package io.github.yok.snv.core.model;

import io.github.yok.snv.core.linearalgebra.ComplexMatrices;
import java.util.function.UnaryOperator;
import lombok.Value;
import org.ejml.data.ZMatrixRMaj;

/**
 * 偏光軸 x, y, z ごとの双極子演算子の組を保持するクラスです。
 *
 * <p>
 * 固定基底（{@link PerturbationTerms} と同じ並び）での生の双極子行列は {@link #raw()} で得られます。 固有基底へ変換した後や、8×8
 * の合成形に並べた後の組も同じクラスで表します。
 * </p>
 */
@Value
public class DipoleOperators {

    /**
     * x 偏光の行列です。
     */
    ZMatrixRMaj x;

    /**
     * y 偏光の行列です。
     */
    ZMatrixRMaj y;

    /**
     * z 偏光の行列です。
     */
    ZMatrixRMaj z;

    /**
     * 固定基底での生の双極子行列（励起 → 基底の遷移要素）を返します。
     *
     * @return x, y, z の 4×4 行列です
     */
    public static DipoleOperators raw() {
        int dim = PerturbationTerms.DIM;

        ZMatrixRMaj px = new ZMatrixRMaj(dim, dim);
        px.set(0, 0, +1.0, 0.0);
        px.set(1, 1, +1.0, 0.0);
        px.set(2, 2, -1.0, 0.0);
        px.set(3, 3, -1.0, 0.0);

        ZMatrixRMaj py = new ZMatrixRMaj(dim, dim);
        py.set(0, 2, -1.0, 0.0);
        py.set(1, 3, -1.0, 0.0);
        py.set(2, 0, -1.0, 0.0);
        py.set(3, 1, -1.0, 0.0);

        // z 偏光は分岐によらず一様で、x, y の 2 倍の強度です。
        ZMatrixRMaj pz = new ZMatrixRMaj(dim, dim);
        for (int i = 0; i < dim; i++) {
            pz.set(i, i, 2.0, 0.0);
        }
        return new DipoleOperators(px, py, pz);
    }

    /**
     * 各軸の行列に同じ変換を適用した組を返します。
     *
     * @param op 行列ごとの変換です
     * @return 変換後の組です
     */
    public DipoleOperators map(UnaryOperator<ZMatrixRMaj> op) {
        return new DipoleOperators(op.apply(x), op.apply(y), op.apply(z));
    }

    /**
     * 複素係数 (re + i im) による重み付き和 w_x D_x + w_y D_y + w_z D_z を返します。
     *
     * @param re 係数の実部（x, y, z の順）です
     * @param im 係数の虚部（x, y, z の順）です
     * @return 重み付き和です
     */
    public ZMatrixRMaj combine(double[] re, double[] im) {
        return ComplexMatrices.linearCombination(re, im, x, y, z);
    }
}
