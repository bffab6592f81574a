package io.github.yok.snv.core.linearalgebra;

import lombok.Value;
import org.ejml.data.ZMatrixRMaj;

/**
 * 固有分解を提供するバックエンドを表すインタフェースです。
 *
 * <p>
 * 使用するライブラリを差し替えやすくするためのインタフェースです。
 * </p>
 */
public interface EigenDecompositionBackend {

    /**
     * 複素 Hermite 行列を固有分解し、固有値昇順の結果を返します。
     *
     * <p>
     * 等しい固有値の間では元の順序を保ちます（安定）。縮退は許容し、エラーにはしません。
     * </p>
     *
     * @param hermitianMatrix 複素 Hermite 行列です
     * @return 固有値昇順の固有分解結果です
     * @throws IllegalArgumentException 入力が null、非正方、または Hermite でない場合に発生します
     * @throws IllegalStateException 固有分解に失敗した場合に発生します
     */
    EigenDecompositionResult decomposeHermitianAndSort(ZMatrixRMaj hermitianMatrix);

    /**
     * 固有分解の結果（固有値・固有ベクトル）を保持するクラスです。
     *
     * <p>
     * 固有ベクトル行列は「列が固有ベクトル」である前提です。
     * </p>
     */
    @Value
    class EigenDecompositionResult {

        /**
         * 固有値配列です（昇順）。
         */
        double[] eigenvalues;

        /**
         * 固有ベクトル行列です（列が固有ベクトルです）。
         */
        ZMatrixRMaj eigenvectors;

        /**
         * 固有対の個数を返します。
         *
         * @return 固有対の個数です
         */
        public int size() {
            return eigenvalues.length;
        }

        /**
         * 隣り合う固有値の差の最小値を返します。固有値が 1 個以下なら正の無限大です。
         *
         * @return 最小の固有値間隔です
         */
        public double minimumGap() {
            double gap = Double.POSITIVE_INFINITY;
            for (int i = 1; i < eigenvalues.length; i++) {
                gap = Math.min(gap, eigenvalues[i] - eigenvalues[i - 1]);
            }
            return gap;
        }

        /**
         * 偶数番目（0, 2, ...）の固有対だけを残した結果を返します。
         *
         * @return 射影した固有分解結果です
         */
        public EigenDecompositionResult evenIndexed() {
            double[] values = new double[(eigenvalues.length + 1) / 2];
            for (int i = 0; i < values.length; i++) {
                values[i] = eigenvalues[2 * i];
            }
            return new EigenDecompositionResult(values, ComplexMatrices.evenColumns(eigenvectors));
        }
    }
}
