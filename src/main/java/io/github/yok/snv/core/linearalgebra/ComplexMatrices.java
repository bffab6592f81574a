package io.github.yok.snv.core.linearalgebra;

import org.ejml.data.ZMatrixRMaj;
import org.ejml.dense.row.CommonOps_ZDRM;
import org.ejml.dense.row.MatrixFeatures_ZDRM;

/**
 * 複素行列（EJML の {@link ZMatrixRMaj}）に対する補助演算をまとめたクラスです。
 */
public final class ComplexMatrices {

    private ComplexMatrices() {
    }

    /**
     * 行列が Hermite（M = M†）であることを検証します。
     *
     * @param name 引数名です（メッセージ用）
     * @param matrix 検証対象です
     * @param tolerance 許容誤差（絶対値）です
     * @throws IllegalArgumentException null、非正方、または Hermite でない場合に発生します
     */
    public static void requireHermitian(String name, ZMatrixRMaj matrix, double tolerance) {
        if (matrix == null) {
            throw new IllegalArgumentException(name + " は null 不可です");
        }
        if (matrix.numRows != matrix.numCols) {
            throw new IllegalArgumentException(
                    name + " は正方行列が必要です: " + matrix.numRows + "x" + matrix.numCols);
        }
        if (!MatrixFeatures_ZDRM.isHermitian(matrix, tolerance)) {
            throw new IllegalArgumentException(name + " が Hermite 行列ではありません（許容誤差=" + tolerance + "）");
        }
    }

    /**
     * a† · b · c を計算して新しい行列で返します。
     *
     * @param a 左から共役転置で掛ける行列です
     * @param b 中央の行列です
     * @param c 右から掛ける行列です
     * @return a† b c です
     */
    public static ZMatrixRMaj sandwich(ZMatrixRMaj a, ZMatrixRMaj b, ZMatrixRMaj c) {
        ZMatrixRMaj aDagger = new ZMatrixRMaj(a.numCols, a.numRows);
        CommonOps_ZDRM.transposeConjugate(a, aDagger);

        ZMatrixRMaj bc = new ZMatrixRMaj(b.numRows, c.numCols);
        CommonOps_ZDRM.mult(b, c, bc);

        ZMatrixRMaj out = new ZMatrixRMaj(aDagger.numRows, bc.numCols);
        CommonOps_ZDRM.mult(aDagger, bc, out);
        return out;
    }

    /**
     * 共役転置を新しい行列で返します。
     *
     * @param matrix 対象行列です
     * @return 共役転置です
     */
    public static ZMatrixRMaj dagger(ZMatrixRMaj matrix) {
        ZMatrixRMaj out = new ZMatrixRMaj(matrix.numCols, matrix.numRows);
        CommonOps_ZDRM.transposeConjugate(matrix, out);
        return out;
    }

    /**
     * src を dest の (row0, col0) を左上とする位置へ書き込みます。
     *
     * @param src 書き込む行列です
     * @param dest 書き込み先です
     * @param row0 先頭行です
     * @param col0 先頭列です
     */
    public static void insert(ZMatrixRMaj src, ZMatrixRMaj dest, int row0, int col0) {
        if (row0 < 0 || col0 < 0 || row0 + src.numRows > dest.numRows
                || col0 + src.numCols > dest.numCols) {
            throw new IllegalArgumentException("書き込み位置が範囲外です: (" + row0 + "," + col0 + ") "
                    + src.numRows + "x" + src.numCols + " -> " + dest.numRows + "x" + dest.numCols);
        }
        for (int row = 0; row < src.numRows; row++) {
            for (int col = 0; col < src.numCols; col++) {
                dest.set(row0 + row, col0 + col, src.getReal(row, col), src.getImag(row, col));
            }
        }
    }

    /**
     * 偶数番目（0, 2, ...）の行と列だけを取り出した行列を返します。
     *
     * @param matrix 対象行列です
     * @return 射影した行列です
     */
    public static ZMatrixRMaj evenRowsAndColumns(ZMatrixRMaj matrix) {
        int rows = (matrix.numRows + 1) / 2;
        int cols = (matrix.numCols + 1) / 2;
        ZMatrixRMaj out = new ZMatrixRMaj(rows, cols);
        for (int row = 0; row < rows; row++) {
            for (int col = 0; col < cols; col++) {
                out.set(row, col, matrix.getReal(2 * row, 2 * col),
                        matrix.getImag(2 * row, 2 * col));
            }
        }
        return out;
    }

    /**
     * 偶数番目（0, 2, ...）の列だけを取り出した行列を返します。
     *
     * @param matrix 対象行列です
     * @return 射影した行列です
     */
    public static ZMatrixRMaj evenColumns(ZMatrixRMaj matrix) {
        int cols = (matrix.numCols + 1) / 2;
        ZMatrixRMaj out = new ZMatrixRMaj(matrix.numRows, cols);
        for (int row = 0; row < matrix.numRows; row++) {
            for (int col = 0; col < cols; col++) {
                out.set(row, col, matrix.getReal(row, 2 * col), matrix.getImag(row, 2 * col));
            }
        }
        return out;
    }

    /**
     * 複素係数 (re_k + i im_k) による線形結合 Σ_k w_k M_k を返します。
     *
     * @param re 係数の実部です
     * @param im 係数の虚部です
     * @param matrices 同じ形状の行列です
     * @return 線形結合です
     */
    public static ZMatrixRMaj linearCombination(double[] re, double[] im,
            ZMatrixRMaj... matrices) {
        if (re.length != matrices.length || im.length != matrices.length) {
            throw new IllegalArgumentException("係数と行列の個数が一致しません: " + re.length + ", "
                    + im.length + " vs " + matrices.length);
        }
        ZMatrixRMaj out = new ZMatrixRMaj(matrices[0].numRows, matrices[0].numCols);
        for (int k = 0; k < matrices.length; k++) {
            ZMatrixRMaj m = matrices[k];
            if (re[k] == 0.0 && im[k] == 0.0) {
                continue;
            }
            for (int row = 0; row < m.numRows; row++) {
                for (int col = 0; col < m.numCols; col++) {
                    double mr = m.getReal(row, col);
                    double mi = m.getImag(row, col);
                    double r = out.getReal(row, col) + re[k] * mr - im[k] * mi;
                    double i = out.getImag(row, col) + re[k] * mi + im[k] * mr;
                    out.set(row, col, r, i);
                }
            }
        }
        return out;
    }
}
