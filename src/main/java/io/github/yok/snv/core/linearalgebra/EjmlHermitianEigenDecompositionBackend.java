package io.github.yok.snv.core.linearalgebra;

import java.util.Arrays;
import org.ejml.data.DMatrixRMaj;
import org.ejml.data.ZMatrixRMaj;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.EigenDecomposition_F64;

/**
 * EJML を用いて、複素 Hermite 行列の固有分解を行うクラスです。
 *
 * <p>
 * n×n の Hermite 行列 H = A + iB を 2n×2n の実対称行列 [[A, -B], [B, A]] に埋め込み、 EJML の対称固有分解で解きます。
 * 実対称側の固有ベクトル (u; v) は H の固有ベクトル u + iv に対応し、各固有値は 2 重に現れます。 そこから n 本の正規直交な複素固有ベクトルを
 * ピボット付き Gram-Schmidt で取り出し、固有値を昇順に並べ替えて返します。
 * </p>
 */
public final class EjmlHermitianEigenDecompositionBackend implements EigenDecompositionBackend {

    /**
     * Hermite 性検証の既定の許容誤差です。
     */
    public static final double DEFAULT_HERMITIAN_TOLERANCE = 1e-9;

    /**
     * 取り出し時に残差ノルムがこれを下回ったら失敗とみなす閾値です。
     */
    private static final double MIN_PIVOT_NORM = 1e-6;

    /**
     * Hermite 性検証の許容誤差です。
     */
    private final double hermitianTolerance;

    /**
     * 既定の許容誤差でバックエンドを生成します。
     */
    public EjmlHermitianEigenDecompositionBackend() {
        this(DEFAULT_HERMITIAN_TOLERANCE);
    }

    /**
     * バックエンドを生成します。
     *
     * @param hermitianTolerance Hermite 性検証の許容誤差です（0 以上）
     * @throws IllegalArgumentException hermitianTolerance が負または有限値でない場合に発生します
     */
    public EjmlHermitianEigenDecompositionBackend(double hermitianTolerance) {
        if (!(hermitianTolerance >= 0.0) || Double.isInfinite(hermitianTolerance)) {
            throw new IllegalArgumentException(
                    "hermitianTolerance は 0 以上の有限値が必要です: " + hermitianTolerance);
        }
        this.hermitianTolerance = hermitianTolerance;
    }

    /**
     * 複素 Hermite 行列を固有分解し、固有値昇順の結果を返します。
     *
     * @param hermitianMatrix 複素 Hermite 行列です
     * @return 固有値昇順の固有分解結果です
     * @throws IllegalArgumentException 入力が null、非正方、または Hermite でない場合に発生します
     * @throws IllegalStateException 固有分解に失敗した場合に発生します
     */
    @Override
    public EigenDecompositionResult decomposeHermitianAndSort(ZMatrixRMaj hermitianMatrix) {
        ComplexMatrices.requireHermitian("hermitianMatrix", hermitianMatrix, hermitianTolerance);

        int dim = hermitianMatrix.numRows;

        // 1) 実対称行列へ埋め込み、EJML で固有分解します。
        DMatrixRMaj embedded = embed(hermitianMatrix);
        EigenDecomposition_F64<DMatrixRMaj> decomposition =
                DecompositionFactory_DDRM.eig(2 * dim, true, true);
        if (!decomposition.decompose(embedded)) {
            throw new IllegalStateException("固有分解に失敗しました（EJML）: dim=" + dim);
        }

        // 2) 実固有ベクトル (u; v) を複素ベクトル u + iv の候補として取り出します。
        int candidates = 2 * dim;
        double[][] re = new double[candidates][dim];
        double[][] im = new double[candidates][dim];
        for (int k = 0; k < candidates; k++) {
            DMatrixRMaj vec = decomposition.getEigenVector(k);
            if (vec == null) {
                throw new IllegalStateException("固有ベクトルが取得できません: col=" + k);
            }
            for (int row = 0; row < dim; row++) {
                re[k][row] = vec.get(row, 0);
                im[k][row] = vec.get(row + dim, 0);
            }
        }

        // 3) 残差の最も大きい候補から順に採用し、残りから射影を除きます。
        double[][] basisRe = new double[dim][];
        double[][] basisIm = new double[dim][];
        boolean[] used = new boolean[candidates];
        for (int n = 0; n < dim; n++) {
            int best = -1;
            double bestNorm = -1.0;
            for (int k = 0; k < candidates; k++) {
                if (used[k]) {
                    continue;
                }
                double norm = norm(re[k], im[k]);
                if (norm > bestNorm) {
                    bestNorm = norm;
                    best = k;
                }
            }
            if (bestNorm < MIN_PIVOT_NORM) {
                throw new IllegalStateException(
                        "直交な固有ベクトルを取り出せません: n=" + n + ", residual=" + bestNorm);
            }
            used[best] = true;
            basisRe[n] = scale(re[best], 1.0 / bestNorm);
            basisIm[n] = scale(im[best], 1.0 / bestNorm);

            for (int k = 0; k < candidates; k++) {
                if (!used[k]) {
                    project(basisRe[n], basisIm[n], re[k], im[k]);
                }
            }
        }

        // 4) 位相を固定し、Rayleigh 商で固有値を求めます。
        double[] eigenvalues = new double[dim];
        for (int n = 0; n < dim; n++) {
            fixPhase(basisRe[n], basisIm[n]);
            eigenvalues[n] = rayleighQuotient(hermitianMatrix, basisRe[n], basisIm[n]);
        }

        // 5) 固有値を昇順にし、固有ベクトルも同じ順序で並べ替えます。
        int[] order = argsortAscending(eigenvalues);
        double[] sortedValues = new double[dim];
        ZMatrixRMaj sortedVectors = new ZMatrixRMaj(dim, dim);
        for (int newCol = 0; newCol < dim; newCol++) {
            int oldCol = order[newCol];
            sortedValues[newCol] = eigenvalues[oldCol];
            for (int row = 0; row < dim; row++) {
                sortedVectors.set(row, newCol, basisRe[oldCol][row], basisIm[oldCol][row]);
            }
        }

        return new EigenDecompositionResult(sortedValues, sortedVectors);
    }

    /**
     * H = A + iB を実対称行列 [[A, -B], [B, A]] に埋め込みます。
     *
     * @param h Hermite 行列です
     * @return 2n×2n の実対称行列です
     */
    private static DMatrixRMaj embed(ZMatrixRMaj h) {
        int dim = h.numRows;
        DMatrixRMaj out = new DMatrixRMaj(2 * dim, 2 * dim);
        for (int row = 0; row < dim; row++) {
            for (int col = 0; col < dim; col++) {
                double a = h.getReal(row, col);
                double b = h.getImag(row, col);
                out.set(row, col, a);
                out.set(row + dim, col + dim, a);
                out.set(row, col + dim, -b);
                out.set(row + dim, col, b);
            }
        }
        return out;
    }

    private static double norm(double[] re, double[] im) {
        double s = 0.0;
        for (int i = 0; i < re.length; i++) {
            s += re[i] * re[i] + im[i] * im[i];
        }
        return Math.sqrt(s);
    }

    private static double[] scale(double[] v, double factor) {
        double[] out = new double[v.length];
        for (int i = 0; i < v.length; i++) {
            out[i] = v[i] * factor;
        }
        return out;
    }

    /**
     * 単位ベクトル q 方向の成分 <q, z> q を z から取り除きます（複素内積）。
     */
    private static void project(double[] qRe, double[] qIm, double[] zRe, double[] zIm) {
        double cRe = 0.0;
        double cIm = 0.0;
        for (int i = 0; i < qRe.length; i++) {
            // conj(q_i) * z_i
            cRe += qRe[i] * zRe[i] + qIm[i] * zIm[i];
            cIm += qRe[i] * zIm[i] - qIm[i] * zRe[i];
        }
        for (int i = 0; i < qRe.length; i++) {
            zRe[i] -= cRe * qRe[i] - cIm * qIm[i];
            zIm[i] -= cRe * qIm[i] + cIm * qRe[i];
        }
    }

    /**
     * 絶対値最大の成分（同値なら先頭）が正の実数になるように全体位相を合わせます。
     */
    private static void fixPhase(double[] re, double[] im) {
        int pivot = 0;
        double max = -1.0;
        for (int i = 0; i < re.length; i++) {
            double abs = Math.hypot(re[i], im[i]);
            if (abs > max * (1.0 + 1e-12)) {
                max = abs;
                pivot = i;
            }
        }
        if (max <= 0.0) {
            return;
        }
        // z に conj(z_pivot)/|z_pivot| を掛けます。
        double pRe = re[pivot] / max;
        double pIm = -im[pivot] / max;
        for (int i = 0; i < re.length; i++) {
            double r = re[i] * pRe - im[i] * pIm;
            double m = re[i] * pIm + im[i] * pRe;
            re[i] = r;
            im[i] = m;
        }
        im[pivot] = 0.0;
    }

    /**
     * 単位ベクトル z に対する Rayleigh 商 Re(z† H z) を返します。
     */
    private static double rayleighQuotient(ZMatrixRMaj h, double[] re, double[] im) {
        int dim = re.length;
        double sum = 0.0;
        for (int row = 0; row < dim; row++) {
            double hzRe = 0.0;
            double hzIm = 0.0;
            for (int col = 0; col < dim; col++) {
                double a = h.getReal(row, col);
                double b = h.getImag(row, col);
                hzRe += a * re[col] - b * im[col];
                hzIm += a * im[col] + b * re[col];
            }
            sum += re[row] * hzRe + im[row] * hzIm;
        }
        return sum;
    }

    /**
     * 配列を昇順ソートしたときのインデックス順（argsort）を返します。
     *
     * @param values 対象配列です
     * @return 昇順のインデックス配列です
     */
    private static int[] argsortAscending(double[] values) {
        // ソート対象は「値」ではなく「インデックス」です（オブジェクト配列のソートは安定です）。
        Integer[] indices = new Integer[values.length];
        for (int i = 0; i < values.length; i++) {
            indices[i] = i;
        }

        Arrays.sort(indices, (i, j) -> Double.compare(values[i], values[j]));

        int[] order = new int[values.length];
        for (int i = 0; i < values.length; i++) {
            order[i] = indices[i];
        }
        return order;
    }
}
