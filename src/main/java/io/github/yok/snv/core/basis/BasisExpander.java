package io.github.yok.snv.core.basis;

import io.github.yok.snv.core.solver.Polarization;
import io.github.yok.snv.core.solver.SystemResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.ejml.data.DMatrixRMaj;
import org.ejml.data.ZMatrixRMaj;

/**
 * 電子固有状態と補助ラベル {0, 1} の直積基底を列挙し、拡大演算子を組み立てるクラスです。
 *
 * <p>
 * 直積基底は 2·dim 状態で、並びは「ラベルが外側、電子準位が内側」です。 すなわち index(level, label) = label·dim + level です。
 * 演算子の行列要素は基底の探索ではなくこの式で直接配置します。
 * </p>
 *
 * <p>
 * 拡大演算子は電子演算子と補助ラベル上の恒等演算子のテンソル積 1_label ⊗ O に等しく、 ラベルをまたぐ要素は常に 0 です。
 * </p>
 */
public final class BasisExpander {

    /**
     * 補助ラベルの取り得る値の数です。
     */
    public static final int LABEL_COUNT = 2;

    private BasisExpander() {
    }

    /**
     * 直積基底でのインデックスを返します。
     *
     * @param level 電子固有状態のインデックス（0 以上 dim 未満）です
     * @param label 補助ラベル（0 または 1）です
     * @param dim 電子固有状態の数（1 以上）です
     * @return label·dim + level です
     * @throws IllegalArgumentException 引数が範囲外の場合に発生します
     */
    public static int index(int level, int label, int dim) {
        if (dim <= 0) {
            throw new IllegalArgumentException("dim は 1 以上が必要です: " + dim);
        }
        if (level < 0 || level >= dim) {
            throw new IllegalArgumentException("level は 0 以上 dim 未満が必要です: level=" + level
                    + ", dim=" + dim);
        }
        if (label < 0 || label >= LABEL_COUNT) {
            throw new IllegalArgumentException("label は 0 または 1 が必要です: " + label);
        }
        return label * dim + level;
    }

    /**
     * 直積基底を index の順に列挙します。
     *
     * @param dim 電子固有状態の数（1 以上）です
     * @return 長さ 2·dim の変更不可リストです
     */
    public static List<BasisState> enumerate(int dim) {
        if (dim <= 0) {
            throw new IllegalArgumentException("dim は 1 以上が必要です: " + dim);
        }
        List<BasisState> states = new ArrayList<>(LABEL_COUNT * dim);
        for (int label = 0; label < LABEL_COUNT; label++) {
            for (int level = 0; level < dim; level++) {
                states.add(new BasisState(level, label));
            }
        }
        return Collections.unmodifiableList(states);
    }

    /**
     * 固有エネルギーを両ラベルに複製した対角エネルギー演算子を返します。
     *
     * <p>
     * 補助ラベル自体はエネルギーを持たず、(level, label) の対角要素は energies[level] です。
     * </p>
     *
     * @param energies 電子固有エネルギー（長さ dim）です
     * @return (2·dim)×(2·dim) の実対角行列です
     * @throws IllegalArgumentException energies が null または空の場合に発生します
     */
    public static DMatrixRMaj energyOperator(double[] energies) {
        if (energies == null || energies.length == 0) {
            throw new IllegalArgumentException("energies は 1 個以上必要です");
        }
        int dim = energies.length;
        DMatrixRMaj out = new DMatrixRMaj(LABEL_COUNT * dim, LABEL_COUNT * dim);
        for (int label = 0; label < LABEL_COUNT; label++) {
            for (int level = 0; level < dim; level++) {
                int i = index(level, label, dim);
                out.set(i, i, energies[level]);
            }
        }
        return out;
    }

    /**
     * 電子演算子 O を各ラベルのセクタ内に配置した結合演算子を返します。
     *
     * <p>
     * すべての (from, to, label) について、(index(to,label), index(from,label)) に O[to, from] を加えます。
     * </p>
     *
     * @param dipole dim×dim の電子演算子です
     * @return (2·dim)×(2·dim) の複素行列です
     * @throws IllegalArgumentException dipole が null または正方でない場合に発生します
     */
    public static ZMatrixRMaj couplingOperator(ZMatrixRMaj dipole) {
        if (dipole == null) {
            throw new IllegalArgumentException("dipole は null 不可です");
        }
        if (dipole.numRows != dipole.numCols || dipole.numRows == 0) {
            throw new IllegalArgumentException(
                    "dipole は正方行列が必要です: " + dipole.numRows + "x" + dipole.numCols);
        }
        int dim = dipole.numRows;
        ZMatrixRMaj out = new ZMatrixRMaj(LABEL_COUNT * dim, LABEL_COUNT * dim);
        for (int label = 0; label < LABEL_COUNT; label++) {
            for (int from = 0; from < dim; from++) {
                int col = index(from, label, dim);
                for (int to = 0; to < dim; to++) {
                    int row = index(to, label, dim);
                    out.set(row, col, out.getReal(row, col) + dipole.getReal(to, from),
                            out.getImag(row, col) + dipole.getImag(to, from));
                }
            }
        }
        return out;
    }

    /**
     * 組み立て結果のエネルギーから拡大エネルギー演算子を作ります。
     *
     * @param system 組み立て結果です
     * @return 拡大エネルギー演算子です
     */
    public static DMatrixRMaj energyOperator(SystemResult system) {
        return energyOperator(system.energies());
    }

    /**
     * 組み立て結果の合成双極子演算子を偏光で重み付けして、拡大結合演算子を作ります。
     *
     * @param system 組み立て結果です
     * @param polarization 偏光です
     * @return 拡大結合演算子です
     */
    public static ZMatrixRMaj couplingOperator(SystemResult system, Polarization polarization) {
        return couplingOperator(system.dipole(polarization));
    }

    /**
     * 電子固有エネルギーを dim×dim の実対角行列として返します。
     *
     * @param energies 電子固有エネルギーです
     * @return 対角行列です
     */
    public static DMatrixRMaj electronicEnergyOperator(double[] energies) {
        if (energies == null || energies.length == 0) {
            throw new IllegalArgumentException("energies は 1 個以上必要です");
        }
        DMatrixRMaj out = new DMatrixRMaj(energies.length, energies.length);
        for (int i = 0; i < energies.length; i++) {
            out.set(i, i, energies[i]);
        }
        return out;
    }

    /**
     * ラベルをまたぐ要素がすべて 0 であるかを返します。
     *
     * @param operator (2·dim)×(2·dim) の演算子です
     * @param dim 電子固有状態の数です
     * @return ラベルをまたぐ要素がすべて 0 なら true です
     */
    public static boolean isLabelDiagonal(ZMatrixRMaj operator, int dim) {
        for (int row = 0; row < operator.numRows; row++) {
            for (int col = 0; col < operator.numCols; col++) {
                if (row / dim != col / dim
                        && (operator.getReal(row, col) != 0.0 || operator.getImag(row, col) != 0.0)) {
                    return false;
                }
            }
        }
        return true;
    }
}
