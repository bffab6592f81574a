package io.github.yok.snv.core.solver;

import io.github.yok.snv.core.model.DipoleOperators;
import lombok.Value;
import org.ejml.data.ZMatrixRMaj;

/**
 * 1 つの磁場（と歪みの有無）について組み立てた系の結果です。
 *
 * <p>
 * 電子状態の並びは「基底固有状態 → 励起固有状態」です。 合成双極子演算子は dim×dim の Hermite 行列で、 行 [0,m)・列 [m,2m) に遷移行列
 * G、行 [m,2m)・列 [0,m) に G† を持ちます（m は多様体あたりの状態数）。
 * </p>
 */
@Value
public class SystemResult {

    /**
     * 基底多様体の固有エネルギー（昇順）です。
     */
    double[] groundEnergies;

    /**
     * 励起多様体の固有エネルギー（昇順）です。
     */
    double[] excitedEnergies;

    /**
     * 基底多様体の固有ベクトル行列（列が固有ベクトル）です。
     */
    ZMatrixRMaj groundEigenvectors;

    /**
     * 励起多様体の固有ベクトル行列（列が固有ベクトル）です。
     */
    ZMatrixRMaj excitedEigenvectors;

    /**
     * x, y, z 偏光の合成双極子演算子です。
     */
    DipoleOperators dipoles;

    /**
     * 完全解における多様体内の固有値間隔の最小値です。
     */
    double minimumEigenvalueGap;

    /**
     * 最小の固有値間隔が閾値を下回り、固有ベクトルが一意に決まらない状態かどうかです。
     *
     * <p>
     * true の場合、縮退部分空間内での基底の取り方に遷移行列が依存します。
     * </p>
     */
    boolean nearDegenerate;

    /**
     * 基底多様体の固有エネルギーの複製を返します。
     *
     * @return 固有エネルギー（昇順）です
     */
    public double[] getGroundEnergies() {
        return groundEnergies.clone();
    }

    /**
     * 励起多様体の固有エネルギーの複製を返します。
     *
     * @return 固有エネルギー（昇順）です
     */
    public double[] getExcitedEnergies() {
        return excitedEnergies.clone();
    }

    /**
     * 基底多様体の固有ベクトル行列の複製を返します。
     *
     * @return 固有ベクトル行列です
     */
    public ZMatrixRMaj getGroundEigenvectors() {
        return groundEigenvectors.copy();
    }

    /**
     * 励起多様体の固有ベクトル行列の複製を返します。
     *
     * @return 固有ベクトル行列です
     */
    public ZMatrixRMaj getExcitedEigenvectors() {
        return excitedEigenvectors.copy();
    }

    /**
     * 電子状態の総数 dim を返します。
     *
     * @return 電子状態数です
     */
    public int electronicDimension() {
        return groundEnergies.length + excitedEnergies.length;
    }

    /**
     * 基底・励起の固有エネルギーを連結して返します。
     *
     * @return 長さ dim のエネルギー配列です
     */
    public double[] energies() {
        double[] out = new double[electronicDimension()];
        System.arraycopy(groundEnergies, 0, out, 0, groundEnergies.length);
        System.arraycopy(excitedEnergies, 0, out, groundEnergies.length, excitedEnergies.length);
        return out;
    }

    /**
     * 偏光の重みで合成双極子演算子をまとめた行列を返します。
     *
     * @param polarization 偏光です（null 不可）
     * @return dim×dim の行列です
     */
    public ZMatrixRMaj dipole(Polarization polarization) {
        if (polarization == null) {
            throw new IllegalArgumentException("polarization は null 不可です");
        }
        return polarization.apply(dipoles);
    }
}
