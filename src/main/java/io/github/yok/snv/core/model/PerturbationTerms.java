package io.github.yok.snv.core.model;

import io.github.yok.snv.core.geometry.FieldVector;
import org.ejml.data.ZMatrixRMaj;

/**
 * 1 つの軌道多様体に作用する摂動項（4×4 複素 Hermite 行列）を構築するクラスです。
 *
 * <p>
 * 基底の並びは全項で共通で、(e_x,↑), (e_x,↓), (e_y,↑), (e_y,↓) の順です。 インデックス 0,1 と 2,3 がそれぞれ軌道分岐 x, y、
 * 各分岐の中で偶数がスピン ↑、奇数がスピン ↓ です。
 * </p>
 *
 * <p>
 * 実数のパラメータに対しては、どの項も Hermite になります。
 * </p>
 */
public final class PerturbationTerms {

    /**
     * 多様体の状態数です。
     */
    public static final int DIM = 4;

    private PerturbationTerms() {
    }

    /**
     * スピン軌道相互作用項を返します。
     *
     * <p>
     * 各スピンセクタ内で軌道分岐間に大きさ λ/2 の純虚数結合を持ち、符号はスピンで反転します。
     * </p>
     *
     * @param lambda スピン軌道相互作用 λ です
     * @return 4×4 の行列です
     */
    public static ZMatrixRMaj spinOrbit(double lambda) {
        double a = 0.5 * lambda;
        ZMatrixRMaj m = new ZMatrixRMaj(DIM, DIM);
        m.set(0, 2, 0.0, -a);
        m.set(1, 3, 0.0, +a);
        m.set(2, 0, 0.0, +a);
        m.set(3, 1, 0.0, -a);
        return m;
    }

    /**
     * Jahn-Teller 項を返します。
     *
     * @param xiX ξ_x です（分岐 x / y の対角シフト ±ξ_x）
     * @param xiY ξ_y です（分岐間の実結合）
     * @return 4×4 の行列です
     */
    public static ZMatrixRMaj jahnTeller(double xiX, double xiY) {
        ZMatrixRMaj m = new ZMatrixRMaj(DIM, DIM);
        m.set(0, 0, +xiX, 0.0);
        m.set(1, 1, +xiX, 0.0);
        m.set(2, 2, -xiX, 0.0);
        m.set(3, 3, -xiX, 0.0);
        m.set(0, 2, xiY, 0.0);
        m.set(1, 3, xiY, 0.0);
        m.set(2, 0, xiY, 0.0);
        m.set(3, 1, xiY, 0.0);
        return m;
    }

    /**
     * 軌道 Zeeman 項を返します。
     *
     * <p>
     * 磁場の z 成分のみが寄与し、分岐間に f γ_L (i B_z) とその複素共役を置きます。
     * </p>
     *
     * @param field 磁場ベクトル（対称軸座標）です
     * @param gammaL 軌道 Zeeman 係数 γ_L です
     * @param factor 縮小因子 f です
     * @return 4×4 の行列です
     */
    public static ZMatrixRMaj orbitalZeeman(FieldVector field, double gammaL, double factor) {
        double c = factor * gammaL * field.getZ();
        ZMatrixRMaj m = new ZMatrixRMaj(DIM, DIM);
        m.set(0, 2, 0.0, +c);
        m.set(1, 3, 0.0, +c);
        m.set(2, 0, 0.0, -c);
        m.set(3, 1, 0.0, -c);
        return m;
    }

    /**
     * スピン Zeeman 項を返します。
     *
     * <p>
     * 各軌道分岐の中で γ_S [[B_z, B_x - iB_y], [B_x + iB_y, -B_z]] を置きます。
     * </p>
     *
     * @param field 磁場ベクトル（対称軸座標）です
     * @param gammaS スピン Zeeman 係数 γ_S です
     * @return 4×4 の行列です
     */
    public static ZMatrixRMaj spinZeeman(FieldVector field, double gammaS) {
        double bx = gammaS * field.getX();
        double by = gammaS * field.getY();
        double bz = gammaS * field.getZ();
        ZMatrixRMaj m = new ZMatrixRMaj(DIM, DIM);
        for (int branch = 0; branch < DIM; branch += 2) {
            m.set(branch, branch, +bz, 0.0);
            m.set(branch + 1, branch + 1, -bz, 0.0);
            m.set(branch, branch + 1, bx, -by);
            m.set(branch + 1, branch, bx, +by);
        }
        return m;
    }

    /**
     * 歪み応答項を返します。
     *
     * @param alpha α（E_gx 成分）です
     * @param beta β（E_gy 成分）です
     * @param delta δ（A_1g 成分）です
     * @return 4×4 の行列です
     */
    public static ZMatrixRMaj strain(double alpha, double beta, double delta) {
        double upper = alpha - delta;
        double lower = -alpha - delta;
        ZMatrixRMaj m = new ZMatrixRMaj(DIM, DIM);
        m.set(0, 0, upper, 0.0);
        m.set(1, 1, upper, 0.0);
        m.set(2, 2, lower, 0.0);
        m.set(3, 3, lower, 0.0);
        m.set(0, 2, beta, 0.0);
        m.set(1, 3, beta, 0.0);
        m.set(2, 0, beta, 0.0);
        m.set(3, 1, beta, 0.0);
        return m;
    }
}
