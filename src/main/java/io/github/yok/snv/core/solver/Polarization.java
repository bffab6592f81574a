package io.github.yok.snv.core.solver;

import io.github.yok.snv.core.model.DipoleOperators;
import org.ejml.data.ZMatrixRMaj;

/**
 * 偏光の重みベクトル (w_x, w_y, w_z) を表すクラスです。
 *
 * <p>
 * 重みは複素数も扱え、円偏光は {@link #circular(int)} で作れます。
 * </p>
 */
public final class Polarization {

    private final double[] re;

    private final double[] im;

    private Polarization(double[] re, double[] im) {
        this.re = re;
        this.im = im;
    }

    /**
     * 実数の重みから偏光を生成します。
     *
     * @param weights 重み (w_x, w_y, w_z) です
     * @return 偏光です
     * @throws IllegalArgumentException weights が null、または長さが 3 でない場合に発生します
     */
    public static Polarization of(double... weights) {
        requireThree("polarization", weights);
        return new Polarization(weights.clone(), new double[3]);
    }

    /**
     * 複素数の重みから偏光を生成します。
     *
     * @param re 重みの実部です
     * @param im 重みの虚部です
     * @return 偏光です
     * @throws IllegalArgumentException re, im が null、または長さが 3 でない場合に発生します
     */
    public static Polarization ofComplex(double[] re, double[] im) {
        requireThree("polarization.re", re);
        requireThree("polarization.im", im);
        return new Polarization(re.clone(), im.clone());
    }

    /**
     * 対称軸 z を伝搬方向とする円偏光 (1, ±i, 0)/√2 を返します。
     *
     * @param helicity +1 または -1 です
     * @return 円偏光です
     * @throws IllegalArgumentException helicity が ±1 でない場合に発生します
     */
    public static Polarization circular(int helicity) {
        if (helicity != 1 && helicity != -1) {
            throw new IllegalArgumentException("helicity は +1 か -1 を指定してください: " + helicity);
        }
        double s = 1.0 / Math.sqrt(2.0);
        return new Polarization(new double[] {s, 0.0, 0.0}, new double[] {0.0, helicity * s, 0.0});
    }

    /**
     * 偏光軸ごとの演算子を w_x D_x + w_y D_y + w_z D_z にまとめます。
     *
     * @param dipoles 偏光軸ごとの演算子です
     * @return 重み付き和です
     */
    public ZMatrixRMaj apply(DipoleOperators dipoles) {
        return dipoles.combine(re, im);
    }

    private static void requireThree(String name, double[] weights) {
        if (weights == null) {
            throw new IllegalArgumentException(name + " は null 不可です");
        }
        if (weights.length != 3) {
            throw new IllegalArgumentException(name + " は長さ 3 が必要です: " + weights.length);
        }
        for (double w : weights) {
            if (!Double.isFinite(w)) {
                throw new IllegalArgumentException(name + " は有限値のみ指定できます: " + w);
            }
        }
    }
}
