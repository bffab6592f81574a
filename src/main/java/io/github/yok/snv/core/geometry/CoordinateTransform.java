package io.github.yok.snv.core.geometry;

/**
 * 欠陥の対称軸座標系とホスト結晶の格子座標系の間でベクトルを変換するクラスです。
 *
 * <p>
 * 対称軸は格子座標で ex = (1,-2,1)/√6, ey = (1,0,-1)/√2, ez = (1,1,1)/√3 です（[111] 配向の欠陥）。 この 3 本を行に持つ直交行列
 * R について、格子 → 対称軸は R v、対称軸 → 格子は R^T v です。
 * </p>
 */
public final class CoordinateTransform {

    /**
     * 対称軸を行に並べた直交行列 R です。
     */
    private static final double[][] SYMMETRY_AXES = {
            {1.0 / Math.sqrt(6.0), -2.0 / Math.sqrt(6.0), 1.0 / Math.sqrt(6.0)},
            {1.0 / Math.sqrt(2.0), 0.0, -1.0 / Math.sqrt(2.0)},
            {1.0 / Math.sqrt(3.0), 1.0 / Math.sqrt(3.0), 1.0 / Math.sqrt(3.0)}};

    private CoordinateTransform() {
    }

    /**
     * 方向ベクトルを単位長に正規化し、指定の大きさに拡大します。
     *
     * @param magnitude 大きさです（有限値）
     * @param direction 方向ベクトルです（長さ 3、零ベクトル不可）
     * @return ノルムが |magnitude| のベクトルです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public static FieldVector normalizeAndScale(double magnitude, double[] direction) {
        requireThreeVector("direction", direction);
        if (!Double.isFinite(magnitude)) {
            throw new IllegalArgumentException("magnitude は有限値を指定してください: " + magnitude);
        }
        double norm = Math.sqrt(direction[0] * direction[0] + direction[1] * direction[1]
                + direction[2] * direction[2]);
        if (norm == 0.0) {
            throw new IllegalArgumentException("direction に零ベクトルは指定できません");
        }
        double s = magnitude / norm;
        return new FieldVector(s * direction[0], s * direction[1], s * direction[2]);
    }

    /**
     * 格子座標のベクトルを対称軸座標へ変換します。
     *
     * @param lattice 格子座標のベクトルです（長さ 3）
     * @return 対称軸座標のベクトルです
     */
    public static double[] latticeToSymmetry(double[] lattice) {
        requireThreeVector("lattice", lattice);
        double[] out = new double[3];
        for (int row = 0; row < 3; row++) {
            for (int col = 0; col < 3; col++) {
                out[row] += SYMMETRY_AXES[row][col] * lattice[col];
            }
        }
        return out;
    }

    /**
     * 対称軸座標のベクトルを格子座標へ変換します。
     *
     * @param symmetry 対称軸座標のベクトルです（長さ 3）
     * @return 格子座標のベクトルです
     */
    public static double[] symmetryToLattice(double[] symmetry) {
        requireThreeVector("symmetry", symmetry);
        double[] out = new double[3];
        for (int row = 0; row < 3; row++) {
            for (int col = 0; col < 3; col++) {
                out[row] += SYMMETRY_AXES[col][row] * symmetry[col];
            }
        }
        return out;
    }

    /**
     * 対称軸 ex, ey, ez（格子座標）を行とする行列のコピーを返します。
     *
     * @return 3×3 の直交行列です
     */
    public static double[][] symmetryAxes() {
        double[][] copy = new double[3][];
        for (int i = 0; i < 3; i++) {
            copy[i] = SYMMETRY_AXES[i].clone();
        }
        return copy;
    }

    static void requireThreeVector(String name, double[] vector) {
        if (vector == null) {
            throw new IllegalArgumentException(name + " は null 不可です");
        }
        if (vector.length != 3) {
            throw new IllegalArgumentException(name + " は長さ 3 が必要です: " + vector.length);
        }
        for (double v : vector) {
            if (!Double.isFinite(v)) {
                throw new IllegalArgumentException(name + " は有限値のみ指定できます: " + v);
            }
        }
    }
}
