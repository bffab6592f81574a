package io.github.yok.snv.core.geometry;

/**
 * 呼び出し側が方向ベクトルを表した座標系です。
 */
public enum CoordinateFrame {

    /**
     * 欠陥の対称軸座標系です。
     */
    SYMMETRY {
        @Override
        public double[] toSymmetry(double[] vector) {
            CoordinateTransform.requireThreeVector("vector", vector);
            return vector.clone();
        }
    },

    /**
     * ホスト結晶の格子座標系です。
     */
    LATTICE {
        @Override
        public double[] toSymmetry(double[] vector) {
            return CoordinateTransform.latticeToSymmetry(vector);
        }
    };

    /**
     * この座標系のベクトルを対称軸座標へ変換します。
     *
     * @param vector この座標系で表したベクトルです（長さ 3）
     * @return 対称軸座標のベクトルです
     */
    public abstract double[] toSymmetry(double[] vector);
}
