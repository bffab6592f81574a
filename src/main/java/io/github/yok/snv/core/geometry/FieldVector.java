package io.github.yok.snv.core.geometry;

import lombok.Value;

/**
 * 磁場などの実 3 成分ベクトルを表すクラスです。
 *
 * <p>
 * 特に断りがない限り、欠陥の対称軸座標系で表した成分を保持します。
 * </p>
 */
@Value
public class FieldVector {

    /**
     * 零ベクトルです。
     */
    public static final FieldVector ZERO = new FieldVector(0.0, 0.0, 0.0);

    /**
     * x 成分です。
     */
    double x;

    /**
     * y 成分です。
     */
    double y;

    /**
     * z 成分です。
     */
    double z;

    /**
     * ユークリッドノルムを返します。
     *
     * @return ノルムです
     */
    public double norm() {
        return Math.sqrt(x * x + y * y + z * z);
    }
}
