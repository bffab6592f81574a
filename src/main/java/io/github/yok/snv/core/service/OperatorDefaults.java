package io.github.yok.snv.core.service;

import io.github.yok.snv.core.geometry.CoordinateTransform;
import lombok.Value;

/**
 * 公開演算で引数を省略したときに用いる既定値です。
 */
@Value
public class OperatorDefaults {

    /**
     * 既定の磁場の大きさです。Kramers 縮退を解くだけの小さな値にしています。
     */
    public static final double STANDARD_FIELD_MAGNITUDE = 1e-6;

    /**
     * 磁場の大きさです。
     */
    double fieldMagnitude;

    /**
     * 磁場の方向（長さ 3）です。
     */
    double[] fieldDirection;

    /**
     * 既定値を生成します。
     *
     * @param fieldMagnitude 磁場の大きさ（有限値）です
     * @param fieldDirection 磁場の方向（長さ 3、零ベクトル不可）です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public OperatorDefaults(double fieldMagnitude, double[] fieldDirection) {
        // 正規化できることだけ先に確認します。
        CoordinateTransform.normalizeAndScale(fieldMagnitude, fieldDirection);
        this.fieldMagnitude = fieldMagnitude;
        this.fieldDirection = fieldDirection.clone();
    }

    /**
     * 磁場 1e-6、方向 [0, 0, 1] の既定値を返します。
     *
     * @return 既定値です
     */
    public static OperatorDefaults standard() {
        return new OperatorDefaults(STANDARD_FIELD_MAGNITUDE, new double[] {0.0, 0.0, 1.0});
    }

    /**
     * 磁場の方向のコピーを返します。
     *
     * @return 磁場の方向です
     */
    public double[] getFieldDirection() {
        return fieldDirection.clone();
    }
}
