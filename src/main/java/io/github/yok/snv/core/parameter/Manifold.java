package io.github.yok.snv.core.parameter;

/**
 * 軌道多様体（基底状態 / 励起状態）を表す列挙型です。
 */
public enum Manifold {

    /**
     * 基底状態（E_g）の多様体です。
     */
    GROUND,

    /**
     * 励起状態（E_u）の多様体です。ゼロフォノン線のエネルギーだけ持ち上がります。
     */
    EXCITED
}
