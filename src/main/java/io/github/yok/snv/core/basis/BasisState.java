package io.github.yok.snv.core.basis;

import lombok.Value;

/**
 * 電子固有状態 level と補助ラベル label（0 または 1）の直積基底の 1 状態です。
 */
@Value
public class BasisState {

    /**
     * 電子固有状態のインデックス（0 以上 dim 未満）です。
     */
    int level;

    /**
     * 補助ラベル（0 または 1）です。
     */
    int label;

    /**
     * 直積基底でのインデックス label·dim + level を返します。
     *
     * @param dim 電子固有状態の数です
     * @return インデックスです
     */
    public int index(int dim) {
        return BasisExpander.index(level, label, dim);
    }

    /**
     * 電子固有状態の one-hot 占有ベクトルを返します。
     *
     * @param dim 電子固有状態の数です
     * @return 長さ dim の占有ベクトルです
     */
    public int[] occupation(int dim) {
        int[] out = new int[dim];
        out[level] = 1;
        return out;
    }
}
