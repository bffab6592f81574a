package io.github.yok.snv.core.parameter;

import lombok.Value;

/**
 * 欠陥中心の物質パラメータ一式を保持する不変クラスです。
 *
 * <p>
 * 基底 / 励起それぞれの {@link ManifoldParameters} と、共通のゼロフォノン線エネルギー、 Zeeman 係数 γ_L, γ_S を持ちます。
 * 実行開始時に一度だけ生成し、すべての項ビルダから読み取り専用で共有します。
 * </p>
 */
@Value
public class MaterialParameters {

    /**
     * 基底状態の結合定数です。
     */
    ManifoldParameters ground;

    /**
     * 励起状態の結合定数です。
     */
    ManifoldParameters excited;

    /**
     * ゼロフォノン線エネルギー（rad·THz）です。
     */
    double zeroPhononLine;

    /**
     * 軌道 Zeeman 係数 γ_L（rad·THz/T）です。
     */
    double gammaL;

    /**
     * スピン Zeeman 係数 γ_S（rad·THz/T）です。
     */
    double gammaS;

    /**
     * 物質パラメータを生成します。
     *
     * @param ground 基底状態の結合定数です（null 不可）
     * @param excited 励起状態の結合定数です（null 不可）
     * @param zeroPhononLine ゼロフォノン線エネルギーです
     * @param gammaL 軌道 Zeeman 係数です
     * @param gammaS スピン Zeeman 係数です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public MaterialParameters(ManifoldParameters ground, ManifoldParameters excited,
            double zeroPhononLine, double gammaL, double gammaS) {
        if (ground == null) {
            throw new IllegalArgumentException("ground は null 不可です");
        }
        if (excited == null) {
            throw new IllegalArgumentException("excited は null 不可です");
        }
        ManifoldParameters.requireFinite("zeroPhononLine", zeroPhononLine);
        ManifoldParameters.requireFinite("gammaL", gammaL);
        ManifoldParameters.requireFinite("gammaS", gammaS);
        this.ground = ground;
        this.excited = excited;
        this.zeroPhononLine = zeroPhononLine;
        this.gammaL = gammaL;
        this.gammaS = gammaS;
    }

    /**
     * 物理定数から導いた γ_L, γ_S を用いて物質パラメータを生成します。
     *
     * @param ground 基底状態の結合定数です
     * @param excited 励起状態の結合定数です
     * @param zeroPhononLine ゼロフォノン線エネルギー（rad·THz）です
     * @return 物質パラメータです
     */
    public static MaterialParameters of(ManifoldParameters ground, ManifoldParameters excited,
            double zeroPhononLine) {
        return new MaterialParameters(ground, excited, zeroPhononLine,
                PhysicalConstants.orbitalGyromagneticRatio(),
                PhysicalConstants.spinGyromagneticRatio());
    }

    /**
     * ダイヤモンド中の SnV 中心の参照校正値（Trusheim et al., PRL 124, 023602 (2020)）を返します。
     *
     * @return 参照校正値の物質パラメータです
     */
    public static MaterialParameters tinVacancy() {
        ManifoldParameters ground =
                ManifoldParameters.fromTerahertz(0.815, 0.065, 0.0, 0.15, -0.238, 0.238, 0.0);
        ManifoldParameters excited =
                ManifoldParameters.fromTerahertz(2.355, 0.855, 0.0, 0.15, -0.076, -0.07, 0.0);
        return of(ground, excited, 2.0 * Math.PI * 484.32);
    }

    /**
     * 指定した多様体の結合定数を返します。
     *
     * @param manifold 多様体です（null 不可）
     * @return 結合定数です
     */
    public ManifoldParameters manifold(Manifold manifold) {
        if (manifold == null) {
            throw new IllegalArgumentException("manifold は null 不可です");
        }
        return manifold == Manifold.GROUND ? ground : excited;
    }
}
