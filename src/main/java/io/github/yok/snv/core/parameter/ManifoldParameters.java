package io.github.yok.snv.core.parameter;

import lombok.Value;

/**
 * 1 つの軌道多様体（基底 / 励起）に属する結合定数を保持するクラスです。
 *
 * <p>
 * エネルギー次元の値はすべて角周波数単位（rad·THz）で保持します。 軌道 Zeeman の縮小因子 f のみ無次元です。
 * </p>
 */
@Value
public class ManifoldParameters {

    /**
     * スピン軌道相互作用 λ です。
     */
    double spinOrbit;

    /**
     * Jahn-Teller 結合 ξ_x です。
     */
    double jahnTellerX;

    /**
     * Jahn-Teller 結合 ξ_y です。
     */
    double jahnTellerY;

    /**
     * 軌道 Zeeman の縮小因子 f です。
     */
    double orbitalZeemanFactor;

    /**
     * 歪み応答 α（E_gx 成分）です。
     */
    double strainAlpha;

    /**
     * 歪み応答 β（E_gy 成分）です。
     */
    double strainBeta;

    /**
     * 歪み応答 δ（A_1g 成分）です。
     */
    double strainDelta;

    /**
     * 結合定数を生成します。
     *
     * @param spinOrbit スピン軌道相互作用 λ です
     * @param jahnTellerX Jahn-Teller 結合 ξ_x です
     * @param jahnTellerY Jahn-Teller 結合 ξ_y です
     * @param orbitalZeemanFactor 軌道 Zeeman の縮小因子 f です
     * @param strainAlpha 歪み応答 α です
     * @param strainBeta 歪み応答 β です
     * @param strainDelta 歪み応答 δ です
     * @throws IllegalArgumentException いずれかが有限値でない場合に発生します
     */
    public ManifoldParameters(double spinOrbit, double jahnTellerX, double jahnTellerY,
            double orbitalZeemanFactor, double strainAlpha, double strainBeta,
            double strainDelta) {
        requireFinite("spinOrbit", spinOrbit);
        requireFinite("jahnTellerX", jahnTellerX);
        requireFinite("jahnTellerY", jahnTellerY);
        requireFinite("orbitalZeemanFactor", orbitalZeemanFactor);
        requireFinite("strainAlpha", strainAlpha);
        requireFinite("strainBeta", strainBeta);
        requireFinite("strainDelta", strainDelta);
        this.spinOrbit = spinOrbit;
        this.jahnTellerX = jahnTellerX;
        this.jahnTellerY = jahnTellerY;
        this.orbitalZeemanFactor = orbitalZeemanFactor;
        this.strainAlpha = strainAlpha;
        this.strainBeta = strainBeta;
        this.strainDelta = strainDelta;
    }

    /**
     * 周波数単位（THz）の値から結合定数を生成します。
     *
     * <p>
     * f 以外の値に 2π を掛けて角周波数単位へ換算します。
     * </p>
     *
     * @param spinOrbit λ [THz] です
     * @param jahnTellerX ξ_x [THz] です
     * @param jahnTellerY ξ_y [THz] です
     * @param orbitalZeemanFactor f（無次元）です
     * @param strainAlpha α [THz] です
     * @param strainBeta β [THz] です
     * @param strainDelta δ [THz] です
     * @return 角周波数単位の結合定数です
     */
    public static ManifoldParameters fromTerahertz(double spinOrbit, double jahnTellerX,
            double jahnTellerY, double orbitalZeemanFactor, double strainAlpha,
            double strainBeta, double strainDelta) {
        double w = 2.0 * Math.PI;
        return new ManifoldParameters(w * spinOrbit, w * jahnTellerX, w * jahnTellerY,
                orbitalZeemanFactor, w * strainAlpha, w * strainBeta, w * strainDelta);
    }

    static void requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " は有限値を指定してください: " + value);
        }
    }
}
