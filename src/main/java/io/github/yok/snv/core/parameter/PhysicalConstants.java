package io.github.yok.snv.core.parameter;

/**
 * 物理定数（CODATA 2018, SI 単位）です。
 */
public final class PhysicalConstants {

    /**
     * 換算プランク定数 ħ [J s] です。
     */
    public static final double HBAR = 1.054571817e-34;

    /**
     * 電気素量 e [C] です。
     */
    public static final double ELEMENTARY_CHARGE = 1.602176634e-19;

    /**
     * 電子の静止質量 m_e [kg] です。
     */
    public static final double ELECTRON_MASS = 9.1093837015e-31;

    /**
     * ボーア磁子 μ_B = eħ / (2 m_e) [J/T] です。
     */
    public static final double BOHR_MAGNETON = 0.5 * ELEMENTARY_CHARGE * HBAR / ELECTRON_MASS;

    /**
     * 角周波数を rad/s から rad/ps（= rad·THz）へ換算する係数です。
     */
    public static final double PER_SECOND_TO_PER_PICOSECOND = 1.0e-12;

    private PhysicalConstants() {
    }

    /**
     * 軌道 Zeeman の係数 γ_L = μ_B / ħ を rad·THz/T で返します。
     *
     * @return γ_L です
     */
    public static double orbitalGyromagneticRatio() {
        return BOHR_MAGNETON / HBAR * PER_SECOND_TO_PER_PICOSECOND;
    }

    /**
     * スピン Zeeman の係数 γ_S = 2 γ_L を rad·THz/T で返します。
     *
     * @return γ_S です
     */
    public static double spinGyromagneticRatio() {
        return 2.0 * orbitalGyromagneticRatio();
    }
}
