package io.github.yok.snv.app;

import io.github.yok.snv.core.parameter.ManifoldParameters;
import io.github.yok.snv.core.parameter.MaterialParameters;
import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.PositiveOrZero;
import javax.validation.constraints.Size;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * snv-hamiltonian の設定値（snv.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、物質パラメータと公開演算の既定値、 診断の閾値、CLI の磁場スキャン設定に使用します。
 * エネルギー次元の物質パラメータは周波数単位（THz）で記述し、{@link Material#toMaterialParameters()} で角周波数単位へ換算します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "snv")
public class SnvProperties {

    /**
     * 物質パラメータです。
     */
    @Valid
    private Material material = new Material();

    /**
     * 公開演算の既定値です。
     */
    @Valid
    private Defaults defaults = new Defaults();

    /**
     * 診断設定です。
     */
    @Valid
    private Diagnostics diagnostics = new Diagnostics();

    /**
     * 磁場スキャン設定です。
     */
    @Valid
    private Sweep sweep = new Sweep();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "snv")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Material m = getMaterial();
        Defaults d = getDefaults();
        Diagnostics g = getDiagnostics();
        Sweep s = getSweep();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "material",
                // zeroPhononLine: ゼロフォノン線 [THz]
                "zeroPhononLine", m.getZeroPhononLine());
        appendManifold(sb, nl, "material.ground", m.getGround());
        appendManifold(sb, nl, "material.excited", m.getExcited());

        appendSection(sb, nl, "defaults",
                // fieldMagnitude: 既定の磁場の大きさ
                "fieldMagnitude", d.getFieldMagnitude(),
                // fieldDirection: 既定の磁場の方向（対称軸座標）
                "fieldDirection", d.getFieldDirection());

        appendSection(sb, nl, "diagnostics",
                // degeneracyGapThreshold: 縮退判定の固有値間隔 [rad·THz]
                "degeneracyGapThreshold", g.getDegeneracyGapThreshold(),
                // hermitianTolerance: Hermite 性検証の許容誤差
                "hermitianTolerance", g.getHermitianTolerance());

        appendSection(sb, nl, "sweep",
                // magnitudes: 計算する磁場の大きさの一覧
                "magnitudes", s.getMagnitudes(),
                // direction: 磁場の方向（対称軸座標）
                "direction", s.getDirection(),
                // strainEnabled: 歪み応答項を含めるかどうか
                "strainEnabled", s.isStrainEnabled(),
                // parallel: 各点を並列に計算するかどうか
                "parallel", s.isParallel());

        return sb.toString();
    }

    private static void appendManifold(StringBuilder sb, String nl, String section,
            ManifoldCoupling c) {
        appendSection(sb, nl, section, "spinOrbit", c.getSpinOrbit(), "jahnTellerX",
                c.getJahnTellerX(), "jahnTellerY", c.getJahnTellerY(), "orbitalZeemanFactor",
                c.getOrbitalZeemanFactor(), "strainAlpha", c.getStrainAlpha(), "strainBeta",
                c.getStrainBeta(), "strainDelta", c.getStrainDelta());
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * <pre>
     *   section:
     *     key: value
     * </pre>
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    /**
     * 長さ 3 の List を配列に変換します。
     *
     * @param name 設定名です（メッセージ用）
     * @param values 値です
     * @return 配列です
     */
    static double[] toVector(String name, List<Double> values) {
        if (values == null || values.size() != 3) {
            throw new IllegalStateException(name + " は 3 成分で指定してください: " + values);
        }
        double[] out = new double[3];
        for (int i = 0; i < 3; i++) {
            Double v = values.get(i);
            if (v == null) {
                throw new IllegalStateException(name + " に null が含まれています");
            }
            out[i] = v.doubleValue();
        }
        return out;
    }

    @Data
    public static class Material {

        /**
         * ゼロフォノン線 [THz] です。
         */
        private double zeroPhononLine = 484.32;

        /**
         * 基底多様体の結合定数です。
         */
        @Valid
        private ManifoldCoupling ground = ManifoldCoupling.defaultGround();

        /**
         * 励起多様体の結合定数です。
         */
        @Valid
        private ManifoldCoupling excited = ManifoldCoupling.defaultExcited();

        /**
         * 角周波数単位の物質パラメータに換算します。
         *
         * @return 物質パラメータです
         */
        public MaterialParameters toMaterialParameters() {
            return MaterialParameters.of(ground.toManifoldParameters(),
                    excited.toManifoldParameters(), 2.0 * Math.PI * zeroPhononLine);
        }
    }

    /**
     * 1 つの多様体の結合定数です（f 以外は THz）。
     */
    @Data
    public static class ManifoldCoupling {

        /**
         * スピン軌道相互作用 λ [THz] です。
         */
        private double spinOrbit;

        /**
         * Jahn-Teller 結合 ξ_x [THz] です。
         */
        private double jahnTellerX;

        /**
         * Jahn-Teller 結合 ξ_y [THz] です。
         */
        private double jahnTellerY;

        /**
         * 軌道 Zeeman の縮小因子 f です。
         */
        private double orbitalZeemanFactor;

        /**
         * 歪み応答 α [THz] です。
         */
        private double strainAlpha;

        /**
         * 歪み応答 β [THz] です。
         */
        private double strainBeta;

        /**
         * 歪み応答 δ [THz] です。
         */
        private double strainDelta;

        static ManifoldCoupling defaultGround() {
            ManifoldCoupling c = new ManifoldCoupling();
            c.setSpinOrbit(0.815);
            c.setJahnTellerX(0.065);
            c.setOrbitalZeemanFactor(0.15);
            c.setStrainAlpha(-0.238);
            c.setStrainBeta(0.238);
            return c;
        }

        static ManifoldCoupling defaultExcited() {
            ManifoldCoupling c = new ManifoldCoupling();
            c.setSpinOrbit(2.355);
            c.setJahnTellerX(0.855);
            c.setOrbitalZeemanFactor(0.15);
            c.setStrainAlpha(-0.076);
            c.setStrainBeta(-0.07);
            return c;
        }

        /**
         * 角周波数単位の結合定数に換算します。
         *
         * @return 結合定数です
         */
        public ManifoldParameters toManifoldParameters() {
            return ManifoldParameters.fromTerahertz(spinOrbit, jahnTellerX, jahnTellerY,
                    orbitalZeemanFactor, strainAlpha, strainBeta, strainDelta);
        }
    }

    @Data
    public static class Defaults {

        /**
         * 既定の磁場の大きさです。
         */
        private double fieldMagnitude = 1e-6;

        /**
         * 既定の磁場の方向（対称軸座標）です。
         */
        @NotNull
        @Size(min = 3, max = 3)
        private List<Double> fieldDirection = List.of(0.0, 0.0, 1.0);
    }

    @Data
    public static class Diagnostics {

        /**
         * 多様体内の固有値間隔がこれを下回ったら縮退に近いとみなす閾値 [rad·THz] です。
         */
        @PositiveOrZero
        private double degeneracyGapThreshold = 1e-9;

        /**
         * 固有分解の入力に対する Hermite 性検証の許容誤差です。
         */
        @PositiveOrZero
        private double hermitianTolerance = 1e-9;
    }

    @Data
    public static class Sweep {

        /**
         * 計算する磁場の大きさの一覧です。
         */
        @NotEmpty
        private List<Double> magnitudes = List.of(1e-6);

        /**
         * 磁場の方向（対称軸座標）です。
         */
        @NotNull
        @Size(min = 3, max = 3)
        private List<Double> direction = List.of(0.0, 0.0, 1.0);

        /**
         * 歪み応答項を含めるかどうかです。
         */
        private boolean strainEnabled = false;

        /**
         * 各点を並列に計算するかどうかです。
         */
        private boolean parallel = true;
    }
}
