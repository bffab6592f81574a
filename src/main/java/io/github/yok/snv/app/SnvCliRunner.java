package io.github.yok.snv.app;

import io.github.yok.snv.core.solver.FieldSweep;
import io.github.yok.snv.core.solver.SystemResult;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で snv-hamiltonian を実行するクラスです。
 *
 * <p>
 * 磁場の大きさをスキャンし、各点の固有エネルギー（基底 → 励起）と最小固有値間隔を表示します。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class SnvCliRunner implements CommandLineRunner {

    /**
     * snv-hamiltonian の設定値（snv.*）です。
     */
    private final SnvProperties properties;

    /**
     * 磁場スキャンです。
     */
    private final FieldSweep fieldSweep;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== snv-hamiltonian start: field sweep ===");
        System.out.print(properties.toMultilineString());

        SnvProperties.Sweep sweep = properties.getSweep();
        List<Double> magnitudes = sweep.getMagnitudes();
        if (magnitudes == null || magnitudes.isEmpty()) {
            throw new IllegalStateException("sweep.magnitudes は必須です（磁場の大きさの一覧を指定してください）");
        }
        double[] direction = SnvProperties.toVector("sweep.direction", sweep.getDirection());

        List<SystemResult> results = fieldSweep.sweep(magnitudes, direction,
                sweep.isStrainEnabled(), sweep.isParallel());

        for (int i = 0; i < results.size(); i++) {
            SystemResult r = results.get(i);
            System.out.println("=== 磁場ごとの計算 ===");
            System.out.println("入力: B=" + fmt(magnitudes.get(i)) + "（step=" + (i + 1) + "/"
                    + results.size() + "）");
            System.out.println("結果: 基底=" + fmtArray(r.getGroundEnergies()));
            System.out.println("結果: 励起=" + fmtArray(r.getExcitedEnergies()));
            System.out.println("結果: 最小固有値間隔=" + fmt(r.getMinimumEigenvalueGap())
                    + (r.isNearDegenerate() ? "（縮退に近い）" : ""));
        }
    }

    /**
     * 数値を有効数字 9 桁の文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.9g", v);
    }

    private static String fmtArray(double[] values) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(fmt(values[i]));
        }
        return sb.append("]").toString();
    }
}
