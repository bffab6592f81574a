package io.github.yok.snv.core.solver;

import static com.google.common.base.Preconditions.*;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import lombok.extern.slf4j.Slf4j;

/**
 * 磁場の大きさをスキャンして、各点で系を組み立てるクラスです。
 *
 * <p>
 * 各点は独立に計算できるため、並列実行してもよいです。結果は入力と同じ順序で返します。
 * </p>
 */
@Slf4j
public final class FieldSweep {

    /**
     * 系の組み立て器です。
     */
    private final SystemAssembler assembler;

    /**
     * スキャンを生成します。
     *
     * @param assembler 系の組み立て器です（null 不可）
     * @throws IllegalArgumentException assembler が null の場合に発生します
     */
    public FieldSweep(SystemAssembler assembler) {
        checkArgument(assembler != null, "assembler は null 不可です");
        this.assembler = assembler;
    }

    /**
     * 磁場の大きさの一覧について系を組み立てます。
     *
     * @param magnitudes 磁場の大きさの一覧です（null 不可、null 要素不可）
     * @param direction 磁場の方向（対称軸座標）です
     * @param strainEnabled 歪み応答項を含めるかどうかです
     * @param parallel 並列に実行するかどうかです
     * @return 入力順の組み立て結果です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public List<SystemResult> sweep(List<Double> magnitudes, double[] direction,
            boolean strainEnabled, boolean parallel) {
        checkArgument(magnitudes != null, "magnitudes は null 不可です");
        for (int i = 0; i < magnitudes.size(); i++) {
            checkArgument(magnitudes.get(i) != null,
                    "magnitudes に null が含まれています: index=%s", i);
        }
        checkArgument(direction != null, "direction は null 不可です");
        double[] dir = direction.clone();

        long t0 = System.nanoTime();
        log.info("磁場スキャンを開始します。点数={}、並列={}、歪み={}", magnitudes.size(), parallel,
                strainEnabled);

        IntStream indices = IntStream.range(0, magnitudes.size());
        if (parallel) {
            indices = indices.parallel();
        }
        List<SystemResult> results = indices
                .mapToObj(i -> assembler.assemble(magnitudes.get(i), dir, strainEnabled))
                .collect(Collectors.toList());

        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;
        long degenerate = results.stream().filter(SystemResult::isNearDegenerate).count();
        log.info("磁場スキャンが完了しました。点数={}、縮退に近い点={}、所要時間={}ms", results.size(), degenerate,
                elapsedMs);
        return results;
    }
}
