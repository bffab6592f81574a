package io.github.yok.snv.core.solver;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.snv.core.MatrixTestUtils;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class FieldSweepTest {

    private final SystemAssembler assembler = MatrixTestUtils.tinVacancyAssembler();
    private final FieldSweep sweep = new FieldSweep(assembler);
    private final double[] direction = {1.0, 0.0, 1.0};

    @Test
    void testParallelSweepMatchesSequentialInInputOrder() {
        List<Double> magnitudes = Arrays.asList(1.0, 0.0, 0.25, 2.0, 0.5, 1e-6, 3.0, 0.75);

        List<SystemResult> parallel = sweep.sweep(magnitudes, direction, true, true);
        List<SystemResult> sequential = sweep.sweep(magnitudes, direction, true, false);

        assertEquals(magnitudes.size(), parallel.size());
        for (int i = 0; i < magnitudes.size(); i++) {
            assertArrayEquals(sequential.get(i).energies(), parallel.get(i).energies(), 0.0,
                    "index " + i);
            SystemResult single = assembler.assemble(magnitudes.get(i), direction, true);
            assertArrayEquals(single.energies(), parallel.get(i).energies(), 0.0, "index " + i);
        }
        assertTrue(parallel.get(1).isNearDegenerate());
    }

    @Test
    void testEmptySweepReturnsEmptyList() {
        assertTrue(sweep.sweep(Collections.emptyList(), direction, false, true).isEmpty());
    }

    @Test
    void testInvalidInputsAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> sweep.sweep(null, direction, false, false));
        assertThrows(IllegalArgumentException.class,
                () -> sweep.sweep(Arrays.asList(1.0, null), direction, false, false));
        assertThrows(IllegalArgumentException.class,
                () -> sweep.sweep(List.of(1.0), null, false, false));
        assertThrows(IllegalArgumentException.class, () -> new FieldSweep(null));
    }
}
