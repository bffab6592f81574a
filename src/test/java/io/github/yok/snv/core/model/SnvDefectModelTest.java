package io.github.yok.snv.core.model;

import static io.github.yok.snv.core.MatrixTestUtils.assertMatrixEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.snv.core.geometry.FieldVector;
import io.github.yok.snv.core.parameter.Manifold;
import io.github.yok.snv.core.parameter.ManifoldParameters;
import io.github.yok.snv.core.parameter.MaterialParameters;
import org.ejml.data.ZMatrixRMaj;
import org.ejml.dense.row.CommonOps_ZDRM;
import org.ejml.dense.row.MatrixFeatures_ZDRM;
import org.junit.jupiter.api.Test;

class SnvDefectModelTest {

    private final MaterialParameters parameters = MaterialParameters.tinVacancy();
    private final SnvDefectModel model = new SnvDefectModel(parameters);
    private final FieldVector field = new FieldVector(0.2, -0.1, 0.6);

    @Test
    void testManifoldBlocksAreHermitian() {
        for (Manifold manifold : Manifold.values()) {
            for (boolean strain : new boolean[] {false, true}) {
                ZMatrixRMaj block = model.buildManifold(manifold, field, strain);
                assertEquals(4, block.numRows);
                assertTrue(MatrixFeatures_ZDRM.isHermitian(block, 1e-12), manifold + " " + strain);
            }
        }
    }

    @Test
    void testExcitedTraceIsShiftedByZeroPhononLine() {
        ZMatrixRMaj ground = model.buildManifold(Manifold.GROUND, field, false);
        ZMatrixRMaj excited = model.buildManifold(Manifold.EXCITED, field, false);
        double groundTrace = realTrace(ground);
        double excitedTrace = realTrace(excited);
        assertEquals(0.0, groundTrace, 1e-12);
        assertEquals(4.0 * parameters.getZeroPhononLine(), excitedTrace, 1e-9);
    }

    @Test
    void testStrainToggleAddsExactlyTheStrainTerm() {
        for (Manifold manifold : Manifold.values()) {
            ZMatrixRMaj with = model.buildManifold(manifold, field, true);
            ZMatrixRMaj without = model.buildManifold(manifold, field, false);
            ZMatrixRMaj diff = new ZMatrixRMaj(4, 4);
            CommonOps_ZDRM.subtract(with, without, diff);

            ManifoldParameters p = parameters.manifold(manifold);
            ZMatrixRMaj expected = PerturbationTerms.strain(p.getStrainAlpha(), p.getStrainBeta(),
                    p.getStrainDelta());
            assertMatrixEquals(expected, diff, 1e-9);
        }
    }

    @Test
    void testCompositeIsBlockDiagonalWithExcitedFirst() {
        ZMatrixRMaj composite = model.buildComposite(field, true);
        assertEquals(8, composite.numRows);
        assertTrue(MatrixFeatures_ZDRM.isHermitian(composite, 1e-12));

        ZMatrixRMaj excited = model.buildManifold(Manifold.EXCITED, field, true);
        ZMatrixRMaj ground = model.buildManifold(Manifold.GROUND, field, true);
        for (int row = 0; row < 4; row++) {
            for (int col = 0; col < 4; col++) {
                assertEquals(excited.getReal(row, col), composite.getReal(row, col), 0.0);
                assertEquals(excited.getImag(row, col), composite.getImag(row, col), 0.0);
                assertEquals(ground.getReal(row, col), composite.getReal(row + 4, col + 4), 0.0);
                assertEquals(ground.getImag(row, col), composite.getImag(row + 4, col + 4), 0.0);
                assertEquals(0.0, composite.getReal(row, col + 4), 0.0);
                assertEquals(0.0, composite.getImag(row, col + 4), 0.0);
                assertEquals(0.0, composite.getReal(row + 4, col), 0.0);
                assertEquals(0.0, composite.getImag(row + 4, col), 0.0);
            }
        }
    }

    @Test
    void testNullFieldIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> model.buildManifold(Manifold.GROUND, null, false));
        assertThrows(IllegalArgumentException.class, () -> new SnvDefectModel(null));
    }

    private static double realTrace(ZMatrixRMaj m) {
        double sum = 0.0;
        for (int i = 0; i < m.numRows; i++) {
            sum += m.getReal(i, i);
        }
        return sum;
    }
}
