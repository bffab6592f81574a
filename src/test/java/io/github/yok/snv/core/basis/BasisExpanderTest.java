package io.github.yok.snv.core.basis;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.snv.core.MatrixTestUtils;
import io.github.yok.snv.core.solver.Polarization;
import io.github.yok.snv.core.solver.SystemResult;
import java.util.List;
import org.ejml.data.DMatrixRMaj;
import org.ejml.data.ZMatrixRMaj;
import org.ejml.dense.row.MatrixFeatures_ZDRM;
import org.junit.jupiter.api.Test;

class BasisExpanderTest {

    @Test
    void testEnumerateOrdersLabelOuterLevelInner() {
        List<BasisState> states = BasisExpander.enumerate(3);

        assertEquals(6, states.size());
        assertEquals(new BasisState(0, 0), states.get(0));
        assertEquals(new BasisState(2, 0), states.get(2));
        assertEquals(new BasisState(0, 1), states.get(3));
        assertEquals(new BasisState(2, 1), states.get(5));
        for (int i = 0; i < states.size(); i++) {
            assertEquals(i, states.get(i).index(3));
        }
        assertThrows(UnsupportedOperationException.class,
                () -> states.add(new BasisState(0, 0)));
    }

    @Test
    void testIndexFormulaAndBounds() {
        assertEquals(0, BasisExpander.index(0, 0, 8));
        assertEquals(7, BasisExpander.index(7, 0, 8));
        assertEquals(8, BasisExpander.index(0, 1, 8));
        assertEquals(13, BasisExpander.index(5, 1, 8));
        assertThrows(IllegalArgumentException.class, () -> BasisExpander.index(8, 0, 8));
        assertThrows(IllegalArgumentException.class, () -> BasisExpander.index(0, 2, 8));
        assertThrows(IllegalArgumentException.class, () -> BasisExpander.index(-1, 0, 8));
        assertThrows(IllegalArgumentException.class, () -> BasisExpander.index(0, 0, 0));
    }

    @Test
    void testOccupationIsOneHot() {
        assertArrayEquals(new int[] {0, 0, 1, 0}, new BasisState(2, 1).occupation(4));
    }

    @Test
    void testEnergyOperatorRepeatsEnergiesPerLabel() {
        double[] energies = {-1.0, 0.5, 3.0};
        DMatrixRMaj op = BasisExpander.energyOperator(energies);

        assertEquals(6, op.numRows);
        for (BasisState s : BasisExpander.enumerate(3)) {
            int i = s.index(3);
            assertEquals(energies[s.getLevel()], op.get(i, i), 0.0);
            for (int j = 0; j < 6; j++) {
                if (j != i) {
                    assertEquals(0.0, op.get(i, j), 0.0);
                }
            }
        }
        assertThrows(IllegalArgumentException.class,
                () -> BasisExpander.energyOperator(new double[0]));
    }

    @Test
    void testCouplingOperatorMatchesOneHotSearch() {
        SystemResult system = MatrixTestUtils.tinVacancyAssembler()
                .assemble(0.5, new double[] {1.0, 0.0, 1.0}, false);
        ZMatrixRMaj dipole = system.dipole(Polarization.circular(+1));
        int dim = dipole.numRows;

        ZMatrixRMaj op = BasisExpander.couplingOperator(dipole);

        List<BasisState> states = BasisExpander.enumerate(dim);
        assertEquals(2 * dim, op.numRows);
        for (int row = 0; row < states.size(); row++) {
            for (int col = 0; col < states.size(); col++) {
                BasisState to = states.get(row);
                BasisState from = states.get(col);
                double re = 0.0;
                double im = 0.0;
                if (to.getLabel() == from.getLabel()) {
                    int[] occTo = to.occupation(dim);
                    int[] occFrom = from.occupation(dim);
                    for (int a = 0; a < dim; a++) {
                        for (int b = 0; b < dim; b++) {
                            re += occTo[a] * occFrom[b] * dipole.getReal(a, b);
                            im += occTo[a] * occFrom[b] * dipole.getImag(a, b);
                        }
                    }
                }
                assertEquals(re, op.getReal(row, col), 0.0, row + "," + col);
                assertEquals(im, op.getImag(row, col), 0.0, row + "," + col);
            }
        }
        assertTrue(BasisExpander.isLabelDiagonal(op, dim));
        assertTrue(MatrixFeatures_ZDRM.isHermitian(op, 1e-12));
    }

    @Test
    void testIsLabelDiagonalDetectsCrossLabelEntry() {
        ZMatrixRMaj op = new ZMatrixRMaj(4, 4);
        op.set(0, 1, 1.0, 0.0);
        assertTrue(BasisExpander.isLabelDiagonal(op, 2));
        op.set(0, 3, 0.0, 1e-3);
        assertFalse(BasisExpander.isLabelDiagonal(op, 2));
    }

    @Test
    void testElectronicEnergyOperatorIsDiagonal() {
        DMatrixRMaj op = BasisExpander.electronicEnergyOperator(new double[] {1.0, 2.0});
        assertEquals(2, op.numRows);
        assertEquals(2.0, op.get(1, 1), 0.0);
        assertEquals(0.0, op.get(0, 1), 0.0);
    }

    @Test
    void testCouplingOperatorRejectsNonSquare() {
        assertThrows(IllegalArgumentException.class,
                () -> BasisExpander.couplingOperator(new ZMatrixRMaj(2, 3)));
        assertThrows(IllegalArgumentException.class,
                () -> BasisExpander.couplingOperator((ZMatrixRMaj) null));
    }
}
