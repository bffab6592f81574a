package io.github.yok.snv.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.snv.core.geometry.FieldVector;
import java.util.Random;
import org.ejml.data.ZMatrixRMaj;
import org.ejml.dense.row.MatrixFeatures_ZDRM;
import org.junit.jupiter.api.Test;

class PerturbationTermsTest {

    private static final double TOL = 1e-14;

    @Test
    void testAllTermsHermitianForRandomInputs() {
        Random rnd = new Random(20240917L);
        for (int trial = 0; trial < 50; trial++) {
            FieldVector b = new FieldVector(rnd.nextGaussian(), rnd.nextGaussian(),
                    rnd.nextGaussian());
            ZMatrixRMaj[] terms = {PerturbationTerms.spinOrbit(rnd.nextGaussian()),
                    PerturbationTerms.jahnTeller(rnd.nextGaussian(), rnd.nextGaussian()),
                    PerturbationTerms.orbitalZeeman(b, rnd.nextDouble(), rnd.nextDouble()),
                    PerturbationTerms.spinZeeman(b, rnd.nextDouble()),
                    PerturbationTerms.strain(rnd.nextGaussian(), rnd.nextGaussian(),
                            rnd.nextGaussian())};
            for (int i = 0; i < terms.length; i++) {
                assertEquals(PerturbationTerms.DIM, terms[i].numRows);
                assertTrue(MatrixFeatures_ZDRM.isHermitian(terms[i], TOL),
                        "term " + i + " trial " + trial);
            }
        }
    }

    @Test
    void testSpinOrbitEntries() {
        ZMatrixRMaj m = PerturbationTerms.spinOrbit(2.0);
        assertEquals(-1.0, m.getImag(0, 2), TOL);
        assertEquals(+1.0, m.getImag(1, 3), TOL);
        assertEquals(+1.0, m.getImag(2, 0), TOL);
        assertEquals(-1.0, m.getImag(3, 1), TOL);
        for (int i = 0; i < 4; i++) {
            assertEquals(0.0, m.getReal(i, i), 0.0);
        }
    }

    @Test
    void testJahnTellerEntries() {
        ZMatrixRMaj m = PerturbationTerms.jahnTeller(0.3, 0.7);
        assertEquals(0.3, m.getReal(0, 0), TOL);
        assertEquals(0.3, m.getReal(1, 1), TOL);
        assertEquals(-0.3, m.getReal(2, 2), TOL);
        assertEquals(-0.3, m.getReal(3, 3), TOL);
        assertEquals(0.7, m.getReal(0, 2), TOL);
        assertEquals(0.7, m.getReal(3, 1), TOL);
    }

    @Test
    void testOrbitalZeemanUsesOnlyAxialComponent() {
        ZMatrixRMaj transverse =
                PerturbationTerms.orbitalZeeman(new FieldVector(1.0, 1.0, 0.0), 2.0, 0.15);
        for (int i = 0; i < transverse.getDataLength(); i++) {
            assertEquals(0.0, transverse.data[i], 0.0);
        }
        ZMatrixRMaj axial =
                PerturbationTerms.orbitalZeeman(new FieldVector(0.0, 0.0, 1.0), 2.0, 0.15);
        assertEquals(0.3, axial.getImag(0, 2), TOL);
        assertEquals(-0.3, axial.getImag(2, 0), TOL);
    }

    @Test
    void testSpinZeemanEntries() {
        ZMatrixRMaj m = PerturbationTerms.spinZeeman(new FieldVector(1.0, 2.0, 3.0), 0.5);
        for (int branch = 0; branch < 4; branch += 2) {
            assertEquals(1.5, m.getReal(branch, branch), TOL);
            assertEquals(-1.5, m.getReal(branch + 1, branch + 1), TOL);
            assertEquals(0.5, m.getReal(branch, branch + 1), TOL);
            assertEquals(-1.0, m.getImag(branch, branch + 1), TOL);
            assertEquals(1.0, m.getImag(branch + 1, branch), TOL);
        }
        assertEquals(0.0, m.getReal(0, 2), 0.0);
    }

    @Test
    void testStrainEntries() {
        ZMatrixRMaj m = PerturbationTerms.strain(0.2, 0.4, 0.1);
        assertEquals(0.1, m.getReal(0, 0), TOL);
        assertEquals(-0.3, m.getReal(2, 2), TOL);
        assertEquals(0.4, m.getReal(1, 3), TOL);
        assertEquals(0.4, m.getReal(2, 0), TOL);
    }
}
