package io.github.yok.snv.core.solver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.snv.core.model.DipoleOperators;
import org.ejml.data.ZMatrixRMaj;
import org.junit.jupiter.api.Test;

class PolarizationTest {

    @Test
    void testRealPolarizationAppliesWeights() {
        ZMatrixRMaj m = Polarization.of(1.0, 0.0, 0.5).apply(DipoleOperators.raw());
        assertEquals(2.0, m.getReal(0, 0), 1e-15);
        assertEquals(0.0, m.getReal(2, 2), 1e-15);
        assertEquals(0.0, m.getReal(0, 2), 1e-15);
    }

    @Test
    void testCircularPolarizationHasImaginaryYComponent() {
        double s = 1.0 / Math.sqrt(2.0);
        ZMatrixRMaj m = Polarization.circular(+1).apply(DipoleOperators.raw());
        assertEquals(s, m.getReal(0, 0), 1e-15);
        assertEquals(-s, m.getImag(0, 2), 1e-15);
        assertEquals(0.0, m.getReal(0, 2), 1e-15);

        ZMatrixRMaj opposite = Polarization.circular(-1).apply(DipoleOperators.raw());
        assertEquals(s, opposite.getImag(0, 2), 1e-15);
    }

    @Test
    void testInvalidWeightsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> Polarization.of(1.0, 0.0));
        assertThrows(IllegalArgumentException.class, () -> Polarization.of(1.0, 0.0, 0.0, 0.0));
        assertThrows(IllegalArgumentException.class, () -> Polarization.of((double[]) null));
        assertThrows(IllegalArgumentException.class, () -> Polarization.of(Double.NaN, 0.0, 0.0));
        assertThrows(IllegalArgumentException.class,
                () -> Polarization.ofComplex(new double[3], new double[2]));
        assertThrows(IllegalArgumentException.class, () -> Polarization.circular(0));
    }
}
