package io.github.yok.snv.core.parameter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class MaterialParametersTest {

    @Test
    void testTinVacancyIsInAngularUnits() {
        MaterialParameters p = MaterialParameters.tinVacancy();

        assertEquals(2.0 * Math.PI * 0.815, p.getGround().getSpinOrbit(), 1e-12);
        assertEquals(2.0 * Math.PI * 2.355, p.getExcited().getSpinOrbit(), 1e-12);
        assertEquals(2.0 * Math.PI * 484.32, p.getZeroPhononLine(), 1e-9);
        assertEquals(0.15, p.getGround().getOrbitalZeemanFactor(), 0.0);
        assertEquals(2.0 * Math.PI * -0.07, p.getExcited().getStrainBeta(), 1e-12);
        assertSame(p.getGround(), p.manifold(Manifold.GROUND));
        assertSame(p.getExcited(), p.manifold(Manifold.EXCITED));
    }

    @Test
    void testGyromagneticRatios() {
        double gammaL = PhysicalConstants.orbitalGyromagneticRatio();
        // μ_B/ħ ≈ 8.794e10 rad/(s·T) を ps 単位にした値です。
        assertEquals(0.08794, gammaL, 1e-4);
        assertEquals(2.0 * gammaL, PhysicalConstants.spinGyromagneticRatio(), 1e-15);
        assertTrue(MaterialParameters.tinVacancy().getGammaS() > 0.0);
    }

    @Test
    void testNonFiniteValuesAreRejected() {
        ManifoldParameters g = MaterialParameters.tinVacancy().getGround();
        assertThrows(IllegalArgumentException.class,
                () -> new ManifoldParameters(Double.NaN, 0, 0, 0, 0, 0, 0));
        assertThrows(IllegalArgumentException.class,
                () -> MaterialParameters.of(g, g, Double.POSITIVE_INFINITY));
        assertThrows(IllegalArgumentException.class, () -> MaterialParameters.of(null, g, 1.0));
        assertThrows(IllegalArgumentException.class,
                () -> MaterialParameters.tinVacancy().manifold(null));
    }
}
