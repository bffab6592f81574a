package io.github.yok.snv.app;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.snv.core.parameter.MaterialParameters;
import io.github.yok.snv.core.service.SpinCenterService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {"snv.sweep.magnitudes=1.0e-6,0.5", "snv.sweep.parallel=false"})
class SnvHamiltonianApplicationTest {

    @Autowired
    private SnvProperties properties;

    @Autowired
    private MaterialParameters materialParameters;

    @Autowired
    private SpinCenterService spinCenterService;

    @Test
    void testPropertiesBind() {
        assertEquals(List.of(1.0e-6, 0.5), properties.getSweep().getMagnitudes());
        assertEquals(484.32, properties.getMaterial().getZeroPhononLine(), 0.0);
        assertEquals(0.065, properties.getMaterial().getGround().getJahnTellerX(), 0.0);
        assertEquals(1e-9, properties.getDiagnostics().getDegeneracyGapThreshold(), 0.0);
        assertTrue(properties.toMultilineString().contains("zeroPhononLine: 484.32"));
    }

    @Test
    void testMaterialBeanMatchesTinVacancyDefaults() {
        MaterialParameters expected = MaterialParameters.tinVacancy();
        assertEquals(expected.getZeroPhononLine(), materialParameters.getZeroPhononLine(), 1e-9);
        assertEquals(expected.getGround().getSpinOrbit(),
                materialParameters.getGround().getSpinOrbit(), 1e-12);
        assertEquals(expected.getExcited().getJahnTellerX(),
                materialParameters.getExcited().getJahnTellerX(), 1e-12);
        assertEquals(expected.getGround().getStrainAlpha(),
                materialParameters.getGround().getStrainAlpha(), 1e-12);
        assertEquals(expected.getGammaS(), materialParameters.getGammaS(), 0.0);
    }

    @Test
    void testServiceBeanUsesConfiguredDefaults() {
        assertArrayEquals(new double[] {0.0, 0.0, 1.0},
                spinCenterService.getDefaults().getFieldDirection(), 0.0);
        assertEquals(16, spinCenterService.enlargedEnergyOperator().numRows);
    }

    @Test
    void testToVectorRejectsWrongLength() {
        assertThrows(IllegalStateException.class,
                () -> SnvProperties.toVector("sweep.direction", List.of(1.0, 0.0)));
        assertArrayEquals(new double[] {1.0, 2.0, 3.0},
                SnvProperties.toVector("sweep.direction", List.of(1.0, 2.0, 3.0)), 0.0);
    }
}
