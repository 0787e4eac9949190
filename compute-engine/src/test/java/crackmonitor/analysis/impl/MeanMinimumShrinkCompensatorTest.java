package crackmonitor.analysis.impl;

import crackmonitor.config.ShrinkCompensationConfig;
import crackmonitor.domain.exception.PreconditionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MeanMinimumShrinkCompensatorTest {

    private static final double[] X = {0, 1, 2, 3, 4};

    @Test
    @DisplayName("Un único mínimo: la corrección es uniforme e igual a la diferencia en ese mínimo")
    void run_shouldReturnUniformOffsetAtSingleMinimum() {
        // ARRANGE
        double[] strainInst = {20, 15, 10, 15, 20};
        double[] strain = {55, 48, 40, 51, 60};

        // ACT
        double[] correction = new MeanMinimumShrinkCompensator().run(X, strain, strainInst);

        // ASSERT
        assertThat(correction).containsOnly(30.0).hasSize(X.length);
    }

    @Test
    @DisplayName("Varios mínimos: se promedian las diferencias")
    void run_shouldAverageOverMinima() {
        double[] x = {0, 1, 2, 3, 4, 5, 6};
        double[] strainInst = {50, 10, 50, 60, 20, 60, 70};
        double[] strain = {50, 30, 50, 60, 60, 60, 70};

        double[] correction = new MeanMinimumShrinkCompensator().run(x, strain, strainInst);

        // (20 + 40) / 2
        assertThat(correction).containsOnly(30.0);
    }

    @Test
    @DisplayName("Prominencia: los mínimos poco marcados se ignoran")
    void run_shouldHonourProminence() {
        double[] x = {0, 1, 2, 3, 4, 5, 6};
        double[] strainInst = {50, 10, 50, 60, 58, 60, 70};
        double[] strain = {50, 30, 50, 60, 98, 60, 70};

        double[] correction = new MeanMinimumShrinkCompensator(
                ShrinkCompensationConfig.builder().prominence(10.0).build()).run(x, strain, strainInst);

        assertThat(correction).containsOnly(20.0);
    }

    @Test
    @DisplayName("Errores: sin deformación instantánea no se puede compensar")
    void run_shouldRequireInstantaneousStrain() {
        assertThrows(PreconditionException.class,
                () -> new MeanMinimumShrinkCompensator().run(X, new double[X.length], null));
    }

    @Test
    @DisplayName("Errores: una deformación instantánea monótona no tiene mínimos")
    void run_shouldFailWithoutMinima() {
        assertThrows(PreconditionException.class,
                () -> new MeanMinimumShrinkCompensator().run(X, new double[X.length], new double[]{1, 2, 3, 4, 5}));
    }
}
