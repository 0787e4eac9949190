package crackmonitor.analysis.impl;

import crackmonitor.config.CrackFinderConfig;
import crackmonitor.domain.crack.Crack;
import crackmonitor.domain.crack.CrackList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PeakCrackFinderTest {

    // Dos picos triangulares iguales en los índices 3 y 7, valle en el índice 5
    static final double[] X = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10};
    static final double[] TWO_PEAKS = {0, 100, 300, 500, 300, 50, 300, 500, 300, 100, 0};

    @Test
    @DisplayName("Dos picos: con altura y prominencia 100 se detectan exactamente dos fisuras")
    void run_shouldFindBothPeaks() {
        // ARRANGE
        PeakCrackFinder finder = new PeakCrackFinder(CrackFinderConfig.builder()
                .height(100.0)
                .prominence(100.0)
                .build());

        // ACT
        CrackList cracks = finder.run(X, TWO_PEAKS);

        // ASSERT
        assertThat(cracks.getIndices()).containsExactly(3, 7);
        assertThat(cracks.getLocations()).containsExactly(3.0, 7.0);
        assertThat(cracks.getMaxStrains()).containsExactly(500.0, 500.0);
        Crack first = cracks.get(0);
        assertEquals(0.0, first.getXL());
        assertEquals(10.0, first.getXR());
        assertThat(cracks.getWidths()).containsOnlyNulls();
    }

    @Test
    @DisplayName("Configuración por defecto: un perfil plano no tiene fisuras")
    void run_shouldReturnEmptyListWithoutPeaks() {
        CrackList cracks = new PeakCrackFinder().run(X, new double[X.length]);

        assertTrue(cracks.isEmpty());
    }

    @Test
    @DisplayName("Configuración por defecto: los picos por debajo de 100 µm/m se ignoran")
    void run_shouldApplyDefaultThresholds() {
        double[] small = {0, 20, 80, 20, 0, 0, 400, 0, 0, 0, 0};

        CrackList cracks = new PeakCrackFinder().run(X, small);

        assertThat(cracks.getIndices()).containsExactly(6);
    }

    @Test
    @DisplayName("Errores: distancia mínima menor que una muestra")
    void config_shouldRejectNonPositiveDistance() {
        assertThrows(IllegalArgumentException.class, () -> CrackFinderConfig.builder().distance(0).build());
    }
}
