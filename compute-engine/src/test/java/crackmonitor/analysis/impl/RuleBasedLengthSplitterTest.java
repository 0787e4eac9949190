package crackmonitor.analysis.impl;

import crackmonitor.config.LengthRule;
import crackmonitor.config.LengthRuleType;
import crackmonitor.config.LengthSplitterConfig;
import crackmonitor.config.ResetScope;
import crackmonitor.domain.crack.Crack;
import crackmonitor.domain.crack.CrackList;
import crackmonitor.domain.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static crackmonitor.analysis.impl.PeakCrackFinderTest.TWO_PEAKS;
import static crackmonitor.analysis.impl.PeakCrackFinderTest.X;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RuleBasedLengthSplitterTest {

    private static RuleBasedLengthSplitter splitter(ResetScope reset, LengthRule... rules) {
        return new RuleBasedLengthSplitter(LengthSplitterConfig.builder()
                .rules(List.of(rules))
                .reset(reset)
                .build());
    }

    private static CrackList bareCracks() {
        return CrackList.of(
                Crack.builder().index(7).location(7.0).build(),
                Crack.builder().index(3).location(3.0).build());
    }

    @Test
    @DisplayName("Regla 'min': el límite compartido es la muestra de mínima deformación entre los picos")
    void min_shouldSplitAtLowestSample() {
        // ARRANGE
        CrackList cracks = new PeakCrackFinder().run(X, TWO_PEAKS);

        // ACT
        splitter(ResetScope.NO, LengthRule.min()).run(X, TWO_PEAKS, cracks);

        // ASSERT
        assertEquals(0.0, cracks.get(0).getXL());
        assertEquals(5.0, cracks.get(0).getXR());
        assertEquals(5.0, cracks.get(1).getXL());
        assertEquals(10.0, cracks.get(1).getXR());
    }

    @Test
    @DisplayName("Orden: la lista se ordena por posición y los límites sin asignar se abren a infinito")
    void run_shouldSortAndOpenUnsetBoundaries() {
        CrackList cracks = bareCracks();

        splitter(ResetScope.NO).run(X, TWO_PEAKS, cracks);

        assertThat(cracks.getLocations()).containsExactly(3.0, 7.0);
        assertThat(cracks.getXL()).containsExactly(Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY);
        assertThat(cracks.getXR()).containsExactly(Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY);
    }

    @Test
    @DisplayName("Regla 'middle': corte en el punto medio entre posiciones vecinas")
    void middle_shouldSplitAtMidpoint() {
        CrackList cracks = CrackList.of(
                Crack.builder().index(2).location(2.0).build(),
                Crack.builder().index(8).location(8.0).build());

        splitter(ResetScope.NO, LengthRule.middle()).run(X, TWO_PEAKS, cracks);

        assertEquals(5.0, cracks.get(0).getXR());
        assertEquals(5.0, cracks.get(1).getXL());
    }

    @Test
    @DisplayName("Regla 'threshold': primera muestra bajo el umbral al recorrer desde el pico hacia fuera")
    void threshold_shouldWalkOutwardsFromPeak() {
        CrackList cracks = bareCracks();

        splitter(ResetScope.NO, LengthRule.threshold(150.0)).run(X, TWO_PEAKS, cracks);

        assertThat(cracks.getXL()).containsExactly(1.0, 5.0);
        assertThat(cracks.getXR()).containsExactly(5.0, 9.0);
    }

    @Test
    @DisplayName("Regla 'length': radio fijo alrededor de la fisura")
    void length_shouldLimitToRadius() {
        CrackList cracks = bareCracks();

        splitter(ResetScope.NO, LengthRule.length(0.5)).run(X, TWO_PEAKS, cracks);

        assertThat(cracks.getXL()).containsExactly(2.5, 6.5);
        assertThat(cracks.getXR()).containsExactly(3.5, 7.5);
    }

    @Test
    @DisplayName("Monotonía: añadir reglas nunca ensancha la longitud de transferencia")
    void rules_shouldOnlyNarrowBoundaries() {
        // ARRANGE
        CrackList onlyMin = new PeakCrackFinder().run(X, TWO_PEAKS);
        CrackList minAndLength = new PeakCrackFinder().run(X, TWO_PEAKS);

        // ACT
        splitter(ResetScope.INNER, LengthRule.min()).run(X, TWO_PEAKS, onlyMin);
        splitter(ResetScope.INNER, LengthRule.min(), LengthRule.length(1.0)).run(X, TWO_PEAKS, minAndLength);

        // ASSERT
        for (int i = 0; i < onlyMin.size(); i++) {
            assertThat(minAndLength.get(i).getXL()).isGreaterThanOrEqualTo(onlyMin.get(i).getXL());
            assertThat(minAndLength.get(i).getXR()).isLessThanOrEqualTo(onlyMin.get(i).getXR());
        }
        // Los extremos exteriores conservan las bases del pico tras un reinicio interior
        assertEquals(0.0, onlyMin.get(0).getXL());
        assertEquals(10.0, onlyMin.get(1).getXR());
    }

    @Test
    @DisplayName("Reinicio: 'all' descarta también los límites exteriores")
    void reset_shouldClearOuterBoundaries() {
        CrackList cracks = new PeakCrackFinder().run(X, TWO_PEAKS);

        splitter(ResetScope.ALL, LengthRule.min()).run(X, TWO_PEAKS, cracks);

        assertEquals(Double.NEGATIVE_INFINITY, cracks.get(0).getXL());
        assertEquals(5.0, cracks.get(0).getXR());
        assertEquals(Double.POSITIVE_INFINITY, cracks.get(1).getXR());
    }

    @Test
    @DisplayName("Configuración por defecto: mínimo y radio 0.2")
    void defaultConfig_shouldCombineMinAndLength() {
        CrackList cracks = new PeakCrackFinder().run(X, TWO_PEAKS);

        new RuleBasedLengthSplitter().run(X, TWO_PEAKS, cracks);

        assertEquals(2.8, cracks.get(0).getXL(), 1e-12);
        assertEquals(3.2, cracks.get(0).getXR(), 1e-12);
        assertEquals(6.8, cracks.get(1).getXL(), 1e-12);
        assertEquals(7.2, cracks.get(1).getXR(), 1e-12);
    }

    @Test
    @DisplayName("Errores: nombre de regla desconocido")
    void unknownRule_shouldFailAsConfigurationError() {
        assertThrows(ConfigurationException.class, () -> LengthRuleType.fromName("widest"));
    }
}
