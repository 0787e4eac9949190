package crackmonitor.config;

import crackmonitor.domain.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LengthSplitterConfigTest {

    @Test
    @DisplayName("Por defecto: mínimo, radio 0.2 y reinicio interior")
    void getDefault_shouldMatchDocumentedValues() {
        LengthSplitterConfig config = LengthSplitterConfig.getDefault();

        assertThat(config.rules()).containsExactly(LengthRule.min(), LengthRule.length(0.2));
        assertEquals(ResetScope.INNER, config.reset());
    }

    @Test
    @DisplayName("Desde pares nombre/valor: se respeta el orden y la clave de reinicio")
    void fromMethods_shouldKeepInsertionOrder() {
        // ARRANGE
        Map<String, Object> methods = new LinkedHashMap<>();
        methods.put("threshold", 150);
        methods.put("reset", "ALL");
        methods.put("Middle", true);

        // ACT
        LengthSplitterConfig config = LengthSplitterConfig.fromMethods(methods);

        // ASSERT
        assertThat(config.rules()).containsExactly(LengthRule.threshold(150.0), LengthRule.middle());
        assertEquals(ResetScope.ALL, config.reset());
    }

    @Test
    @DisplayName("Errores: nombre de regla desconocido")
    void fromMethods_shouldRejectUnknownRule() {
        ConfigurationException error = assertThrows(ConfigurationException.class,
                () -> LengthSplitterConfig.fromMethods(Map.of("maximum", true)));

        assertThat(error.getMessage()).contains("maximum");
    }

    @Test
    @DisplayName("Errores: threshold y length necesitan un valor")
    void lengthRule_shouldRequireValue() {
        assertThrows(ConfigurationException.class, () -> new LengthRule(LengthRuleType.LENGTH, null));
        assertThrows(ConfigurationException.class,
                () -> LengthSplitterConfig.fromMethods(Map.of("threshold", "alto")));
    }
}
