package crackmonitor.config;

import crackmonitor.domain.exception.ConfigurationException;
import lombok.Builder;
import lombok.With;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Conjunto ordenado de reglas para asignar la longitud de transferencia.
 * <p>
 * Todas las reglas se aplican en orden; cada límite resultante es el más cercano a la fisura.
 *
 * @param rules Reglas, en orden de aplicación.
 * @param reset Reinicio previo de los límites.
 */
@Builder
@With
public record LengthSplitterConfig(
        List<LengthRule> rules,
        ResetScope reset
) {
    public static final String RESET_KEY = "reset";

    public LengthSplitterConfig {
        rules = rules == null ? List.of() : List.copyOf(rules);
        reset = reset == null ? ResetScope.NO : reset;
    }

    /**
     * Configuración por defecto: mínimo entre fisuras, radio de 0.2 y reinicio interior.
     */
    public static LengthSplitterConfig getDefault() {
        return LengthSplitterConfig.builder()
                .rules(List.of(LengthRule.min(), LengthRule.length(0.2)))
                .reset(ResetScope.INNER)
                .build();
    }

    /**
     * Construye la configuración a partir de pares nombre/valor en orden de inserción,
     * p. ej. {@code {"min": true, "length": 0.2, "reset": "inner"}}.
     * El valor de {@code min} y {@code middle} se ignora.
     *
     * @throws ConfigurationException si algún nombre es desconocido o falta un valor obligatorio.
     */
    public static LengthSplitterConfig fromMethods(Map<String, ?> methods) {
        List<LengthRule> rules = new ArrayList<>();
        ResetScope reset = ResetScope.NO;
        for (Map.Entry<String, ?> entry : methods.entrySet()) {
            if (RESET_KEY.equalsIgnoreCase(entry.getKey())) {
                reset = ResetScope.fromName(String.valueOf(entry.getValue()));
                continue;
            }
            LengthRuleType type = LengthRuleType.fromName(entry.getKey());
            Double value = null;
            if (type.isValueRequired()) {
                if (!(entry.getValue() instanceof Number)) {
                    throw new ConfigurationException(String.format(
                            "La regla '%s' necesita un valor numérico, recibido: %s", type.getRuleName(), entry.getValue()));
                }
                value = ((Number) entry.getValue()).doubleValue();
            }
            rules.add(new LengthRule(type, value));
        }
        return new LengthSplitterConfig(rules, reset);
    }
}
