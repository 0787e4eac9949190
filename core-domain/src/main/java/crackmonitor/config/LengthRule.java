package crackmonitor.config;

import crackmonitor.domain.exception.ConfigurationException;

/**
 * Una regla de separación con su parámetro.
 *
 * @param type  Tipo de regla.
 * @param value Umbral de deformación ({@code THRESHOLD}) o radio ({@code LENGTH}); ignorado en el resto.
 */
public record LengthRule(LengthRuleType type, Double value) {

    public LengthRule {
        if (type == null) {
            throw new ConfigurationException("La regla de separación debe indicar su tipo.");
        }
        if (type.isValueRequired() && (value == null || value.isNaN())) {
            throw new ConfigurationException(String.format(
                    "La regla '%s' necesita un valor numérico.", type.getRuleName()));
        }
    }

    public static LengthRule min() {
        return new LengthRule(LengthRuleType.MIN, null);
    }

    public static LengthRule middle() {
        return new LengthRule(LengthRuleType.MIDDLE, null);
    }

    public static LengthRule threshold(double strain) {
        return new LengthRule(LengthRuleType.THRESHOLD, strain);
    }

    public static LengthRule length(double radius) {
        return new LengthRule(LengthRuleType.LENGTH, radius);
    }
}
