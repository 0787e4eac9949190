package crackmonitor.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import crackmonitor.domain.exception.ConfigurationException;

import java.util.Locale;

/**
 * Reglas disponibles para restringir la longitud de transferencia de cada fisura.
 */
public enum LengthRuleType {
    /**
     * Divide en el mínimo de deformación entre dos fisuras vecinas.
     */
    MIN("min", false),
    /**
     * Divide en el punto medio entre dos fisuras vecinas.
     */
    MIDDLE("middle", false),
    /**
     * Limita en la primera muestra cuya deformación cae al umbral o por debajo.
     */
    THRESHOLD("threshold", true),
    /**
     * Limita a un radio fijo alrededor de la fisura.
     */
    LENGTH("length", true);

    private final String ruleName;
    private final boolean valueRequired;

    LengthRuleType(String ruleName, boolean valueRequired) {
        this.ruleName = ruleName;
        this.valueRequired = valueRequired;
    }

    @JsonValue
    public String getRuleName() {
        return ruleName;
    }

    public boolean isValueRequired() {
        return valueRequired;
    }

    /**
     * Resuelve una regla por su nombre (sin distinguir mayúsculas).
     *
     * @throws ConfigurationException si el nombre no corresponde a ninguna regla.
     */
    @JsonCreator
    public static LengthRuleType fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (LengthRuleType type : values()) {
                if (type.ruleName.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new ConfigurationException(String.format("No existe la regla de separación '%s'.", name));
    }
}
