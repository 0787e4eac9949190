package crackmonitor.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import crackmonitor.domain.exception.ConfigurationException;

import java.util.Locale;

/**
 * Modelos disponibles de rigidización a tracción (tension stiffening).
 */
public enum TensionStiffeningMethod {
    NONE("none"),
    /**
     * Berrocal et al. (2021): sensor adherido a la armadura.
     */
    BERROCAL("berrocal"),
    /**
     * Fischer et al. (2019): sensor embebido en el hormigón.
     */
    FISCHER("fischer");

    private final String methodName;

    TensionStiffeningMethod(String methodName) {
        this.methodName = methodName;
    }

    @JsonValue
    public String getMethodName() {
        return methodName;
    }

    @JsonCreator
    public static TensionStiffeningMethod fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (TensionStiffeningMethod method : values()) {
                if (method.methodName.equals(normalized)) {
                    return method;
                }
            }
        }
        throw new ConfigurationException(String.format("Método de tension stiffening desconocido: '%s'.", name));
    }
}
