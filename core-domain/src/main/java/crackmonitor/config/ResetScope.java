package crackmonitor.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import crackmonitor.domain.exception.ConfigurationException;

import java.util.Locale;

/**
 * Alcance del reinicio de límites (a -inf / +inf) previo a la aplicación de las reglas.
 */
public enum ResetScope {
    /**
     * Se reinician todos los límites salvo el exterior de las fisuras de los extremos.
     */
    INNER("inner"),
    /**
     * Se reinician todos los límites.
     */
    ALL("all"),
    /**
     * Sin reinicio: se conservan los límites recibidos.
     */
    NO("no");

    private final String scopeName;

    ResetScope(String scopeName) {
        this.scopeName = scopeName;
    }

    @JsonValue
    public String getScopeName() {
        return scopeName;
    }

    @JsonCreator
    public static ResetScope fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (ResetScope scope : values()) {
                if (scope.scopeName.equals(normalized)) {
                    return scope;
                }
            }
        }
        throw new ConfigurationException(String.format("Opción de reinicio desconocida: '%s'.", name));
    }
}
