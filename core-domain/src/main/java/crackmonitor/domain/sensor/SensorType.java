package crackmonitor.domain.sensor;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import crackmonitor.domain.exception.ConfigurationException;

import java.util.Locale;

/**
 * Forma de instalación del sensor de fibra óptica. Determina el modelo de
 * rigidización a tracción por defecto del perfil.
 */
public enum SensorType {
    /**
     * Sensor sin modelo físico asociado.
     */
    GENERIC("generic"),
    /**
     * Sensor embebido directamente en el hormigón (modelo de Fischer).
     */
    CONCRETE("concrete"),
    /**
     * Sensor adherido a una barra de armadura (modelo de Berrocal).
     */
    REBAR("rebar");

    private final String typeName;

    SensorType(String typeName) {
        this.typeName = typeName;
    }

    @JsonValue
    public String getTypeName() {
        return typeName;
    }

    @JsonCreator
    public static SensorType fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (SensorType type : values()) {
                if (type.typeName.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new ConfigurationException(String.format("Tipo de sensor desconocido: '%s'.", name));
    }
}
