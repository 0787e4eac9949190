package crackmonitor.domain.exception;

/**
 * Configuración inválida: nombre de estrategia desconocido o parámetro obligatorio ausente.
 * Depende solo de la configuración, nunca de los datos medidos.
 */
public class ConfigurationException extends CrackAnalysisException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
