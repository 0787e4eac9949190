package crackmonitor.domain.exception;

/**
 * Fallo al calcular una compensación. Envuelve la causa original para que ninguna
 * corrección parcial llegue al cálculo de anchos.
 */
public class CompensationException extends CrackAnalysisException {

    private final String compensatorName;

    public CompensationException(String compensatorName, String message, Throwable cause) {
        super("[" + compensatorName + "] " + message, cause);
        this.compensatorName = compensatorName;
    }

    public String getCompensatorName() {
        return compensatorName;
    }
}
