package crackmonitor.domain.exception;

/**
 * Raíz de las excepciones propias del análisis de fisuras.
 * <p>
 * Es no comprobada: los errores de configuración o de estado de los datos no son
 * recuperables por el código que invoca el flujo de cálculo.
 */
public class CrackAnalysisException extends RuntimeException {

    public CrackAnalysisException(String message) {
        super(message);
    }

    public CrackAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
