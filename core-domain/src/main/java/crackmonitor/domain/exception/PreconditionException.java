package crackmonitor.domain.exception;

/**
 * El estado de los datos no permite ejecutar la operación
 * (p. ej. menos de dos fisuras para Berrocal, o falta la deformación instantánea).
 */
public class PreconditionException extends CrackAnalysisException {

    public PreconditionException(String message) {
        super(message);
    }
}
