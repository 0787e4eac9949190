package crackmonitor.analysis;

/**
 * Compensación de la retracción y la fluencia del hormigón.
 */
public interface ShrinkCompensator extends Compensator {
    /**
     * @param x          Posiciones.
     * @param strain     Deformación medida con retardo tras aplicar la carga.
     * @param strainInst Deformación instantánea, justo después de aplicar la carga.
     * @return Corrección por muestra, de la misma longitud que {@code x}.
     * @throws crackmonitor.domain.exception.PreconditionException si falta alguna de las entradas.
     */
    double[] run(double[] x, double[] strain, double[] strainInst);
}
