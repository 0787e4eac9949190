package crackmonitor.analysis;

/**
 * Integración numérica de una función discreta {@code y = f(x)}.
 * <p>
 * Los datos se asumen ya saneados (sin NaN); el comportamiento con valores ausentes no está definido.
 */
public interface Integrator extends AnalysisComponent {

    /**
     * Integral definida sobre el tramo {@code [startIndex, endIndex]} (ambos incluidos) más la constante {@code initial}.
     */
    double integrateSegment(double[] x, double[] y, int startIndex, int endIndex, double initial);

    /**
     * Primitiva acumulada: array de la misma longitud que la entrada, con {@code initial} en la primera posición.
     */
    double[] antiderivative(double[] x, double[] y, double initial);

    default double integrateSegment(double[] x, double[] y, int startIndex, int endIndex) {
        return integrateSegment(x, y, startIndex, endIndex, 0.0);
    }

    /**
     * Integral sobre todo el array.
     */
    default double integrateSegment(double[] x, double[] y) {
        return integrateSegment(x, y, 0, x.length - 1, 0.0);
    }

    default double[] antiderivative(double[] x, double[] y) {
        return antiderivative(x, y, 0.0);
    }
}
