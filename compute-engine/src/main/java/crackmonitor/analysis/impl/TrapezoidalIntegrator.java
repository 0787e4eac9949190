package crackmonitor.analysis.impl;

import crackmonitor.analysis.Integrator;
import crackmonitor.utils.NumericArrays;

/**
 * Integración por la regla del trapecio:
 * {@code sum (y_i + y_{i+1}) * (x_{i+1} - x_i) / 2}.
 */
public class TrapezoidalIntegrator implements Integrator {

    @Override
    public String getName() {
        return "Trapezoidal";
    }

    @Override
    public String getDescription() {
        return "Regla del trapecio compuesta sobre muestras no equiespaciadas";
    }

    @Override
    public double integrateSegment(double[] x, double[] y, int startIndex, int endIndex, double initial) {
        NumericArrays.requireSameLength(x, y);
        if (x.length == 0) {
            return initial;
        }
        if (startIndex < 0 || endIndex >= x.length) {
            throw new IndexOutOfBoundsException(String.format(
                    "Tramo [%d, %d] fuera del rango válido [0, %d].", startIndex, endIndex, x.length - 1));
        }
        double sum = 0.0;
        for (int i = startIndex; i < endIndex; i++) {
            sum += (y[i] + y[i + 1]) * (x[i + 1] - x[i]) / 2.0;
        }
        return sum + initial;
    }

    @Override
    public double[] antiderivative(double[] x, double[] y, double initial) {
        NumericArrays.requireSameLength(x, y);
        double[] result = new double[x.length];
        if (x.length == 0) {
            return result;
        }
        result[0] = initial;
        for (int i = 1; i < x.length; i++) {
            result[i] = result[i - 1] + (y[i - 1] + y[i]) * (x[i] - x[i - 1]) / 2.0;
        }
        return result;
    }
}
