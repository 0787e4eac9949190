package crackmonitor.utils;

/**
 * Utilidades numéricas sobre arrays unidimensionales ordenados.
 */
public final class NumericArrays {

    private NumericArrays() {
    }

    /**
     * Índice de la muestra de {@code sorted} más cercana a {@code value}.
     * A igual distancia de dos vecinos se elige el menor.
     *
     * @param sorted Array en orden ascendente, no vacío.
     * @param value  Valor objetivo (se admiten infinitos: se ajustan a los extremos).
     */
    public static int findClosestIndex(double[] sorted, double value) {
        if (sorted.length == 0) {
            throw new IllegalArgumentException("No se puede buscar en un array vacío.");
        }
        int i = searchSortedLeft(sorted, value);
        if (i == 0) {
            return 0;
        }
        if (i == sorted.length) {
            return sorted.length - 1;
        }
        double distLeft = Math.abs(value - sorted[i - 1]);
        double distRight = Math.abs(value - sorted[i]);
        return distRight < distLeft ? i : i - 1;
    }

    /**
     * Primera posición en la que {@code value} podría insertarse manteniendo el orden.
     */
    public static int searchSortedLeft(double[] sorted, double value) {
        int low = 0;
        int high = sorted.length;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (sorted[mid] < value) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    /**
     * Número de elementos menores o iguales que {@code value}.
     */
    public static int searchSortedRight(double[] sorted, double value) {
        int low = 0;
        int high = sorted.length;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (sorted[mid] <= value) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    /**
     * Interpolación lineal a tramos con extrapolación constante fuera de {@code [xp[0], xp[n-1]]}.
     *
     * @param xq Abscisas a evaluar.
     * @param xp Abscisas de apoyo, en orden ascendente (se admiten repeticiones).
     * @param fp Ordenadas de apoyo.
     */
    public static double[] interpolate(double[] xq, double[] xp, double[] fp) {
        double[] result = new double[xq.length];
        for (int i = 0; i < xq.length; i++) {
            result[i] = interpolate(xq[i], xp, fp);
        }
        return result;
    }

    public static double interpolate(double xq, double[] xp, double[] fp) {
        requireSameLength(xp, fp);
        int n = xp.length;
        if (n == 0) {
            throw new IllegalArgumentException("Se necesita al menos un punto de apoyo para interpolar.");
        }
        if (xq < xp[0]) {
            return fp[0];
        }
        if (xq >= xp[n - 1]) {
            return fp[n - 1];
        }
        // Último j con xp[j] <= xq; aquí xp[j] <= xq < xp[j + 1]
        int j = searchSortedRight(xp, xq) - 1;
        double slope = (fp[j + 1] - fp[j]) / (xp[j + 1] - xp[j]);
        return fp[j] + slope * (xq - xp[j]);
    }

    /**
     * Índice del mínimo en {@code [from, to)}; en caso de empate, el primero.
     */
    public static int argMin(double[] values, int from, int to) {
        if (from >= to) {
            throw new IllegalArgumentException(String.format("Rango vacío [%d, %d).", from, to));
        }
        int best = from;
        for (int i = from + 1; i < to; i++) {
            if (values[i] < values[best]) {
                best = i;
            }
        }
        return best;
    }

    public static double[] negate(double[] values) {
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = -values[i];
        }
        return result;
    }

    public static void requireSameLength(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(String.format(
                    "El número de entradas no coincide (%d frente a %d).", a.length, b.length));
        }
    }
}
