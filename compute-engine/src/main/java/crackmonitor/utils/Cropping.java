package crackmonitor.utils;

import crackmonitor.config.CropConfig;

import java.util.Arrays;

/**
 * Recorte de un conjunto de datos {@code (x_i, y_i)} según la posición.
 * <p>
 * El proceso tiene dos pasos: se desplaza x por el offset ({@code x <- x + o}) y se conservan
 * las entradas con {@code x_i} en {@code [s, e]}. Si hay que suavizar y recortar, primero se suaviza.
 */
public final class Cropping {

    private Cropping() {
    }

    /**
     * Tramo de índices {@code [from, to)} sobre los arrays originales.
     */
    public record IndexRange(int from, int to) {

        public int length() {
            return Math.max(0, to - from);
        }

        public double[] slice(double[] values) {
            return values == null ? null : Arrays.copyOfRange(values, from, Math.max(from, to));
        }
    }

    /**
     * Datos recortados.
     */
    public record Segment(double[] x, double[] y) {
    }

    /**
     * Calcula el tramo de índices cuyas posiciones están en {@code [startPos, endPos]}.
     *
     * @param x        Posiciones en orden ascendente.
     * @param startPos Posición inicial; {@code null} conserva el principio.
     * @param endPos   Posición final (incluida); {@code null} conserva el final.
     */
    public static IndexRange range(double[] x, Double startPos, Double endPos) {
        double start = startPos != null ? startPos : Double.NEGATIVE_INFINITY;
        double end = endPos != null ? endPos : Double.POSITIVE_INFINITY;
        int from = NumericArrays.searchSortedLeft(x, start);
        int to = NumericArrays.searchSortedRight(x, end);
        return new IndexRange(from, Math.max(from, to));
    }

    /**
     * Recorta {@code x} e {@code y} a {@code [startPos, endPos]}.
     */
    public static Segment crop(double[] x, double[] y, Double startPos, Double endPos) {
        NumericArrays.requireSameLength(x, y);
        IndexRange range = range(x, startPos, endPos);
        return new Segment(range.slice(x), range.slice(y));
    }

    /**
     * Tramo de índices según una configuración de recorte completa.
     * El desplazamiento se aplica sobre una copia; el array recibido no se modifica.
     *
     * @param x      Posiciones originales (sin desplazar).
     * @param config Configuración; {@code endPos} tiene prioridad sobre {@code length}.
     */
    public static IndexRange range(double[] x, CropConfig config) {
        if (config.isNoOp()) {
            return new IndexRange(0, x.length);
        }
        double[] shifted = shift(x, config.offset());
        Double start = config.startPos();
        Double end = config.endPos();
        if (end == null && config.length() != null) {
            double base = start != null ? start : (shifted.length > 0 ? shifted[0] : 0.0);
            end = base + config.length();
        }
        return range(shifted, start, end);
    }

    /**
     * Devuelve una copia de {@code x} desplazada por {@code offset} (o una copia sin cambios si es {@code null}).
     */
    public static double[] shift(double[] x, Double offset) {
        double[] shifted = x.clone();
        if (offset != null && offset != 0.0) {
            for (int i = 0; i < shifted.length; i++) {
                shifted[i] += offset;
            }
        }
        return shifted;
    }
}
