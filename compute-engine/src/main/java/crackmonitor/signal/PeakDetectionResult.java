package crackmonitor.signal;

/**
 * Picos aceptados por {@link PeakDetector}, con sus propiedades alineadas por posición.
 *
 * @param peaks       Índices de los picos, en orden ascendente.
 * @param prominences Prominencia topográfica de cada pico.
 * @param leftBases   Índice del fondo de valle izquierdo que define la prominencia.
 * @param rightBases  Índice del fondo de valle derecho que define la prominencia.
 */
public record PeakDetectionResult(int[] peaks, double[] prominences, int[] leftBases, int[] rightBases) {

    public int size() {
        return peaks.length;
    }

    public boolean isEmpty() {
        return peaks.length == 0;
    }
}
