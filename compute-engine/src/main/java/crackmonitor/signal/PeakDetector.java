package crackmonitor.signal;

import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Detección de máximos locales de una señal unidimensional.
 * <p>
 * Los filtros se aplican en este orden: altura mínima, distancia mínima entre picos
 * (los picos más altos tienen prioridad) y prominencia mínima.
 * <ul>
 * <li><b>Meseta:</b> un máximo plano se asigna a su muestra central (redondeando hacia abajo).</li>
 * <li><b>Prominencia:</b> altura del pico sobre el más alto de los dos fondos de valle que se alcanzan
 * al recorrer la señal hacia fuera hasta que supera al pico o se llega al borde.</li>
 * <li><b>Bases:</b> la muestra de cada fondo de valle; a igual valor se conserva la más cercana al pico.</li>
 * </ul>
 * Las muestras de los extremos nunca son picos.
 */
@Slf4j
@Getter
@Builder
public class PeakDetector {

    /**
     * Altura mínima del pico; {@code null} sin restricción.
     */
    private final Double height;
    /**
     * Prominencia mínima; {@code null} sin restricción.
     */
    private final Double prominence;
    /**
     * Distancia horizontal mínima entre picos, en muestras; {@code null} sin restricción.
     */
    private final Integer distance;

    /**
     * Busca los picos de la señal que cumplen todos los filtros configurados.
     *
     * @param signal Señal sin valores ausentes.
     * @return Picos aceptados con sus prominencias y bases.
     */
    public PeakDetectionResult detect(double[] signal) {
        int[] candidates = findLocalMaxima(signal);

        // 1. Altura
        if (height != null) {
            candidates = IntStream.of(candidates).filter(p -> signal[p] >= height).toArray();
        }

        // 2. Distancia
        if (distance != null && distance > 1 && candidates.length > 1) {
            candidates = selectByDistance(signal, candidates, distance);
        }

        // 3. Prominencia y bases
        List<Integer> accepted = new ArrayList<>();
        double[] prominences = new double[candidates.length];
        int[] leftBases = new int[candidates.length];
        int[] rightBases = new int[candidates.length];
        for (int k = 0; k < candidates.length; k++) {
            int peak = candidates[k];
            computeProminence(signal, peak, k, prominences, leftBases, rightBases);
            if (prominence == null || prominences[k] >= prominence) {
                accepted.add(k);
            }
        }

        int n = accepted.size();
        int[] peaks = new int[n];
        double[] acceptedProminences = new double[n];
        int[] acceptedLeft = new int[n];
        int[] acceptedRight = new int[n];
        for (int i = 0; i < n; i++) {
            int k = accepted.get(i);
            peaks[i] = candidates[k];
            acceptedProminences[i] = prominences[k];
            acceptedLeft[i] = leftBases[k];
            acceptedRight[i] = rightBases[k];
        }
        log.debug("Detección de picos: {} máximos locales aceptados de {} muestras", n, signal.length);
        return new PeakDetectionResult(peaks, acceptedProminences, acceptedLeft, acceptedRight);
    }

    /**
     * Máximos locales estrictos (admitiendo mesetas) en orden ascendente.
     */
    static int[] findLocalMaxima(double[] signal) {
        List<Integer> maxima = new ArrayList<>();
        int last = signal.length - 1;
        int i = 1;
        while (i < last) {
            if (signal[i - 1] < signal[i]) {
                int ahead = i + 1;
                while (ahead < last && signal[ahead] == signal[i]) {
                    ahead++;
                }
                if (signal[ahead] < signal[i]) {
                    int left = i;
                    int right = ahead - 1;
                    maxima.add((left + right) / 2);
                    i = ahead;
                }
            }
            i++;
        }
        return maxima.stream().mapToInt(Integer::intValue).toArray();
    }

    private static int[] selectByDistance(double[] signal, int[] peaks, int minDistance) {
        int n = peaks.length;
        boolean[] keep = new boolean[n];
        Arrays.fill(keep, true);
        // Orden por altura ascendente; se recorre desde el más alto.
        Integer[] order = IntStream.range(0, n).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble(k -> signal[peaks[k]]));
        for (int i = n - 1; i >= 0; i--) {
            int j = order[i];
            if (!keep[j]) {
                continue;
            }
            for (int k = j - 1; k >= 0 && peaks[j] - peaks[k] < minDistance; k--) {
                keep[k] = false;
            }
            for (int k = j + 1; k < n && peaks[k] - peaks[j] < minDistance; k++) {
                keep[k] = false;
            }
        }
        return IntStream.range(0, n).filter(k -> keep[k]).map(k -> peaks[k]).toArray();
    }

    private static void computeProminence(double[] signal, int peak, int slot,
                                          double[] prominences, int[] leftBases, int[] rightBases) {
        double peakValue = signal[peak];

        double leftMin = peakValue;
        int leftBase = peak;
        for (int i = peak; i >= 0 && signal[i] <= peakValue; i--) {
            if (signal[i] < leftMin) {
                leftMin = signal[i];
                leftBase = i;
            }
        }

        double rightMin = peakValue;
        int rightBase = peak;
        for (int i = peak; i < signal.length && signal[i] <= peakValue; i++) {
            if (signal[i] < rightMin) {
                rightMin = signal[i];
                rightBase = i;
            }
        }

        prominences[slot] = peakValue - Math.max(leftMin, rightMin);
        leftBases[slot] = leftBase;
        rightBases[slot] = rightBase;
    }
}
