package crackmonitor.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class NumericArraysTest {

    private static final double[] X = {0, 1, 2, 3, 4};

    @Test
    @DisplayName("Muestra más cercana: a igual distancia gana la menor")
    void findClosestIndex_shouldBreakTiesTowardsSmallerSample() {
        assertEquals(1, NumericArrays.findClosestIndex(X, 1.5));
        assertEquals(2, NumericArrays.findClosestIndex(X, 1.51));
        assertEquals(3, NumericArrays.findClosestIndex(X, 3.0));
    }

    @Test
    @DisplayName("Muestra más cercana: fuera de rango e infinitos se ajustan a los extremos")
    void findClosestIndex_shouldClampToEnds() {
        assertEquals(0, NumericArrays.findClosestIndex(X, -7.0));
        assertEquals(4, NumericArrays.findClosestIndex(X, 12.0));
        assertEquals(0, NumericArrays.findClosestIndex(X, Double.NEGATIVE_INFINITY));
        assertEquals(4, NumericArrays.findClosestIndex(X, Double.POSITIVE_INFINITY));
        assertThrows(IllegalArgumentException.class, () -> NumericArrays.findClosestIndex(new double[0], 1.0));
    }

    @Test
    @DisplayName("Interpolación: lineal a tramos con extrapolación constante")
    void interpolate_shouldExtrapolateConstant() {
        double[] xp = {1, 3};
        double[] fp = {10, 30};

        double[] values = NumericArrays.interpolate(new double[]{0, 1, 2, 3, 5}, xp, fp);

        assertThat(values).containsExactly(new double[]{10, 10, 20, 30, 30}, within(1e-12));
    }

    @Test
    @DisplayName("Interpolación: un punto de apoyo repetido produce un salto")
    void interpolate_shouldHandleRepeatedSupportPoint() {
        double[] xp = {0, 2, 2, 4};
        double[] fp = {0, 10, 50, 50};

        assertEquals(5.0, NumericArrays.interpolate(1.0, xp, fp), 1e-12);
        assertEquals(50.0, NumericArrays.interpolate(2.0, xp, fp), 1e-12);
    }

    @Test
    @DisplayName("Mínimo: en caso de empate, el primer índice del rango")
    void argMin_shouldReturnFirstOnTie() {
        double[] values = {5, 1, 3, 1, 0};

        assertEquals(1, NumericArrays.argMin(values, 0, 4));
        assertEquals(3, NumericArrays.argMin(values, 2, 4));
        assertThrows(IllegalArgumentException.class, () -> NumericArrays.argMin(values, 2, 2));
    }

    @Test
    @DisplayName("Búsqueda ordenada: izquierda y derecha difieren solo en los valores repetidos")
    void searchSorted_shouldMatchInsertionPoints() {
        double[] sorted = {1, 2, 2, 3};

        assertEquals(1, NumericArrays.searchSortedLeft(sorted, 2.0));
        assertEquals(3, NumericArrays.searchSortedRight(sorted, 2.0));
        assertEquals(0, NumericArrays.searchSortedLeft(sorted, Double.NEGATIVE_INFINITY));
        assertEquals(4, NumericArrays.searchSortedRight(sorted, Double.POSITIVE_INFINITY));
    }
}
