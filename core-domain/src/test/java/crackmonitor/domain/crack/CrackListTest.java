package crackmonitor.domain.crack;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Pruebas de la colección de fisuras: orden, búsquedas y filtros.
 */
class CrackListTest {

    private Crack first;
    private Crack second;
    private Crack third;
    private CrackList crackList;

    @BeforeEach
    void setUp() {
        first = Crack.builder().index(1).location(1.0).xL(0.5).xR(1.5).maxStrain(300.0).width(0.02).build();
        second = Crack.builder().index(3).location(3.0).xL(2.0).xR(4.0).maxStrain(800.0).width(0.10).build();
        third = Crack.builder().index(6).location(6.0).maxStrain(500.0).build();
        crackList = CrackList.of(first, second, third);
    }

    @Test
    @DisplayName("Orden: ordenar una lista ya ordenada conserva el orden y las mismas instancias")
    void sort_shouldBeNoOpOnSortedList() {
        // ACT
        crackList.sort();

        // ASSERT
        assertSame(first, crackList.get(0));
        assertSame(second, crackList.get(1));
        assertSame(third, crackList.get(2));
    }

    @Test
    @DisplayName("Orden: se ordena por posición y las fisuras sin posición van al final")
    void sort_shouldOrderByLocationWithUnsetLast() {
        // ARRANGE
        Crack unset = new Crack();
        CrackList unordered = CrackList.of(third, unset, first, second);

        // ACT
        unordered.sort();

        // ASSERT
        assertThat(unordered.getLocations()).containsExactly(1.0, 3.0, 6.0, null);
        assertSame(unset, unordered.get(3));
    }

    @Test
    @DisplayName("Construcción: una entrada nula no es una fisura")
    void constructor_shouldRejectNullEntries() {
        assertThrows(IllegalArgumentException.class, () -> new CrackList(Arrays.asList(first, null)));
    }

    @Test
    @DisplayName("Proyecciones: una lista por atributo, con null para los no asignados")
    void projections_shouldExposeAttributeLists() {
        assertThat(crackList.getIndices()).containsExactly(1, 3, 6);
        assertThat(crackList.getMaxStrains()).containsExactly(300.0, 800.0, 500.0);
        assertThat(crackList.getXR()).containsExactly(1.5, 4.0, null);
        assertThat(crackList.project(Crack.WIDTH)).containsExactly(0.02, 0.10, null);
    }

    @Test
    @DisplayName("Búsqueda: la fisura más cercana; a igual distancia, la primera de la lista")
    void findNearest_shouldPreferFirstOnTie() {
        // 2.0 está a la misma distancia de 1.0 y 3.0
        Optional<Crack> nearest = crackList.findNearest(2.0);

        assertThat(nearest).containsSame(first);
        assertThat(crackList.findNearest(5.2)).containsSame(third);
    }

    @Test
    @DisplayName("Búsqueda: fuera de la tolerancia no hay resultado")
    void findNearest_shouldRespectTolerance() {
        assertThat(crackList.findNearest(4.5, 1.0)).isEmpty();
        assertThat(crackList.findNearest(4.0, 1.0)).containsSame(second);
    }

    @Test
    @DisplayName("Búsqueda: el marcador es una fisura nueva situada en la posición consultada")
    void findNearestOrPlaceholder_shouldReturnPlaceholderOnMiss() {
        // ACT
        Crack placeholder = crackList.findNearestOrPlaceholder(10.0, 0.5);

        // ASSERT
        assertEquals(10.0, placeholder.getLocation());
        assertThat(placeholder.getIndex()).isNull();
        assertThat(crackList.indexOf(placeholder)).isEqualTo(-1);
        assertSame(second, crackList.findNearestOrPlaceholder(3.1, 0.5));
    }

    @Test
    @DisplayName("Búsqueda: contención con el límite izquierdo abierto y el derecho cerrado")
    void findContaining_shouldUseHalfOpenSegment() {
        assertThat(crackList.findContaining(4.0)).containsSame(second);
        assertThat(crackList.findContaining(2.0)).isEmpty();
        assertThat(crackList.findContaining(1.2)).containsSame(first);
        // Sin límites asignados nunca contiene
        assertThat(crackList.findContaining(6.0)).isEmpty();
    }

    @Test
    @DisplayName("Filtros: el rango es inclusivo y devuelve copias independientes")
    void filterByRange_shouldReturnIndependentCopies() {
        // ACT
        CrackList wide = crackList.filterByRange(Crack.MAX_STRAIN, 300.0, 500.0);
        wide.get(0).setWidth(99.0);

        // ASSERT
        assertThat(wide.getIndices()).containsExactly(1, 6);
        assertEquals(0.02, first.getWidth());
    }

    @Test
    @DisplayName("Filtros: las fisuras sin el atributo asignado")
    void filterUnset_shouldSelectMissingAttribute() {
        CrackList withoutWidth = crackList.filterUnset(Crack.WIDTH);

        assertThat(withoutWidth.getIndices()).containsExactly(6);
        assertThat(withoutWidth.get(0)).isNotSameAs(third);
    }

    @Test
    @DisplayName("Borrado de atributo en todas las fisuras")
    void clearAttribute_shouldResetEveryMember() {
        crackList.clearAttribute(Crack.WIDTH);

        assertThat(crackList.getWidths()).containsOnlyNulls();
    }

    @Test
    @DisplayName("Copia profunda: otra lista con otras instancias")
    void copy_shouldDeepCopy() {
        CrackList copy = crackList.copy();

        assertEquals(crackList.size(), copy.size());
        assertThat(copy.get(0)).isNotSameAs(first);
        assertThat(copy.getLocations()).isEqualTo(crackList.getLocations());
    }
}
