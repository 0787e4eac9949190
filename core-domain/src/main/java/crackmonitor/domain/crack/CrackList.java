package crackmonitor.domain.crack;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Colección ordenada de {@link Crack}.
 * <p>
 * Mientras se asignan las longitudes de transferencia, la lista debe estar ordenada
 * de forma ascendente por {@code location} (ver {@link #sort()}).
 * Las búsquedas devuelven vacío (o un marcador) en lugar de lanzar excepciones:
 * que no haya una fisura en una posición consultada es un resultado habitual.
 * Los filtros devuelven copias independientes para que la edición por parte del
 * cliente no altere la lista almacenada.
 */
@Slf4j
public class CrackList implements Iterable<Crack> {

    private static final Comparator<Crack> BY_LOCATION = Comparator.comparing(
            Crack::getLocation, Comparator.nullsLast(Comparator.naturalOrder()));

    private final List<Crack> cracks;

    public CrackList() {
        this.cracks = new ArrayList<>();
    }

    public CrackList(Collection<Crack> cracks) {
        Objects.requireNonNull(cracks, "La colección de fisuras no puede ser nula.");
        if (cracks.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Al menos una de las entradas no es una fisura.");
        }
        this.cracks = new ArrayList<>(cracks);
    }

    public static CrackList of(Crack... cracks) {
        return new CrackList(List.of(cracks));
    }

    // --- ACCESO BÁSICO ---

    public int size() {
        return cracks.size();
    }

    public boolean isEmpty() {
        return cracks.isEmpty();
    }

    public Crack get(int position) {
        return cracks.get(position);
    }

    public void add(Crack crack) {
        cracks.add(Objects.requireNonNull(crack, "No se puede añadir una fisura nula."));
    }

    public Crack remove(int position) {
        return cracks.remove(position);
    }

    /**
     * Posición de la instancia dada en la lista (comparación por identidad), o -1.
     */
    public int indexOf(Crack crack) {
        for (int i = 0; i < cracks.size(); i++) {
            if (cracks.get(i) == crack) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public Iterator<Crack> iterator() {
        return cracks.iterator();
    }

    public Stream<Crack> stream() {
        return cracks.stream();
    }

    /**
     * Copia profunda: nueva lista con copias independientes de cada fisura.
     */
    public CrackList copy() {
        return new CrackList(cracks.stream().map(Crack::copy).collect(Collectors.toList()));
    }

    /**
     * Ordena la lista por {@code location} de forma estable (los empates conservan el orden previo).
     * Las fisuras sin posición quedan al final.
     */
    public void sort() {
        cracks.sort(BY_LOCATION);
    }

    // --- PROYECCIONES ---

    public List<Double> getLocations() {
        return project(Crack::getLocation);
    }

    public List<Double> getXL() {
        return project(Crack::getXL);
    }

    public List<Double> getXR() {
        return project(Crack::getXR);
    }

    public List<Double> getMaxStrains() {
        return project(Crack::getMaxStrain);
    }

    public List<Double> getWidths() {
        return project(Crack::getWidth);
    }

    public List<Integer> getIndices() {
        return project(Crack::getIndex);
    }

    /**
     * Proyección genérica de un atributo sobre todas las fisuras. Los valores no asignados son {@code null}.
     */
    public List<Object> project(String attributeName) {
        return project(crack -> crack.getAttribute(attributeName).orElse(null));
    }

    private <T> List<T> project(Function<Crack, T> getter) {
        List<T> values = new ArrayList<>(cracks.size());
        for (Crack crack : cracks) {
            values.add(getter.apply(crack));
        }
        return values;
    }

    // --- BÚSQUEDAS ---

    /**
     * Fisura más cercana a la posición dada. En caso de empate gana la primera de la lista.
     */
    public Optional<Crack> findNearest(double position) {
        return findNearest(position, Double.POSITIVE_INFINITY);
    }

    /**
     * Fisura más cercana cuya distancia a la posición no supere la tolerancia.
     *
     * @param position  Posición consultada.
     * @param tolerance Distancia máxima admitida (inclusive).
     */
    public Optional<Crack> findNearest(double position, double tolerance) {
        Crack closest = null;
        double minDistance = Double.POSITIVE_INFINITY;
        for (Crack crack : cracks) {
            if (crack.getLocation() == null) {
                continue;
            }
            double distance = Math.abs(position - crack.getLocation());
            if (distance < minDistance) {
                minDistance = distance;
                closest = crack;
            }
        }
        if (closest == null || minDistance > tolerance) {
            log.debug("Sin fisura a menos de {} de la posición {}", tolerance, position);
            return Optional.empty();
        }
        return Optional.of(closest);
    }

    /**
     * Igual que {@link #findNearest(double, double)}, pero ante un fallo devuelve una fisura
     * marcador situada en la posición consultada y sin ningún otro dato.
     */
    public Crack findNearestOrPlaceholder(double position, double tolerance) {
        return findNearest(position, tolerance)
                .orElseGet(() -> Crack.builder().location(position).build());
    }

    /**
     * Primera fisura cuya longitud de transferencia contiene la posición: {@code x_l < position <= x_r}.
     */
    public Optional<Crack> findContaining(double position) {
        for (Crack crack : cracks) {
            if (crack.getXL() == null || crack.getXR() == null) {
                continue;
            }
            if (crack.getXL() < position && position <= crack.getXR()) {
                return Optional.of(crack);
            }
        }
        return Optional.empty();
    }

    // --- FILTROS ---

    /**
     * Fisuras cuyo atributo numérico está dentro de {@code [min, max]}.
     * Las fisuras con el atributo sin asignar (o no numérico) se descartan.
     *
     * @return Nueva lista con copias independientes.
     */
    public CrackList filterByRange(String attributeName, double min, double max) {
        List<Crack> selected = new ArrayList<>();
        for (Crack crack : cracks) {
            Optional<Object> value = crack.getAttribute(attributeName);
            if (value.isPresent() && value.get() instanceof Number) {
                double v = ((Number) value.get()).doubleValue();
                if (min <= v && v <= max) {
                    selected.add(crack.copy());
                }
            }
        }
        return new CrackList(selected);
    }

    /**
     * Fisuras que no tienen asignado el atributo dado.
     *
     * @return Nueva lista con copias independientes.
     */
    public CrackList filterUnset(String attributeName) {
        return new CrackList(cracks.stream()
                .filter(crack -> crack.getAttribute(attributeName).isEmpty())
                .map(Crack::copy)
                .collect(Collectors.toList()));
    }

    /**
     * Borra el atributo dado en todas las fisuras de la lista.
     */
    public void clearAttribute(String attributeName) {
        for (Crack crack : cracks) {
            crack.setAttribute(attributeName, null);
        }
    }

    @Override
    public String toString() {
        return "CrackList" + cracks;
    }
}
