package crackmonitor.domain.crack;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Representa una fisura identificada en el hormigón.
 * <p>
 * La fisura se ensambla de forma incremental a lo largo de varias etapas independientes
 * (detección, separación de longitudes, cálculo de ancho). Por eso todos los campos son
 * opcionales: un valor {@code null} significa "no disponible todavía".
 * <p>
 * Además de los campos fijos, admite atributos de extensión arbitrarios
 * mediante {@link #getAttribute(String)} y {@link #setAttribute(String, Object)}.
 */
@Getter
@Setter
public class Crack {

    public static final String INDEX = "index";
    public static final String LOCATION = "location";
    public static final String X_L = "x_l";
    public static final String X_R = "x_r";
    public static final String MAX_STRAIN = "max_strain";
    public static final String WIDTH = "width";
    public static final String NAME = "name";

    /**
     * Nombres de los atributos fijos del registro.
     */
    public static final Set<String> CORE_ATTRIBUTES = Set.of(INDEX, LOCATION, X_L, X_R, MAX_STRAIN, WIDTH, NAME);

    /**
     * Índice de la muestra del pico en los arrays saneados del perfil.
     */
    private Integer index;
    /**
     * Posición absoluta a lo largo del sensor (siempre coincide con una muestra de x).
     */
    private Double location;
    /**
     * Límite izquierdo de la longitud de transferencia.
     */
    private Double xL;
    /**
     * Límite derecho de la longitud de transferencia.
     */
    private Double xR;
    /**
     * Deformación medida en {@link #location}.
     */
    private Double maxStrain;
    /**
     * Ancho de apertura, resultado de integrar la deformación sobre la longitud de transferencia.
     */
    private Double width;
    private String name;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private final Map<String, Object> extensions = new LinkedHashMap<>();

    public Crack() {
    }

    @Builder
    public Crack(Integer index, Double location, Double xL, Double xR, Double maxStrain, Double width, String name) {
        this.index = index;
        this.location = location;
        this.xL = xL;
        this.xR = xR;
        this.maxStrain = maxStrain;
        this.width = width;
        this.name = name;
    }

    // --- MAGNITUDES DERIVADAS ---

    /**
     * Longitud de transferencia total {@code x_r - x_l}, o {@code null} si falta algún límite.
     */
    public Double getLt() {
        if (xL == null || xR == null) {
            return null;
        }
        return xR - xL;
    }

    /**
     * Distancia desde la fisura hasta el límite izquierdo.
     */
    public Double getLtL() {
        if (location == null || xL == null) {
            return null;
        }
        return location - xL;
    }

    /**
     * Distancia desde la fisura hasta el límite derecho.
     */
    public Double getLtR() {
        if (location == null || xR == null) {
            return null;
        }
        return xR - location;
    }

    /**
     * Segmento de influencia {@code [x_l, x_r]}, o {@code null} si falta algún límite.
     */
    public double[] getSegment() {
        if (xL == null || xR == null) {
            return null;
        }
        return new double[]{xL, xR};
    }

    // --- ATRIBUTOS GENÉRICOS ---

    /**
     * Lee un atributo por nombre. Los nombres de {@link #CORE_ATTRIBUTES} se resuelven contra
     * los campos fijos; el resto contra los atributos de extensión.
     *
     * @param attributeName Nombre del atributo.
     * @return El valor, o vacío si no está asignado o el nombre es desconocido.
     */
    public Optional<Object> getAttribute(String attributeName) {
        Objects.requireNonNull(attributeName, "El nombre del atributo no puede ser nulo.");
        switch (attributeName) {
            case INDEX:
                return Optional.ofNullable(index);
            case LOCATION:
                return Optional.ofNullable(location);
            case X_L:
                return Optional.ofNullable(xL);
            case X_R:
                return Optional.ofNullable(xR);
            case MAX_STRAIN:
                return Optional.ofNullable(maxStrain);
            case WIDTH:
                return Optional.ofNullable(width);
            case NAME:
                return Optional.ofNullable(name);
            default:
                return Optional.ofNullable(extensions.get(attributeName));
        }
    }

    /**
     * Asigna un atributo por nombre. Un valor {@code null} equivale a borrarlo.
     *
     * @throws IllegalArgumentException si el tipo del valor no encaja con el campo fijo.
     */
    public void setAttribute(String attributeName, Object value) {
        Objects.requireNonNull(attributeName, "El nombre del atributo no puede ser nulo.");
        try {
            switch (attributeName) {
                case INDEX:
                    this.index = value == null ? null : ((Number) value).intValue();
                    break;
                case LOCATION:
                    this.location = toDouble(value);
                    break;
                case X_L:
                    this.xL = toDouble(value);
                    break;
                case X_R:
                    this.xR = toDouble(value);
                    break;
                case MAX_STRAIN:
                    this.maxStrain = toDouble(value);
                    break;
                case WIDTH:
                    this.width = toDouble(value);
                    break;
                case NAME:
                    this.name = value == null ? null : value.toString();
                    break;
                default:
                    if (value == null) {
                        extensions.remove(attributeName);
                    } else {
                        extensions.put(attributeName, value);
                    }
            }
        } catch (ClassCastException e) {
            throw new IllegalArgumentException(String.format(
                    "El atributo '%s' requiere un valor numérico, recibido: %s", attributeName, value), e);
        }
    }

    /**
     * Vista de solo lectura de los atributos de extensión.
     */
    public Map<String, Object> getExtensions() {
        return Collections.unmodifiableMap(extensions);
    }

    /**
     * Copia independiente de la fisura, incluidos los atributos de extensión.
     */
    public Crack copy() {
        Crack copy = new Crack(index, location, xL, xR, maxStrain, width, name);
        copy.extensions.putAll(extensions);
        return copy;
    }

    private static Double toDouble(Object value) {
        return value == null ? null : ((Number) value).doubleValue();
    }

    @Override
    public String toString() {
        return String.format("Crack[index=%s, location=%s, x_l=%s, x_r=%s, max_strain=%s, width=%s]",
                index, location, xL, xR, maxStrain, width);
    }
}
