package crackmonitor.profile;

import crackmonitor.analysis.CrackFinder;
import crackmonitor.analysis.Integrator;
import crackmonitor.analysis.LengthSplitter;
import crackmonitor.analysis.ShrinkCompensator;
import crackmonitor.analysis.TensionStiffeningCompensator;
import crackmonitor.analysis.impl.PeakCrackFinder;
import crackmonitor.analysis.impl.RuleBasedLengthSplitter;
import crackmonitor.analysis.impl.TrapezoidalIntegrator;
import crackmonitor.config.CropConfig;
import crackmonitor.domain.crack.Crack;
import crackmonitor.domain.crack.CrackList;
import crackmonitor.domain.exception.CompensationException;
import crackmonitor.utils.Cropping;
import crackmonitor.utils.NumericArrays;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Perfil de deformación de un sensor distribuido y flujo de cálculo de anchos de fisura.
 * <p>
 * El ancho de la fisura i-ésima es
 * {@code w_i = integral sobre [x_l, x_r] de (e(x) - e_shrink(x) - e_ts(x)) dx}, donde:
 * <ul>
 * <li>{@code e(x)}: deformación medida ({@link #getStrain()}).</li>
 * <li>{@code e_shrink(x)}: corrección de retracción y fluencia, calculada por el {@link ShrinkCompensator}.</li>
 * <li>{@code e_ts(x)}: corrección de tension stiffening, calculada por el {@link TensionStiffeningCompensator}.</li>
 * <li>{@code [x_l, x_r]}: longitud de transferencia, asignada por el {@link LengthSplitter}.</li>
 * </ul>
 * El perfil es dueño exclusivo de sus arrays y de su lista de fisuras. Los datos de entrada
 * se copian al construir y los getters de arrays devuelven copias.
 * <p>
 * No es thread-safe: está pensado para análisis offline en un único hilo.
 */
@Slf4j
public class StrainProfile {

    // --- Datos originales (inmutables) ---
    private final double[] xOrig;
    private final double[] strainOrig;
    private final double[] strainInstOrig;

    // --- Estrategias ---
    @Getter
    private final String name;
    @Getter
    private final CrackFinder crackFinder;
    @Getter
    private final LengthSplitter lengthSplitter;
    @Getter
    private final Integrator integrator;
    @Getter
    private final ShrinkCompensator shrinkCompensator;
    @Getter
    private final TensionStiffeningCompensator tensionStiffeningCompensator;
    @Getter
    private final CropConfig crop;
    @Getter
    private final boolean suppressCompression;

    // --- Copias de trabajo ---
    private double[] x;
    private double[] strain;
    private double[] strainInst;

    // --- Estado derivado ---
    @Getter
    private CrackList crackList;
    private double[] shrinkCalibrationValues;
    private double[] tensionStiffeningValues;
    private double[] compensatedStrain;
    @Getter
    private ProfileState state;

    /**
     * Construye un perfil. Solo {@code x} y {@code strain} son obligatorios; las estrategias
     * ausentes toman su configuración por defecto, salvo los compensadores: sin compensador
     * no se aplica la corrección correspondiente.
     *
     * @param x                            Posiciones, estrictamente crecientes.
     * @param strain                       Deformación alineada con {@code x}.
     * @param strainInst                   Deformación instantánea (opcional, necesaria para la retracción).
     * @param crackFinder                  Localización de fisuras.
     * @param lengthSplitter               Asignación de longitudes de transferencia.
     * @param integrator                   Integración de la deformación.
     * @param shrinkCompensator            Compensación de retracción (opcional).
     * @param tensionStiffeningCompensator Compensación de tension stiffening (opcional).
     * @param crop                         Recorte del área de medida (opcional).
     * @param name                         Nombre del perfil.
     * @param suppressCompression          Si se anulan las deformaciones negativas tras compensar (por defecto sí).
     * @throws IllegalArgumentException si las longitudes no coinciden o {@code x} no es estrictamente creciente.
     */
    @Builder
    public StrainProfile(double[] x,
                         double[] strain,
                         double[] strainInst,
                         CrackFinder crackFinder,
                         LengthSplitter lengthSplitter,
                         Integrator integrator,
                         ShrinkCompensator shrinkCompensator,
                         TensionStiffeningCompensator tensionStiffeningCompensator,
                         CropConfig crop,
                         String name,
                         Boolean suppressCompression) {
        // --- Validación de Parámetros ---
        Objects.requireNonNull(x, "El array de posiciones no puede ser nulo.");
        Objects.requireNonNull(strain, "El array de deformaciones no puede ser nulo.");
        if (x.length != strain.length) {
            throw new IllegalArgumentException(String.format(
                    "El número de entradas no coincide (x: %d, strain: %d).", x.length, strain.length));
        }
        if (strainInst != null && strainInst.length != x.length) {
            throw new IllegalArgumentException(String.format(
                    "El número de entradas no coincide (x: %d, strain_inst: %d).", x.length, strainInst.length));
        }
        for (int i = 0; i < x.length - 1; i++) {
            if (!(x[i] < x[i + 1])) {
                throw new IllegalArgumentException(String.format(
                        "Las posiciones deben ser estrictamente crecientes: x[%d]=%s, x[%d]=%s.", i, x[i], i + 1, x[i + 1]));
            }
        }

        this.xOrig = x.clone();
        this.strainOrig = strain.clone();
        this.strainInstOrig = strainInst != null ? strainInst.clone() : null;

        this.name = name != null ? name : "";
        this.crackFinder = crackFinder != null ? crackFinder : new PeakCrackFinder();
        this.lengthSplitter = lengthSplitter != null ? lengthSplitter : new RuleBasedLengthSplitter();
        this.integrator = integrator != null ? integrator : new TrapezoidalIntegrator();
        this.shrinkCompensator = shrinkCompensator;
        this.tensionStiffeningCompensator = tensionStiffeningCompensator;
        this.crop = crop != null ? crop : CropConfig.getDefault();
        this.suppressCompression = suppressCompression == null || suppressCompression;

        cleanData();
    }

    // --- CICLO DE CÁLCULO ---

    /**
     * Restaura las copias de trabajo desde los datos originales (aplicando el recorte) y
     * descarta todo el estado derivado: lista de fisuras y ambas correcciones.
     */
    public void cleanData() {
        Cropping.IndexRange range = Cropping.range(xOrig, crop);
        this.x = range.slice(Cropping.shift(xOrig, crop.offset()));
        this.strain = range.slice(strainOrig);
        this.strainInst = range.slice(strainInstOrig);

        this.crackList = new CrackList();
        this.shrinkCalibrationValues = null;
        this.tensionStiffeningValues = null;
        this.compensatedStrain = null;
        this.state = ProfileState.EMPTY;
        log.debug("Perfil '{}' reiniciado con {} muestras", name, x.length);
    }

    /**
     * Localiza las fisuras con el {@link CrackFinder}. Si ya hay fisuras, no hace nada:
     * para volver a buscarlas hay que llamar antes a {@link #cleanData()}.
     */
    public CrackList findCracks() {
        if (!crackList.isEmpty()) {
            return crackList;
        }
        this.crackList = crackFinder.run(x, strain);
        this.state = ProfileState.FOUND;
        log.info("Perfil '{}': {} fisuras localizadas con {}", name, crackList.size(), crackFinder.getName());
        return crackList;
    }

    /**
     * Asigna las longitudes de transferencia con el {@link LengthSplitter}.
     * Si la lista está vacía, antes se ejecuta {@link #findCracks()}.
     */
    public CrackList assignEffectiveLengths() {
        if (crackList.isEmpty()) {
            findCracks();
        }
        splitLengths();
        return crackList;
    }

    /**
     * Calcula y guarda la corrección de retracción. Sin compensador, la corrección es nula (ceros).
     *
     * @throws CompensationException si el compensador falla por cualquier motivo.
     */
    public double[] compensateShrink() {
        if (shrinkCompensator == null) {
            this.shrinkCalibrationValues = new double[x.length];
            return shrinkCalibrationValues.clone();
        }
        try {
            double[] values = shrinkCompensator.run(x, strain, strainInst);
            requireAligned(values, shrinkCompensator.getName());
            this.shrinkCalibrationValues = values.clone();
        } catch (RuntimeException e) {
            this.shrinkCalibrationValues = null;
            log.error("Perfil '{}': fallo al compensar la retracción con {}", name, shrinkCompensator.getName(), e);
            throw new CompensationException(shrinkCompensator.getName(),
                    "Error al calcular la compensación de retracción.", e);
        }
        return shrinkCalibrationValues.clone();
    }

    /**
     * Calcula y guarda la corrección de tension stiffening. Si las longitudes de transferencia
     * no están asignadas, antes se asignan. Sin compensador, la corrección es nula (ceros).
     *
     * @throws CompensationException si el compensador falla por cualquier motivo.
     */
    public double[] calculateTensionStiffening() {
        if (tensionStiffeningCompensator == null) {
            this.tensionStiffeningValues = new double[x.length];
            return tensionStiffeningValues.clone();
        }
        if (!state.isAtLeast(ProfileState.LENGTHS_ASSIGNED)) {
            assignEffectiveLengths();
        }
        try {
            double[] values = tensionStiffeningCompensator.run(x, strain, crackList);
            requireAligned(values, tensionStiffeningCompensator.getName());
            this.tensionStiffeningValues = values.clone();
        } catch (RuntimeException e) {
            this.tensionStiffeningValues = null;
            log.error("Perfil '{}': fallo al calcular el tension stiffening con {}",
                    name, tensionStiffeningCompensator.getName(), e);
            throw new CompensationException(tensionStiffeningCompensator.getName(),
                    "Error al calcular la compensación de tension stiffening.", e);
        }
        return tensionStiffeningValues.clone();
    }

    /**
     * Calcula el ancho de todas las fisuras con el reinicio completo previo.
     */
    public CrackList calculateCrackWidths() {
        return calculateCrackWidths(true);
    }

    /**
     * Calcula el ancho de todas las fisuras:
     * <ol>
     * <li>Opcionalmente reinicia todo el estado derivado ({@link #cleanData()}).</li>
     * <li>Localiza las fisuras y asigna sus longitudes si hace falta.</li>
     * <li>Resta las correcciones de retracción y tension stiffening.</li>
     * <li>Anula las compresiones si {@code suppressCompression} está activo.</li>
     * <li>Integra la deformación compensada sobre la longitud de transferencia de cada fisura.</li>
     * </ol>
     *
     * @param clean Si se reinicia el estado antes de calcular.
     * @return La lista de fisuras del perfil, con los anchos escritos.
     */
    public CrackList calculateCrackWidths(boolean clean) {
        if (clean) {
            cleanData();
        }
        if (crackList.isEmpty()) {
            findCracks();
        }
        if (!state.isAtLeast(ProfileState.LENGTHS_ASSIGNED)) {
            splitLengths();
        }
        computeWidths();
        return crackList;
    }

    // --- EDICIÓN MANUAL ---

    /**
     * Añade fisuras en las muestras más cercanas a las posiciones dadas y recalcula todo.
     */
    public CrackList addCracks(double... positions) {
        return addCracks(true, positions);
    }

    /**
     * Añade fisuras en las muestras más cercanas a las posiciones dadas
     * (a igual distancia, la muestra menor). Sus límites quedan sin asignar.
     *
     * @param recalculate Si se reasignan las longitudes y se recalculan los anchos de toda la lista.
     * @param positions   Posiciones aproximadas de las nuevas fisuras.
     * @return La lista de fisuras del perfil.
     */
    public CrackList addCracks(boolean recalculate, double... positions) {
        for (double position : positions) {
            int index = NumericArrays.findClosestIndex(x, position);
            crackList.add(Crack.builder()
                    .index(index)
                    .location(x[index])
                    .maxStrain(strain[index])
                    .build());
            log.info("Perfil '{}': fisura añadida manualmente en x={}", name, x[index]);
        }
        afterManualEdit(recalculate);
        return crackList;
    }

    /**
     * Añade copias de las fisuras dadas (p. ej. de otro perfil) y recalcula todo.
     */
    public CrackList addCracks(Crack... cracks) {
        return addCracks(true, cracks);
    }

    /**
     * Añade copias de las fisuras dadas, desplazadas a la muestra más cercana a su posición.
     * Sus límites se conservan solo si siguen rodeando la nueva posición; el ancho se descarta.
     *
     * @param recalculate Si se reasignan las longitudes y se recalculan los anchos de toda la lista.
     * @param cracks      Fisuras de referencia; no se modifican.
     * @return La lista de fisuras del perfil.
     */
    public CrackList addCracks(boolean recalculate, Crack... cracks) {
        for (Crack template : cracks) {
            if (template.getLocation() == null) {
                throw new IllegalArgumentException("La fisura a añadir debe tener posición: " + template);
            }
            Crack crack = template.copy();
            int index = NumericArrays.findClosestIndex(x, template.getLocation());
            crack.setIndex(index);
            crack.setLocation(x[index]);
            crack.setMaxStrain(strain[index]);
            crack.setWidth(null);
            if (crack.getXL() != null && !(crack.getXL() < crack.getLocation())) {
                crack.setXL(null);
            }
            if (crack.getXR() != null && !(crack.getXR() > crack.getLocation())) {
                crack.setXR(null);
            }
            crackList.add(crack);
            log.info("Perfil '{}': fisura copiada en x={}", name, x[index]);
        }
        afterManualEdit(recalculate);
        return crackList;
    }

    /**
     * Elimina las fisuras en las posiciones dadas de la lista y recalcula las restantes.
     */
    public CrackList deleteCracks(int... positions) {
        return deleteCracks(true, positions);
    }

    /**
     * Elimina las fisuras en las posiciones dadas de la lista. Las posiciones fuera de rango se ignoran.
     *
     * @param recalculate Si se reasignan las longitudes y se recalculan los anchos de las restantes.
     * @param positions   Posiciones (índices de la lista) a eliminar.
     * @return Lista con las fisuras eliminadas.
     */
    public CrackList deleteCracks(boolean recalculate, int... positions) {
        Set<Integer> toDelete = new LinkedHashSet<>();
        for (int position : positions) {
            if (position >= 0 && position < crackList.size()) {
                toDelete.add(position);
            }
        }
        CrackList deleted = new CrackList();
        for (int position : toDelete) {
            deleted.add(crackList.get(position));
        }
        List<Crack> remaining = new ArrayList<>();
        for (int i = 0; i < crackList.size(); i++) {
            if (!toDelete.contains(i)) {
                remaining.add(crackList.get(i));
            }
        }
        this.crackList = new CrackList(remaining);
        log.info("Perfil '{}': {} fisuras eliminadas, quedan {}", name, deleted.size(), crackList.size());
        afterManualEdit(recalculate);
        return deleted;
    }

    // --- ACCESO A LOS DATOS ---

    public double[] getX() {
        return x.clone();
    }

    public double[] getStrain() {
        return strain.clone();
    }

    /**
     * @return Deformación instantánea de trabajo, o {@code null} si no se proporcionó.
     */
    public double[] getStrainInst() {
        return strainInst != null ? strainInst.clone() : null;
    }

    /**
     * @return Corrección de retracción, o {@code null} si aún no se ha calculado.
     */
    public double[] getShrinkCalibrationValues() {
        return shrinkCalibrationValues != null ? shrinkCalibrationValues.clone() : null;
    }

    /**
     * @return Corrección de tension stiffening, o {@code null} si aún no se ha calculado.
     */
    public double[] getTensionStiffeningValues() {
        return tensionStiffeningValues != null ? tensionStiffeningValues.clone() : null;
    }

    /**
     * Deformación de la que se integraron los anchos en el último cálculo. Solo para inspección.
     */
    public double[] getCompensatedStrain() {
        return compensatedStrain != null ? compensatedStrain.clone() : null;
    }

    // --- PRIVADOS ---

    private void splitLengths() {
        this.crackList = lengthSplitter.run(x, strain, crackList);
        this.state = ProfileState.LENGTHS_ASSIGNED;
        log.debug("Perfil '{}': longitudes asignadas con {}", name, lengthSplitter.getName());
    }

    private void computeWidths() {
        crackList.clearAttribute(Crack.WIDTH);
        this.compensatedStrain = null;
        double[] shrink = compensateShrink();
        double[] tension = calculateTensionStiffening();
        this.state = ProfileState.COMPENSATED;

        double[] compensated = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            compensated[i] = strain[i] - shrink[i] - tension[i];
            if (suppressCompression && compensated[i] < 0.0) {
                compensated[i] = 0.0;
            }
        }
        this.compensatedStrain = compensated;

        for (Crack crack : crackList) {
            if (crack.getXL() == null || crack.getXR() == null
                    || Double.isInfinite(crack.getXL()) || Double.isInfinite(crack.getXR())) {
                log.warn("Perfil '{}': la fisura en x={} no tiene longitud de transferencia acotada, se integra hasta el extremo",
                        name, crack.getLocation());
            }
            Cropping.Segment segment = Cropping.crop(x, compensated, crack.getXL(), crack.getXR());
            crack.setWidth(integrator.integrateSegment(segment.x(), segment.y()));
        }
        this.state = ProfileState.WIDTHS_COMPUTED;
        log.info("Perfil '{}': anchos calculados para {} fisuras", name, crackList.size());
    }

    /**
     * Tras una edición manual la asignación de longitudes deja de ser válida: depende de las
     * fisuras vecinas, así que se recalcula la lista entera y nunca una fisura aislada.
     */
    private void afterManualEdit(boolean recalculate) {
        this.state = ProfileState.FOUND;
        if (recalculate) {
            splitLengths();
            computeWidths();
        }
    }

    private void requireAligned(double[] values, String componentName) {
        if (values == null || values.length != x.length) {
            throw new IllegalStateException(String.format(
                    "%s devolvió %s valores para %d muestras.",
                    componentName, values == null ? "ningún" : String.valueOf(values.length), x.length));
        }
    }
}
