package crackmonitor.config;

import crackmonitor.domain.sensor.SensorType;
import lombok.Builder;
import lombok.With;

/**
 * Contenedor principal de la configuración de un perfil de deformación.
 * <p>
 * Agrupa las configuraciones de cada etapa del cálculo. Las secciones ausentes
 * ({@code null}) se sustituyen por sus valores por defecto, salvo
 * {@code shrinkCompensation}: si falta, no se compensa la retracción.
 *
 * @param name                Nombre descriptivo del perfil.
 * @param sensorType          Instalación del sensor; fija el tension stiffening por defecto.
 * @param suppressCompression Si se anulan las deformaciones negativas tras compensar (por defecto sí).
 * @param crop                Recorte del área de medida.
 * @param crackFinder         Detección de fisuras.
 * @param lengthSplitter      Asignación de longitudes de transferencia.
 * @param shrinkCompensation  Compensación de retracción y fluencia.
 * @param tensionStiffening   Rigidización a tracción; tiene prioridad sobre el valor implícito de {@code sensorType}.
 */
@Builder
@With
public record StrainProfileConfig(
        String name,
        SensorType sensorType,
        Boolean suppressCompression,
        CropConfig crop,
        CrackFinderConfig crackFinder,
        LengthSplitterConfig lengthSplitter,
        ShrinkCompensationConfig shrinkCompensation,
        TensionStiffeningConfig tensionStiffening
) {
    public StrainProfileConfig {
        name = name == null ? "" : name;
        sensorType = sensorType == null ? SensorType.GENERIC : sensorType;
        suppressCompression = suppressCompression == null ? Boolean.TRUE : suppressCompression;
        crop = crop == null ? CropConfig.getDefault() : crop;
        crackFinder = crackFinder == null ? CrackFinderConfig.getDefault() : crackFinder;
        lengthSplitter = lengthSplitter == null ? LengthSplitterConfig.getDefault() : lengthSplitter;
    }

    public static StrainProfileConfig getDefault() {
        return StrainProfileConfig.builder().build();
    }
}
