package crackmonitor.config;

import lombok.Builder;
import lombok.With;

/**
 * Parámetros de la detección de picos usada para localizar fisuras.
 * <p>
 * Un parámetro {@code null} significa "sin restricción".
 *
 * @param height     Altura absoluta mínima del pico (µm/m).
 * @param prominence Prominencia topográfica mínima del pico. Es el parámetro principal:
 *                   si aparecen demasiadas fisuras, se sube; si faltan fisuras evidentes, se baja.
 * @param distance   Separación horizontal mínima entre picos, en muestras (>= 1).
 */
@Builder
@With
public record CrackFinderConfig(
        Double height,
        Double prominence,
        Integer distance
) {
    public CrackFinderConfig {
        if (distance != null && distance < 1) {
            throw new IllegalArgumentException("La distancia mínima entre picos debe ser >= 1 muestra.");
        }
    }

    public static CrackFinderConfig getDefault() {
        return CrackFinderConfig.builder()
                .height(100.0)
                .prominence(100.0)
                .build();
    }
}
