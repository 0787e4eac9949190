package crackmonitor.config;

import lombok.Builder;
import lombok.With;

/**
 * Parámetros de la búsqueda de mínimos locales en la deformación instantánea.
 * Por defecto no hay restricciones: cuenta cualquier mínimo local.
 *
 * @param height     Altura mínima del pico de la señal negada.
 * @param prominence Prominencia mínima del mínimo local.
 */
@Builder
@With
public record ShrinkCompensationConfig(
        Double height,
        Double prominence
) {
    public static ShrinkCompensationConfig getDefault() {
        return ShrinkCompensationConfig.builder().build();
    }
}
