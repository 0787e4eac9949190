package crackmonitor.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.With;

/**
 * Recorte del área de medida. Todos los parámetros son opcionales.
 *
 * @param startPos Posición inicial {@code s}; por defecto el primer valor de x.
 * @param endPos   Posición final {@code e}; tiene prioridad sobre {@code length}.
 * @param length   Longitud del tramo a partir de {@code startPos}.
 * @param offset   Desplazamiento aplicado a x antes de recortar ({@code x <- x + offset}).
 */
@Builder
@With
public record CropConfig(
        Double startPos,
        Double endPos,
        Double length,
        Double offset
) {
    public static CropConfig getDefault() {
        return CropConfig.builder().build();
    }

    @JsonIgnore
    public boolean isNoOp() {
        return startPos == null && endPos == null && length == null && (offset == null || offset == 0.0);
    }
}
