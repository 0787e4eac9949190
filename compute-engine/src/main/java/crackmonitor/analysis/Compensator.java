package crackmonitor.analysis;

/**
 * Base de las compensaciones de influencias físicas sobre la deformación medida.
 * <p>
 * Toda compensación devuelve un array alineado con {@code x} que se resta de la
 * deformación antes de integrar los anchos: los valores positivos reducen el ancho estimado.
 */
public interface Compensator extends AnalysisComponent {
}
