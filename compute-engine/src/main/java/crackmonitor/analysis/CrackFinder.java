package crackmonitor.analysis;

import crackmonitor.domain.crack.CrackList;

/**
 * Identifica posiciones potenciales de fisura en una señal de deformación.
 */
public interface CrackFinder extends AnalysisComponent {
    /**
     * Devuelve una fisura por cada pico aceptado. Las fisuras quedan incompletas:
     * sus límites son provisionales y aún no tienen ancho.
     *
     * @param x      Posiciones, en orden ascendente.
     * @param strain Deformación alineada con {@code x}.
     * @return Lista de fisuras; vacía si no hay picos.
     */
    CrackList run(double[] x, double[] strain);
}
