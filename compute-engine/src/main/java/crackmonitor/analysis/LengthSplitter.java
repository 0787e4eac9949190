package crackmonitor.analysis;

import crackmonitor.domain.crack.CrackList;

/**
 * Asigna la longitud de transferencia {@code [x_l, x_r]} de cada fisura.
 */
public interface LengthSplitter extends AnalysisComponent {
    /**
     * Modifica los límites de las fisuras en el sitio.
     *
     * @param x         Posiciones.
     * @param strain    Deformación alineada con {@code x}.
     * @param crackList Fisuras con posición ya asignada.
     * @return La misma lista recibida, ordenada por posición.
     */
    CrackList run(double[] x, double[] strain, CrackList crackList);
}
