package crackmonitor.analysis;

import crackmonitor.domain.crack.CrackList;

/**
 * Compensación de la deformación que no contribuye a ninguna fisura porque la
 * soporta el hormigón no fisurado entre ellas (tension stiffening).
 */
public interface TensionStiffeningCompensator extends Compensator {
    /**
     * @param x         Posiciones.
     * @param strain    Deformación alineada con {@code x}.
     * @param crackList Fisuras con posición (y, según el modelo, longitud de transferencia) asignada.
     * @return Corrección por muestra, de la misma longitud que {@code x}.
     */
    double[] run(double[] x, double[] strain, CrackList crackList);
}
