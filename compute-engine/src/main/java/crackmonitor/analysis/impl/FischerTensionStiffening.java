package crackmonitor.analysis.impl;

import crackmonitor.analysis.TensionStiffeningCompensator;
import crackmonitor.config.TensionStiffeningConfig;
import crackmonitor.domain.crack.Crack;
import crackmonitor.domain.crack.CrackList;
import crackmonitor.domain.exception.PreconditionException;
import crackmonitor.utils.NumericArrays;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Tension stiffening según Fischer et al. (2019), para sensores embebidos en el hormigón.
 * <p>
 * Dentro de la longitud de transferencia de cada fisura la compensación crece linealmente
 * desde 0 en la fisura hasta la deformación límite en cada extremo:
 * {@code e_lim = min(e(extremo), e_ctu)}. El resultado nunca supera la deformación medida
 * y nunca es negativo. Fuera de cualquier longitud de transferencia vale 0.
 */
@Slf4j
@Getter
public class FischerTensionStiffening implements TensionStiffeningCompensator {

    /**
     * Deformación máxima que soporta el hormigón antes de fisurar (µm/m).
     */
    private final double maxConcreteStrain;

    public FischerTensionStiffening() {
        this(TensionStiffeningConfig.DEFAULT_MAX_CONCRETE_STRAIN);
    }

    public FischerTensionStiffening(double maxConcreteStrain) {
        this.maxConcreteStrain = maxConcreteStrain;
    }

    @Override
    public String getName() {
        return "Fischer";
    }

    @Override
    public String getDescription() {
        return "Rampa lineal desde la fisura hasta min(e(extremo), " + maxConcreteStrain + ")";
    }

    @Override
    public double[] run(double[] x, double[] strain, CrackList crackList) {
        NumericArrays.requireSameLength(x, strain);
        double[] compensation = new double[x.length];
        if (x.length == 0) {
            return compensation;
        }

        for (Crack crack : crackList) {
            if (crack.getLocation() == null || crack.getXL() == null || crack.getXR() == null) {
                throw new PreconditionException("Fischer necesita posición y longitud de transferencia asignadas: " + crack);
            }
            int leftIndex = NumericArrays.findClosestIndex(x, crack.getXL());
            int rightIndex = NumericArrays.findClosestIndex(x, crack.getXR());

            double[] xp = {x[leftIndex], crack.getLocation(), x[rightIndex]};
            double[] fp = {
                    Math.min(strain[leftIndex], maxConcreteStrain),
                    0.0,
                    Math.min(strain[rightIndex], maxConcreteStrain)
            };
            // Las fisuras posteriores sobrescriben las muestras compartidas
            for (int i = leftIndex; i <= rightIndex; i++) {
                compensation[i] = NumericArrays.interpolate(x[i], xp, fp);
            }
        }

        for (int i = 0; i < compensation.length; i++) {
            compensation[i] = Math.max(0.0, Math.min(compensation[i], strain[i]));
        }
        log.debug("Fischer aplicado sobre {} fisuras", crackList.size());
        return compensation;
    }
}
