package crackmonitor.analysis.impl;

import crackmonitor.analysis.TensionStiffeningCompensator;
import crackmonitor.domain.crack.Crack;
import crackmonitor.domain.crack.CrackList;
import crackmonitor.domain.exception.PreconditionException;
import crackmonitor.utils.NumericArrays;
import lombok.Getter;

/**
 * Tension stiffening según Berrocal et al. (2021), para sensores adheridos a la armadura.
 * <p>
 * La deformación del hormigón es la diferencia entre la interpolación lineal de los picos
 * {@code ê(x)} y la deformación medida, reducida por la cuantía y la relación de módulos:
 * {@code e_ts(x) = rho * alpha * (ê(x) - e(x))}, acotada inferiormente a 0.
 * Fuera de las fisuras extremas, {@code ê(x)} se mantiene constante en el pico extremo.
 */
@Getter
public class BerrocalTensionStiffening implements TensionStiffeningCompensator {

    /**
     * Relación de módulos de Young acero/hormigón {@code alpha = Es / Ec}.
     */
    private final double alpha;
    /**
     * Cuantía de armadura {@code rho = As / Ac,ef}.
     */
    private final double rho;

    public BerrocalTensionStiffening(double alpha, double rho) {
        this.alpha = alpha;
        this.rho = rho;
    }

    @Override
    public String getName() {
        return "Berrocal";
    }

    @Override
    public String getDescription() {
        return String.format("rho * alpha * (interpolación de picos - medida), alpha=%s, rho=%s", alpha, rho);
    }

    @Override
    public double[] run(double[] x, double[] strain, CrackList crackList) {
        NumericArrays.requireSameLength(x, strain);
        if (crackList.size() < 2) {
            throw new PreconditionException(String.format(
                    "Berrocal necesita al menos dos fisuras para interpolar, hay %d.", crackList.size()));
        }

        CrackList sorted = crackList.copy();
        sorted.sort();
        double[] locations = new double[sorted.size()];
        double[] peakStrains = new double[sorted.size()];
        for (int i = 0; i < sorted.size(); i++) {
            Crack crack = sorted.get(i);
            if (crack.getLocation() == null || crack.getMaxStrain() == null) {
                throw new PreconditionException("Todas las fisuras necesitan posición y deformación máxima: " + crack);
            }
            locations[i] = crack.getLocation();
            peakStrains[i] = crack.getMaxStrain();
        }

        double[] interpolated = NumericArrays.interpolate(x, locations, peakStrains);
        double[] compensation = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            compensation[i] = Math.max(0.0, rho * alpha * (interpolated[i] - strain[i]));
        }
        return compensation;
    }
}
