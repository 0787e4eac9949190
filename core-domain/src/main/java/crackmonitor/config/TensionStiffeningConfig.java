package crackmonitor.config;

import lombok.Builder;
import lombok.With;

/**
 * Parámetros del modelo de rigidización a tracción.
 *
 * @param method            Modelo a aplicar.
 * @param alpha             Relación de módulos de Young acero/hormigón {@code Es/Ec} (Berrocal).
 * @param rho               Cuantía de armadura {@code As/Ac,ef} (Berrocal).
 * @param maxConcreteStrain Deformación máxima que soporta el hormigón antes de fisurar, en µm/m (Fischer).
 */
@Builder
@With
public record TensionStiffeningConfig(
        TensionStiffeningMethod method,
        double alpha,
        double rho,
        double maxConcreteStrain
) {
    public static final double DEFAULT_MAX_CONCRETE_STRAIN = 100.0;

    public TensionStiffeningConfig {
        method = method == null ? TensionStiffeningMethod.NONE : method;
    }

    public static TensionStiffeningConfig getDefault() {
        return TensionStiffeningConfig.builder()
                .method(TensionStiffeningMethod.NONE)
                .maxConcreteStrain(DEFAULT_MAX_CONCRETE_STRAIN)
                .build();
    }

    public static TensionStiffeningConfig fischer(double maxConcreteStrain) {
        return getDefault().withMethod(TensionStiffeningMethod.FISCHER).withMaxConcreteStrain(maxConcreteStrain);
    }

    public static TensionStiffeningConfig berrocal(double alpha, double rho) {
        return getDefault().withMethod(TensionStiffeningMethod.BERROCAL).withAlpha(alpha).withRho(rho);
    }
}
