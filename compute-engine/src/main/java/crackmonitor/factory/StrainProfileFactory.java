package crackmonitor.factory;

import crackmonitor.analysis.ShrinkCompensator;
import crackmonitor.analysis.TensionStiffeningCompensator;
import crackmonitor.analysis.impl.BerrocalTensionStiffening;
import crackmonitor.analysis.impl.FischerTensionStiffening;
import crackmonitor.analysis.impl.MeanMinimumShrinkCompensator;
import crackmonitor.analysis.impl.PeakCrackFinder;
import crackmonitor.analysis.impl.RuleBasedLengthSplitter;
import crackmonitor.analysis.impl.TrapezoidalIntegrator;
import crackmonitor.config.StrainProfileConfig;
import crackmonitor.config.TensionStiffeningConfig;
import crackmonitor.domain.exception.ConfigurationException;
import crackmonitor.domain.sensor.SensorType;
import crackmonitor.profile.StrainProfile;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Fábrica de {@link StrainProfile} a partir de un {@link StrainProfileConfig}.
 * <p>
 * Traduce cada sección de la configuración a su estrategia concreta:
 * <ol>
 * <li>Detección de picos ({@link PeakCrackFinder}).</li>
 * <li>Separación de longitudes por reglas ({@link RuleBasedLengthSplitter}).</li>
 * <li>Retracción, solo si la configuración la incluye ({@link MeanMinimumShrinkCompensator}).</li>
 * <li>Tension stiffening: explícito o implícito según el tipo de sensor.</li>
 * </ol>
 */
@Slf4j
public final class StrainProfileFactory {

    private StrainProfileFactory() {
    }

    /**
     * Crea un perfil con las estrategias descritas en la configuración.
     *
     * @param config     Configuración del perfil.
     * @param x          Posiciones, estrictamente crecientes.
     * @param strain     Deformación medida.
     * @param strainInst Deformación instantánea (opcional).
     * @return Un perfil limpio, sin fisuras todavía.
     * @throws ConfigurationException si la combinación de sensor y tension stiffening no es válida.
     */
    public static StrainProfile create(StrainProfileConfig config, double[] x, double[] strain, double[] strainInst) {
        Objects.requireNonNull(config, "La configuración del perfil no puede ser nula.");

        ShrinkCompensator shrinkCompensator = config.shrinkCompensation() != null
                ? new MeanMinimumShrinkCompensator(config.shrinkCompensation())
                : null;
        TensionStiffeningCompensator tsCompensator =
                createTensionStiffeningCompensator(config.sensorType(), config.tensionStiffening());

        log.info("Creando perfil '{}' (sensor: {}, tension stiffening: {})", config.name(),
                config.sensorType().getTypeName(), tsCompensator != null ? tsCompensator.getName() : "ninguno");

        return StrainProfile.builder()
                .x(x)
                .strain(strain)
                .strainInst(strainInst)
                .name(config.name())
                .suppressCompression(config.suppressCompression())
                .crop(config.crop())
                .crackFinder(new PeakCrackFinder(config.crackFinder()))
                .lengthSplitter(new RuleBasedLengthSplitter(config.lengthSplitter()))
                .integrator(new TrapezoidalIntegrator())
                .shrinkCompensator(shrinkCompensator)
                .tensionStiffeningCompensator(tsCompensator)
                .build();
    }

    public static StrainProfile create(StrainProfileConfig config, double[] x, double[] strain) {
        return create(config, x, strain, null);
    }

    /**
     * Perfil de un sensor embebido en el hormigón: tension stiffening de Fischer con los valores por defecto.
     */
    public static StrainProfile concrete(double[] x, double[] strain) {
        return create(StrainProfileConfig.builder()
                .name("concrete")
                .sensorType(SensorType.CONCRETE)
                .build(), x, strain, null);
    }

    /**
     * Perfil de un sensor adherido a la armadura: tension stiffening de Berrocal.
     *
     * @param alpha Relación de módulos de Young acero/hormigón.
     * @param rho   Cuantía de armadura.
     */
    public static StrainProfile rebar(double[] x, double[] strain, double alpha, double rho) {
        return create(StrainProfileConfig.builder()
                .name("rebar")
                .sensorType(SensorType.REBAR)
                .tensionStiffening(TensionStiffeningConfig.berrocal(alpha, rho))
                .build(), x, strain, null);
    }

    /**
     * Resuelve el compensador de tension stiffening. Una configuración explícita tiene prioridad;
     * si falta, el tipo de sensor decide: hormigón usa Fischer, armadura exige parámetros
     * explícitos y un sensor genérico no compensa.
     *
     * @return El compensador, o {@code null} si no se debe compensar.
     * @throws ConfigurationException si un sensor de armadura no trae parámetros de Berrocal.
     */
    public static TensionStiffeningCompensator createTensionStiffeningCompensator(SensorType sensorType,
                                                                                  TensionStiffeningConfig config) {
        if (config != null) {
            return switch (config.method()) {
                case BERROCAL -> new BerrocalTensionStiffening(config.alpha(), config.rho());
                case FISCHER -> new FischerTensionStiffening(config.maxConcreteStrain() > 0.0
                        ? config.maxConcreteStrain()
                        : TensionStiffeningConfig.DEFAULT_MAX_CONCRETE_STRAIN);
                case NONE -> null;
            };
        }
        SensorType type = sensorType != null ? sensorType : SensorType.GENERIC;
        return switch (type) {
            case CONCRETE -> new FischerTensionStiffening();
            case REBAR -> throw new ConfigurationException(
                    "Un sensor de armadura necesita los parámetros alpha y rho del modelo de Berrocal.");
            case GENERIC -> null;
        };
    }
}
