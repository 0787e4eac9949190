package crackmonitor.analysis.impl;

import crackmonitor.analysis.ShrinkCompensator;
import crackmonitor.config.ShrinkCompensationConfig;
import crackmonitor.domain.exception.PreconditionException;
import crackmonitor.signal.PeakDetectionResult;
import crackmonitor.signal.PeakDetector;
import crackmonitor.utils.NumericArrays;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.Objects;

/**
 * Compensación de retracción y fluencia como un desplazamiento aditivo global.
 * <p>
 * En cada mínimo local de la deformación instantánea se mide la diferencia con la
 * deformación diferida en la misma muestra; la media de esas diferencias se aplica
 * de forma uniforme a todo el perfil.
 */
@Slf4j
public class MeanMinimumShrinkCompensator implements ShrinkCompensator {

    private final ShrinkCompensationConfig config;
    private final PeakDetector minimumDetector;

    public MeanMinimumShrinkCompensator() {
        this(ShrinkCompensationConfig.getDefault());
    }

    public MeanMinimumShrinkCompensator(ShrinkCompensationConfig config) {
        this.config = Objects.requireNonNull(config, "La configuración de retracción no puede ser nula.");
        this.minimumDetector = PeakDetector.builder()
                .height(config.height())
                .prominence(config.prominence())
                .build();
    }

    @Override
    public String getName() {
        return "MeanMinimumShrink";
    }

    @Override
    public String getDescription() {
        return "Media de (strain - strain_inst) en los mínimos locales de strain_inst";
    }

    @Override
    public double[] run(double[] x, double[] strain, double[] strainInst) {
        if (x == null || strain == null || strainInst == null) {
            throw new PreconditionException(
                    "No se puede compensar la retracción: x, strain y strain_inst son obligatorios.");
        }
        NumericArrays.requireSameLength(x, strain);
        NumericArrays.requireSameLength(x, strainInst);

        // Los mínimos de strain_inst son los picos de la señal negada
        PeakDetectionResult minima = minimumDetector.detect(NumericArrays.negate(strainInst));
        if (minima.isEmpty()) {
            throw new PreconditionException("La deformación instantánea no tiene ningún mínimo local.");
        }

        double sum = 0.0;
        for (int index : minima.peaks()) {
            sum += strain[index] - strainInst[index];
        }
        double meanDifference = sum / minima.size();
        log.debug("Retracción: {} mínimos, desplazamiento medio {}", minima.size(), meanDifference);

        double[] calibration = new double[x.length];
        Arrays.fill(calibration, meanDifference);
        return calibration;
    }
}
