package crackmonitor.analysis.impl;

import crackmonitor.analysis.CrackFinder;
import crackmonitor.config.CrackFinderConfig;
import crackmonitor.domain.crack.Crack;
import crackmonitor.domain.crack.CrackList;
import crackmonitor.signal.PeakDetectionResult;
import crackmonitor.signal.PeakDetector;
import crackmonitor.utils.NumericArrays;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Localiza fisuras como picos de la deformación.
 * <p>
 * Cada pico aceptado produce una fisura con su índice, posición y deformación máxima.
 * Los límites provisionales {@code x_l}/{@code x_r} se toman de las bases del pico.
 */
@Slf4j
public class PeakCrackFinder implements CrackFinder {

    private final CrackFinderConfig config;
    private final PeakDetector detector;

    public PeakCrackFinder() {
        this(CrackFinderConfig.getDefault());
    }

    public PeakCrackFinder(CrackFinderConfig config) {
        this.config = Objects.requireNonNull(config, "La configuración del buscador no puede ser nula.");
        this.detector = PeakDetector.builder()
                .height(config.height())
                .prominence(config.prominence())
                .distance(config.distance())
                .build();
    }

    @Override
    public String getName() {
        return "PeakCrackFinder";
    }

    @Override
    public String getDescription() {
        return String.format("Picos con altura >= %s y prominencia >= %s", config.height(), config.prominence());
    }

    @Override
    public CrackList run(double[] x, double[] strain) {
        NumericArrays.requireSameLength(x, strain);
        PeakDetectionResult peaks = detector.detect(strain);

        CrackList crackList = new CrackList();
        for (int k = 0; k < peaks.size(); k++) {
            int peak = peaks.peaks()[k];
            crackList.add(Crack.builder()
                    .index(peak)
                    .location(x[peak])
                    .xL(x[peaks.leftBases()[k]])
                    .xR(x[peaks.rightBases()[k]])
                    .maxStrain(strain[peak])
                    .build());
        }

        if (crackList.isEmpty()) {
            log.warn("No se ha encontrado ninguna fisura con la configuración {}", config);
        } else {
            log.debug("{} fisuras detectadas en {} muestras", crackList.size(), x.length);
        }
        return crackList;
    }
}
