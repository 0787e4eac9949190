package crackmonitor.analysis.impl;

import crackmonitor.analysis.LengthSplitter;
import crackmonitor.config.LengthRule;
import crackmonitor.config.LengthSplitterConfig;
import crackmonitor.config.ResetScope;
import crackmonitor.domain.crack.Crack;
import crackmonitor.domain.crack.CrackList;
import crackmonitor.domain.exception.ConfigurationException;
import crackmonitor.domain.exception.PreconditionException;
import crackmonitor.utils.NumericArrays;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Asigna la longitud de transferencia combinando un conjunto ordenado de reglas.
 * <p>
 * Cada regla solo puede estrechar el intervalo {@code [x_l, x_r]}: el límite izquierdo
 * resultante es el máximo de los candidatos y el derecho, el mínimo. La única forma
 * de ensancharlo es el reinicio previo ({@link ResetScope}).
 * <ul>
 * <li><b>min:</b> corte en la muestra de mínima deformación entre dos picos vecinos.</li>
 * <li><b>middle:</b> corte en el punto medio entre dos posiciones vecinas.</li>
 * <li><b>threshold:</b> primera muestra, desde el pico hacia fuera, con deformación menor o igual al umbral.</li>
 * <li><b>length:</b> radio fijo alrededor de la fisura.</li>
 * </ul>
 */
@Slf4j
public class RuleBasedLengthSplitter implements LengthSplitter {

    private final LengthSplitterConfig config;

    public RuleBasedLengthSplitter() {
        this(LengthSplitterConfig.getDefault());
    }

    public RuleBasedLengthSplitter(LengthSplitterConfig config) {
        this.config = Objects.requireNonNull(config, "La configuración de separación no puede ser nula.");
    }

    @Override
    public String getName() {
        return "RuleBasedLengthSplitter";
    }

    @Override
    public String getDescription() {
        return "Reglas " + config.rules() + " con reinicio '" + config.reset().getScopeName() + "'";
    }

    public LengthSplitterConfig getConfig() {
        return config;
    }

    @Override
    public CrackList run(double[] x, double[] strain, CrackList crackList) {
        NumericArrays.requireSameLength(x, strain);
        crackList.sort();

        // Los límites sin asignar se abren a -inf / +inf
        for (Crack crack : crackList) {
            if (crack.getXL() == null) {
                crack.setXL(Double.NEGATIVE_INFINITY);
            }
            if (crack.getXR() == null) {
                crack.setXR(Double.POSITIVE_INFINITY);
            }
        }

        reset(crackList, config.reset());

        for (LengthRule rule : config.rules()) {
            applyRule(rule, x, strain, crackList);
            log.debug("Regla '{}' aplicada sobre {} fisuras", rule.type().getRuleName(), crackList.size());
        }
        return crackList;
    }

    private static void reset(CrackList crackList, ResetScope scope) {
        if (scope == ResetScope.NO) {
            return;
        }
        int n = crackList.size();
        for (int i = 0; i < n; i++) {
            Crack crack = crackList.get(i);
            if (i < n - 1 || scope == ResetScope.ALL) {
                crack.setXR(Double.POSITIVE_INFINITY);
            }
            if (i > 0 || scope == ResetScope.ALL) {
                crack.setXL(Double.NEGATIVE_INFINITY);
            }
        }
    }

    private void applyRule(LengthRule rule, double[] x, double[] strain, CrackList crackList) {
        switch (rule.type()) {
            case MIN:
                splitAtMinimum(x, strain, crackList);
                break;
            case MIDDLE:
                splitAtMiddle(crackList);
                break;
            case THRESHOLD:
                limitByThreshold(x, strain, crackList, rule.value());
                break;
            case LENGTH:
                limitByRadius(crackList, rule.value());
                break;
            default:
                throw new ConfigurationException("Regla de separación no soportada: " + rule.type());
        }
    }

    private static void splitAtMinimum(double[] x, double[] strain, CrackList crackList) {
        for (int i = 1; i < crackList.size(); i++) {
            Crack left = crackList.get(i - 1);
            Crack right = crackList.get(i);
            int leftPeak = resolveIndex(x, left);
            int rightPeak = resolveIndex(x, right);
            // Mínimo estrictamente entre los dos picos; si son contiguos, el propio pico izquierdo
            int minIndex = rightPeak - leftPeak > 1
                    ? NumericArrays.argMin(strain, leftPeak + 1, rightPeak)
                    : leftPeak;
            tightenRight(left, x[minIndex]);
            tightenLeft(right, x[minIndex]);
        }
    }

    private static void splitAtMiddle(CrackList crackList) {
        for (int i = 1; i < crackList.size(); i++) {
            Crack left = crackList.get(i - 1);
            Crack right = crackList.get(i);
            double middle = (requireLocation(left) + requireLocation(right)) / 2.0;
            tightenRight(left, middle);
            tightenLeft(right, middle);
        }
    }

    private static void limitByThreshold(double[] x, double[] strain, CrackList crackList, double threshold) {
        for (Crack crack : crackList) {
            int peak = resolveIndex(x, crack);
            for (int i = peak; i >= 0; i--) {
                if (strain[i] <= threshold) {
                    tightenLeft(crack, x[i]);
                    break;
                }
            }
            for (int i = peak; i < strain.length; i++) {
                if (strain[i] <= threshold) {
                    tightenRight(crack, x[i]);
                    break;
                }
            }
        }
    }

    private static void limitByRadius(CrackList crackList, double radius) {
        for (Crack crack : crackList) {
            double location = requireLocation(crack);
            tightenLeft(crack, location - radius);
            tightenRight(crack, location + radius);
        }
    }

    private static void tightenLeft(Crack crack, double candidate) {
        crack.setXL(Math.max(candidate, crack.getXL()));
    }

    private static void tightenRight(Crack crack, double candidate) {
        crack.setXR(Math.min(candidate, crack.getXR()));
    }

    private static double requireLocation(Crack crack) {
        if (crack.getLocation() == null) {
            throw new PreconditionException("Todas las fisuras deben tener posición antes de separar longitudes: " + crack);
        }
        return crack.getLocation();
    }

    /**
     * Índice del pico; si la fisura no lo tiene, la muestra más cercana a su posición.
     */
    private static int resolveIndex(double[] x, Crack crack) {
        if (crack.getIndex() != null) {
            return crack.getIndex();
        }
        return NumericArrays.findClosestIndex(x, requireLocation(crack));
    }
}
