package stargazer.astro.ephemeris;

import java.time.Instant;
import java.util.Arrays;
import java.util.function.DoubleToIntFunction;
import java.util.function.ToDoubleFunction;

/**
 * Función escalonada del tiempo (sobre el horizonte sí/no, fase del crepúsculo...) definida a
 * partir de una magnitud continua, normalmente la altitud aparente en grados.
 * <p>
 * El estado solo cambia cuando {@link #valueAt} cruza uno de los {@link #thresholds}; el buscador
 * de eventos resuelve esos cruces como raíces de {@code valueAt(t) - umbral}.
 */
public interface StateFunction {

    double valueAt(Instant instant);

    /**
     * Umbrales de cruce en orden ascendente.
     */
    double[] thresholds();

    int stateOf(double value);

    default int stateAt(Instant instant) {
        return stateOf(valueAt(instant));
    }

    static StateFunction of(ToDoubleFunction<Instant> value, double[] thresholds, DoubleToIntFunction stateOf) {
        double[] sorted = thresholds.clone();
        Arrays.sort(sorted);
        return new StateFunction() {
            @Override
            public double valueAt(Instant instant) {
                return value.applyAsDouble(instant);
            }

            @Override
            public double[] thresholds() {
                return sorted.clone();
            }

            @Override
            public int stateOf(double v) {
                return stateOf.applyAsInt(v);
            }
        };
    }
}
