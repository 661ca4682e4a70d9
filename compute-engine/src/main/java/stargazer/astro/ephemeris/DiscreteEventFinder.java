package stargazer.astro.ephemeris;

import lombok.Getter;
import org.hipparchus.analysis.UnivariateFunction;
import org.hipparchus.analysis.solvers.AllowedSolution;
import org.hipparchus.analysis.solvers.BracketingNthOrderBrentSolver;
import org.hipparchus.optim.MaxEval;
import org.hipparchus.optim.nonlinear.scalar.GoalType;
import org.hipparchus.optim.univariate.BrentOptimizer;
import org.hipparchus.optim.univariate.SearchInterval;
import org.hipparchus.optim.univariate.UnivariateObjectiveFunction;
import stargazer.domain.sky.DiscreteEvent;
import stargazer.domain.sky.TimeWindow;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Localiza los cambios de estado de una {@link StateFunction} dentro de una ventana.
 * <p>
 * La ventana se recorre con un paso fijo evaluando la magnitud continua y su pendiente. Cada
 * tramo con un cambio de signo de {@code valor - umbral} se resuelve con el
 * {@link BracketingNthOrderBrentSolver} de Hipparchus. Si la pendiente cambia de signo dentro del
 * tramo, el extremo se localiza con un {@link BrentOptimizer} y el tramo se parte en dos: así un
 * paso rasante (el cuerpo sube y baja entre dos puntos de la rejilla) no se pierde.
 * <p>
 * Se asume como mucho un extremo por paso. El instante reportado es el primero, a la tolerancia,
 * en el que la función ya vale el nuevo estado.
 */
@Getter
public class DiscreteEventFinder {

    private static final int MAX_EVALUATIONS = 100;
    private static final int SOLVER_ORDER = 5;
    private static final double RELATIVE_ACCURACY = 1.0e-12;

    private final Duration step;
    private final Duration tolerance;

    public DiscreteEventFinder() {
        this(Duration.ofMinutes(5), Duration.ofSeconds(1));
    }

    public DiscreteEventFinder(Duration step, Duration tolerance) {
        if (step == null || step.isZero() || step.isNegative()) {
            throw new IllegalArgumentException("Search step must be positive: " + step);
        }
        if (tolerance == null || tolerance.isZero() || tolerance.isNegative()) {
            throw new IllegalArgumentException("Tolerance must be positive: " + tolerance);
        }
        this.step = step;
        this.tolerance = tolerance;
    }

    public List<DiscreteEvent> find(TimeWindow window, StateFunction function) {
        Instant origin = window.start();
        double span = seconds(window.duration());
        double stepSeconds = seconds(step);
        double toleranceSeconds = seconds(tolerance);
        double[] thresholds = function.thresholds();

        // Tiempo en segundos desde el inicio de la ventana
        UnivariateFunction value = t -> function.valueAt(at(origin, t));
        BracketingNthOrderBrentSolver solver =
                new BracketingNthOrderBrentSolver(RELATIVE_ACCURACY, toleranceSeconds, SOLVER_ORDER);
        BrentOptimizer optimizer = new BrentOptimizer(RELATIVE_ACCURACY, toleranceSeconds);

        List<DiscreteEvent> events = new ArrayList<>();
        double a = 0.0;
        double va = value.value(a);
        double slopeA = value.value(a + toleranceSeconds) - va;
        int state = function.stateOf(va);

        while (a < span) {
            double b = Math.min(a + stepSeconds, span);
            double vb = value.value(b);
            double slopeB = value.value(b + toleranceSeconds) - vb;

            List<Crossing> crossings = new ArrayList<>();
            boolean peak = slopeA > 0 && slopeB < 0;
            boolean trough = slopeA < 0 && slopeB > 0;
            if (peak || trough) {
                double m = optimizer.optimize(
                        new MaxEval(MAX_EVALUATIONS),
                        new UnivariateObjectiveFunction(value),
                        peak ? GoalType.MAXIMIZE : GoalType.MINIMIZE,
                        new SearchInterval(a, b)).getPoint();
                double vm = value.value(m);
                collectCrossings(solver, value, thresholds, a, va, m, vm, crossings);
                collectCrossings(solver, value, thresholds, m, vm, b, vb, crossings);
            } else {
                collectCrossings(solver, value, thresholds, a, va, b, vb, crossings);
            }
            crossings.sort(Comparator.comparingDouble(Crossing::time));

            for (Crossing crossing : crossings) {
                // Estado justo al otro lado del umbral; no depende de que el solver caiga exactamente en la raíz
                double beyond = crossing.rising() ? Math.nextUp(crossing.threshold()) : Math.nextDown(crossing.threshold());
                state = emit(events, at(origin, crossing.time()), function.stateOf(beyond), state);
            }
            // Cruces que el solver deja exactamente sobre la frontera del tramo
            state = emit(events, at(origin, b), function.stateOf(vb), state);

            a = b;
            va = vb;
            slopeA = slopeB;
        }
        return events;
    }

    private static void collectCrossings(BracketingNthOrderBrentSolver solver, UnivariateFunction value,
                                         double[] thresholds, double lo, double vLo, double hi, double vHi,
                                         List<Crossing> sink) {
        if (hi <= lo) {
            return;
        }
        for (double threshold : thresholds) {
            if ((vLo >= threshold) != (vHi >= threshold)) {
                UnivariateFunction crossing = t -> value.value(t) - threshold;
                // RIGHT_SIDE: la solución queda después de la raíz, ya en el nuevo estado
                double root = solver.solve(MAX_EVALUATIONS, crossing, lo, hi, AllowedSolution.RIGHT_SIDE);
                sink.add(new Crossing(root, threshold, vHi >= threshold));
            }
        }
    }

    private static int emit(List<DiscreteEvent> events, Instant time, int newState, int currentState) {
        if (newState == currentState) {
            return currentState;
        }
        if (!events.isEmpty() && !time.isAfter(events.get(events.size() - 1).time())) {
            events.set(events.size() - 1, new DiscreteEvent(events.get(events.size() - 1).time(), newState));
        } else {
            events.add(new DiscreteEvent(time, newState));
        }
        return newState;
    }

    private record Crossing(double time, double threshold, boolean rising) {}

    private static double seconds(Duration duration) {
        return duration.getSeconds() + duration.getNano() / 1.0e9;
    }

    private static Instant at(Instant origin, double seconds) {
        return origin.plusNanos(Math.round(seconds * 1.0e9));
    }
}
