package stargazer.domain.sky;

import java.util.List;
import java.util.Optional;

/**
 * Serie de muestras de un cuerpo a lo largo de una ventana, en orden temporal ascendente.
 */
public record HourlySeries(Body body, List<Sample> samples) {

    public HourlySeries {
        samples = List.copyOf(samples);
    }

    /**
     * Muestra de máxima altitud. En caso de empate exacto gana la primera (índice más bajo).
     */
    public Optional<Sample> bestSample() {
        Sample best = null;
        for (Sample sample : samples) {
            if (best == null || sample.altitude() > best.altitude()) {
                best = sample;
            }
        }
        return Optional.ofNullable(best);
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }
}
