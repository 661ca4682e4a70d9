package stargazer.astro.sampling;

import lombok.RequiredArgsConstructor;
import stargazer.astro.ephemeris.EphemerisEngine;
import stargazer.domain.sky.Body;
import stargazer.domain.sky.HourlySeries;
import stargazer.domain.sky.Observer;
import stargazer.domain.sky.Sample;
import stargazer.domain.sky.TimeWindow;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Muestreo horario de un cuerpo a lo largo de una ventana.
 * <p>
 * Número de muestras = floor(duración en segundos / 3600) + 1, empezando en el inicio de la
 * ventana. Cada muestra es una evaluación exacta e independiente del motor (sin interpolar).
 */
@RequiredArgsConstructor
public class SamplingEngine {

    private static final long SECONDS_PER_SAMPLE = Duration.ofHours(1).getSeconds();

    private final EphemerisEngine engine;

    public HourlySeries sample(Body body, Observer observer, TimeWindow window) {
        List<Sample> samples = new ArrayList<>();
        for (Instant time : sampleTimes(window)) {
            samples.add(Sample.of(time, engine.observe(body, observer, time)));
        }
        return new HourlySeries(body, samples);
    }

    public static List<Instant> sampleTimes(TimeWindow window) {
        long count = window.duration().getSeconds() / SECONDS_PER_SAMPLE + 1;
        List<Instant> times = new ArrayList<>((int) count);
        for (long i = 0; i < count; i++) {
            times.add(window.start().plusSeconds(i * SECONDS_PER_SAMPLE));
        }
        return times;
    }
}
