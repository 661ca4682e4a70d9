package stargazer.domain.sky;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HourlySeriesTest {

    private static final Instant T0 = Instant.parse("2024-06-21T01:00:00Z");

    @Test
    @DisplayName("Mejor muestra: la de mayor altitud")
    void bestSample_shouldPickMaximumAltitude() {
        HourlySeries series = new HourlySeries(Body.MARS, List.of(
                new Sample(T0, 5.0, 90.0),
                new Sample(T0.plusSeconds(3600), 32.5, 120.0),
                new Sample(T0.plusSeconds(7200), 12.0, 150.0)));

        assertEquals(T0.plusSeconds(3600), series.bestSample().orElseThrow().time());
    }

    @Test
    @DisplayName("Empate exacto: gana la primera muestra")
    void bestSample_shouldKeepFirstOnTie() {
        HourlySeries series = new HourlySeries(Body.VENUS, List.of(
                new Sample(T0, 20.0, 90.0),
                new Sample(T0.plusSeconds(3600), 20.0, 100.0)));

        assertEquals(T0, series.bestSample().orElseThrow().time());
    }

    @Test
    @DisplayName("Un cuerpo bajo el horizonte toda la noche sigue teniendo mejor muestra (altitud negativa)")
    void bestSample_shouldWorkForNegativeAltitudes() {
        HourlySeries series = new HourlySeries(Body.MERCURY, List.of(
                new Sample(T0, -30.0, 10.0),
                new Sample(T0.plusSeconds(3600), -12.0, 20.0)));

        assertEquals(-12.0, series.bestSample().orElseThrow().altitude());
    }

    @Test
    @DisplayName("Serie vacía -> sin mejor muestra; la lista es una copia inmutable")
    void series_shouldBeImmutableCopy() {
        List<Sample> source = new ArrayList<>();
        HourlySeries series = new HourlySeries(Body.MOON, source);
        source.add(new Sample(T0, 1.0, 1.0));

        assertTrue(series.isEmpty());
        assertTrue(series.bestSample().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> series.samples().add(new Sample(T0, 0, 0)));
    }
}
