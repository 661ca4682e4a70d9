package stargazer.domain.sky;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class TimeWindowTest {

    @Test
    @DisplayName("Día natural: [00:00Z, 00:00Z del día siguiente]")
    void calendarDay_shouldSpanOneUtcDay() {
        TimeWindow day = TimeWindow.calendarDay(LocalDate.of(2024, 6, 21));

        assertEquals(Instant.parse("2024-06-21T00:00:00Z"), day.start());
        assertEquals(Instant.parse("2024-06-22T00:00:00Z"), day.end());
        assertEquals(Duration.ofDays(1), day.duration());
    }

    @Test
    @DisplayName("El día se toma en UTC aunque el instante esté cerca de medianoche")
    void calendarDayOf_shouldUseUtcDate() {
        TimeWindow day = TimeWindow.calendarDayOf(Instant.parse("2024-06-21T23:59:59Z"));

        assertEquals(Instant.parse("2024-06-21T00:00:00Z"), day.start());
    }

    @Test
    @DisplayName("Inicio posterior al fin -> IllegalArgumentException")
    void constructor_shouldRejectInvertedBounds() {
        Instant t = Instant.parse("2024-06-21T00:00:00Z");

        assertThrows(IllegalArgumentException.class, () -> new TimeWindow(t.plusSeconds(1), t));
        assertDoesNotThrow(() -> new TimeWindow(t, t));
    }

    @Test
    @DisplayName("contains: ambos extremos incluidos")
    void contains_shouldIncludeBothEnds() {
        TimeWindow day = TimeWindow.calendarDay(LocalDate.of(2024, 1, 1));

        assertTrue(day.contains(day.start()));
        assertTrue(day.contains(day.end()));
        assertFalse(day.contains(day.end().plusSeconds(1)));
    }
}
