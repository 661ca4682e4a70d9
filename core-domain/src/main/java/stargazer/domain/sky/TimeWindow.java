package stargazer.domain.sky;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Intervalo temporal [start, end] en UTC.
 * Representa un día natural [00:00, 00:00 del día siguiente) o una noche ya resuelta.
 */
public record TimeWindow(Instant start, Instant end) {

    public TimeWindow {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Window bounds are required");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Window start " + start + " is after end " + end);
        }
    }

    /**
     * Día natural UTC que contiene la fecha dada.
     */
    public static TimeWindow calendarDay(LocalDate date) {
        Instant start = date.atStartOfDay(ZoneOffset.UTC).toInstant();
        return new TimeWindow(start, start.plus(Duration.ofDays(1)));
    }

    public static TimeWindow calendarDayOf(Instant instant) {
        return calendarDay(instant.atOffset(ZoneOffset.UTC).toLocalDate());
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && !instant.isAfter(end);
    }
}
