package stargazer.domain.sky;

import stargazer.domain.exception.InvalidObservationException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;

/**
 * Petición validada: observador + instante canónico (UTC, precisión de segundos).
 */
public record ObservationQuery(Observer observer, Instant instant) {

    public ObservationQuery {
        if (observer == null) {
            throw new InvalidObservationException("Observer is required");
        }
        if (instant == null) {
            throw new InvalidObservationException("Instant is required");
        }
        instant = instant.truncatedTo(ChronoUnit.SECONDS);
    }

    public static ObservationQuery of(double latitude, double longitude, Instant instant) {
        return new ObservationQuery(new Observer(latitude, longitude), instant);
    }

    /**
     * Valida los tres parámetros crudos de la petición HTTP.
     * Un instante sin zona horaria se interpreta como UTC.
     */
    public static ObservationQuery parse(String latitude, String longitude, String time) {
        double lat = parseCoordinate("lat", latitude);
        double lon = parseCoordinate("lon", longitude);
        return of(lat, lon, parseInstant(time));
    }

    static double parseCoordinate(String name, String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidObservationException("Missing required parameter: " + name);
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidObservationException("Parameter '" + name + "' is not a number: " + raw, e);
        }
    }

    static Instant parseInstant(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidObservationException("Missing required parameter: time");
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(raw.trim(), ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return zoned.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new InvalidObservationException("Parameter 'time' is not an ISO-8601 instant: " + raw, e);
        }
    }
}
