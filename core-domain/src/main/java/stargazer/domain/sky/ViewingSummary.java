package stargazer.domain.sky;

import java.time.Instant;

/**
 * Hechos derivados por cuerpo. {@code riseTime} y {@code setTime} pueden ser null.
 */
public record ViewingSummary(Instant bestViewingTime, Instant riseTime, Instant setTime) {
}
