package stargazer.domain.sky;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Formato único de instantes hacia fuera: ISO-8601 UTC con precisión de segundos.
 */
public final class SkyTimes {

    private SkyTimes() {}

    public static String iso(Instant instant) {
        if (instant == null) return null;
        return DateTimeFormatter.ISO_INSTANT.format(instant.truncatedTo(ChronoUnit.SECONDS));
    }
}
