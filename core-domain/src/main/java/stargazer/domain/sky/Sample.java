package stargazer.domain.sky;

import java.time.Instant;

/**
 * Una observación de un cuerpo en un instante.
 */
public record Sample(Instant time, double altitude, double azimuth) {

    public static Sample of(Instant time, HorizontalPosition position) {
        return new Sample(time, position.altitude(), position.azimuth());
    }
}
