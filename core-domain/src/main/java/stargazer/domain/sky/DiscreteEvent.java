package stargazer.domain.sky;

import java.time.Instant;

/**
 * Instante en el que una función escalonada del tiempo pasa a valer {@code state}.
 */
public record DiscreteEvent(Instant time, int state) {
}
