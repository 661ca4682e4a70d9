package stargazer.domain.sky;

import java.time.Instant;

/**
 * Cambio de fase del cielo: a partir de {@code time} el estado pasa a ser {@code state}.
 */
public record TwilightTransition(Instant time, int state) {

    public TwilightTransition {
        if (state < TwilightPhase.MIN_CODE || state > TwilightPhase.MAX_CODE) {
            throw new IllegalArgumentException("Twilight state out of range: " + state);
        }
    }

    public static TwilightTransition from(DiscreteEvent event) {
        return new TwilightTransition(event.time(), event.state());
    }

    public TwilightPhase phase() {
        return TwilightPhase.fromCode(state);
    }
}
