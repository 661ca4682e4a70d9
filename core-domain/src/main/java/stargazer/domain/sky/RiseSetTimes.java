package stargazer.domain.sky;

import java.time.Instant;

/**
 * Par orto/ocaso. Cualquiera de los dos puede ser null.
 */
public record RiseSetTimes(Instant rise, Instant set) {

    public static final RiseSetTimes NONE = new RiseSetTimes(null, null);
}
