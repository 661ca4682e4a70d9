package stargazer.astro.event;

import stargazer.astro.ephemeris.EphemerisEngine;
import stargazer.astro.ephemeris.StateFunction;
import stargazer.config.SkyConventions;
import stargazer.domain.sky.Body;
import stargazer.domain.sky.Observer;
import stargazer.domain.sky.TwilightPhase;

/**
 * Funciones escalonadas sobre las que trabaja el buscador de eventos discretos.
 */
public final class SkyStateFunctions {

    private static final int BELOW_HORIZON = 0;

    private SkyStateFunctions() {}

    /**
     * {@code risingState} mientras el cuerpo está por encima de su horizonte aparente, 0 si no.
     * Vale también para el Sol (orto/ocaso). La magnitud continua es la altitud aparente.
     */
    public static StateFunction aboveHorizon(EphemerisEngine engine, Body body, Observer observer,
                                             SkyConventions conventions) {
        double horizon = conventions.horizonDegreesFor(body.getCategory());
        int above = conventions.getRisingState();
        int below = above == BELOW_HORIZON ? 1 : BELOW_HORIZON;
        return StateFunction.of(
                instant -> engine.observe(body, observer, instant).altitude(),
                new double[]{horizon},
                altitude -> altitude > horizon ? above : below);
    }

    /**
     * Fase del cielo (0-4) según la altitud aparente del Sol.
     */
    public static StateFunction twilight(EphemerisEngine engine, Observer observer, SkyConventions conventions) {
        return StateFunction.of(
                instant -> engine.observe(Body.SUN, observer, instant).altitude(),
                new double[]{
                        conventions.getAstronomicalTwilightDegrees(),
                        conventions.getNauticalTwilightDegrees(),
                        conventions.getCivilTwilightDegrees(),
                        conventions.getSunHorizonDegrees()},
                altitude -> twilightPhase(altitude, conventions).getCode());
    }

    public static TwilightPhase twilightPhase(double sunAltitude, SkyConventions conventions) {
        if (sunAltitude >= conventions.getSunHorizonDegrees()) return TwilightPhase.DAY;
        if (sunAltitude >= conventions.getCivilTwilightDegrees()) return TwilightPhase.CIVIL;
        if (sunAltitude >= conventions.getNauticalTwilightDegrees()) return TwilightPhase.NAUTICAL;
        if (sunAltitude >= conventions.getAstronomicalTwilightDegrees()) return TwilightPhase.ASTRONOMICAL;
        return TwilightPhase.NIGHT;
    }
}
