package stargazer.astro.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import stargazer.astro.ephemeris.EphemerisEngine;
import stargazer.config.SkyConventions;
import stargazer.domain.sky.Body;
import stargazer.domain.sky.DiscreteEvent;
import stargazer.domain.sky.Observer;
import stargazer.domain.sky.RiseSetTimes;
import stargazer.domain.sky.TimeWindow;
import stargazer.domain.sky.TwilightTransition;

import java.time.Instant;
import java.util.List;

/**
 * Localiza eventos discretos (orto/ocaso, orto/ocaso solar, crepúsculos) dentro de un día
 * y aplica la política de selección respecto a un instante de referencia.
 * <p>
 * Política asimétrica centrada en la referencia:
 * <ul>
 *     <li>Orto: el <b>último</b> orto en o antes de la referencia ("¿cuándo salió?").</li>
 *     <li>Ocaso: el <b>primer</b> ocaso en o después de la referencia ("¿cuándo se pone?").</li>
 * </ul>
 * La búsqueda nunca se extiende al día anterior o siguiente: si no hay evento, null.
 * <p>
 * Un fallo del motor para un cuerpo se degrada a null para ese cuerpo; nunca aborta la petición.
 */
@Slf4j
@RequiredArgsConstructor
public class EventSelector {

    private final EphemerisEngine engine;
    private final SkyConventions conventions;

    public RiseSetTimes riseSetAround(Body body, Observer observer, TimeWindow day, Instant reference) {
        try {
            List<DiscreteEvent> events = engine.findDiscrete(day,
                    SkyStateFunctions.aboveHorizon(engine, body, observer, conventions));
            return selectAround(events, reference);
        } catch (RuntimeException e) {
            log.warn("Rise/set search failed for {} at ({}, {}): {}",
                    body.getDisplayName(), observer.latitude(), observer.longitude(), e.getMessage());
            return RiseSetTimes.NONE;
        }
    }

    /**
     * Orto y ocaso solares del día natural: el primero de cada tipo, sin depender de la referencia.
     */
    public RiseSetTimes sunriseSunset(Observer observer, TimeWindow day) {
        try {
            List<DiscreteEvent> events = engine.findDiscrete(day,
                    SkyStateFunctions.aboveHorizon(engine, Body.SUN, observer, conventions));
            return selectFirstOfDay(events);
        } catch (RuntimeException e) {
            log.warn("Sunrise/sunset search failed at ({}, {}): {}",
                    observer.latitude(), observer.longitude(), e.getMessage());
            return RiseSetTimes.NONE;
        }
    }

    /**
     * Línea temporal completa de fases del cielo en la ventana. Vacía si el motor falla.
     */
    public List<TwilightTransition> twilightTimeline(Observer observer, TimeWindow window) {
        try {
            return engine.findDiscrete(window, SkyStateFunctions.twilight(engine, observer, conventions))
                    .stream()
                    .map(TwilightTransition::from)
                    .toList();
        } catch (RuntimeException e) {
            log.warn("Twilight search failed at ({}, {}): {}",
                    observer.latitude(), observer.longitude(), e.getMessage());
            return List.of();
        }
    }

    RiseSetTimes selectAround(List<DiscreteEvent> events, Instant reference) {
        Instant rise = null;
        Instant set = null;
        for (DiscreteEvent event : events) {
            if (isRising(event)) {
                if (!event.time().isAfter(reference)) {
                    rise = event.time();
                }
            } else if (set == null && !event.time().isBefore(reference)) {
                set = event.time();
            }
        }
        return new RiseSetTimes(rise, set);
    }

    RiseSetTimes selectFirstOfDay(List<DiscreteEvent> events) {
        Instant rise = null;
        Instant set = null;
        for (DiscreteEvent event : events) {
            if (isRising(event)) {
                if (rise == null) rise = event.time();
            } else if (set == null) {
                set = event.time();
            }
        }
        return new RiseSetTimes(rise, set);
    }

    private boolean isRising(DiscreteEvent event) {
        return event.state() == conventions.getRisingState();
    }
}
