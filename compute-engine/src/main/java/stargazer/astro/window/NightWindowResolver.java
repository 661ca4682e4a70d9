package stargazer.astro.window;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import stargazer.astro.event.EventSelector;
import stargazer.config.SkyConventions;
import stargazer.domain.sky.NightWindow;
import stargazer.domain.sky.Observer;
import stargazer.domain.sky.TimeWindow;
import stargazer.domain.sky.TwilightTransition;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Resuelve la "noche verdadera" de un día natural UTC a partir de las transiciones de crepúsculo.
 * <p>
 * Inicio: primera transición cuyo estado resultante es el de noche cerrada.
 * Fin: primera transición posterior a un estado distinto.
 * <p>
 * Si no existe ese par dentro del día (día o noche polar, latitudes sin noche astronómica
 * en verano) se devuelve el día completo marcado como aproximación. Nunca lanza.
 */
@Slf4j
@RequiredArgsConstructor
public class NightWindowResolver {

    private final EventSelector eventSelector;
    private final SkyConventions conventions;

    public NightWindow resolve(LocalDate date, Observer observer) {
        TimeWindow day = TimeWindow.calendarDay(date);
        return resolve(day, eventSelector.twilightTimeline(observer, day));
    }

    public NightWindow resolve(TimeWindow day, List<TwilightTransition> transitions) {
        int night = conventions.getNightState();
        Instant nightStart = null;

        for (TwilightTransition transition : transitions) {
            if (nightStart == null) {
                if (transition.state() == night) {
                    nightStart = transition.time();
                }
            } else if (transition.state() != night) {
                return NightWindow.trueNight(new TimeWindow(nightStart, transition.time()));
            }
        }

        log.debug("No true night between {} and {}; using the whole calendar day", day.start(), day.end());
        return NightWindow.fullDayFallback(day);
    }
}
