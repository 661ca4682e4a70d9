package stargazer.compute.cache;

import stargazer.domain.sky.Observer;
import stargazer.domain.sky.SkyTimes;

import java.time.Instant;

/**
 * Coordenadas tal cual llegan (sin redondeo) e instante en ISO-8601 UTC con precisión de segundos.
 * <p>
 * Dos coordenadas astronómicamente indistinguibles pero con distinta representación en coma
 * flotante producen entradas distintas. Es una imprecisión aceptada: la respuesta incluye
 * las coordenadas recibidas, y redondear haría que dos peticiones distintas compartieran payload.
 */
public class ExactCoordinatesKeyPolicy implements CacheKeyPolicy {

    @Override
    public CacheKey keyFor(Observer observer, Instant instant) {
        return new CacheKey(observer.latitude(), observer.longitude(), SkyTimes.iso(instant));
    }
}
