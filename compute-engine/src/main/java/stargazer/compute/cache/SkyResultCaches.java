package stargazer.compute.cache;

import stargazer.domain.dto.sky.CelestialObjectDTO;
import stargazer.domain.sky.TwilightTransition;

import java.util.List;

/**
 * Las tres cachés del servicio: resultados por cuerpo, crepúsculos y fase lunar.
 */
public record SkyResultCaches(
        ResultCache<List<CelestialObjectDTO>> bodies,
        ResultCache<List<TwilightTransition>> twilight,
        ResultCache<Double> moonPhase
) {
    public List<ResultCache<?>> all() {
        return List.of(bodies, twilight, moonPhase);
    }
}
