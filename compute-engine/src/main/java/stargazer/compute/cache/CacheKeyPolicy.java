package stargazer.compute.cache;

import stargazer.domain.sky.Observer;

import java.time.Instant;

/**
 * Canonicalización de (observador, instante) en una clave de caché.
 */
@FunctionalInterface
public interface CacheKeyPolicy {

    CacheKey keyFor(Observer observer, Instant instant);
}
