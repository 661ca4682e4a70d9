package stargazer.compute.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import stargazer.compute.cache.CacheKeyPolicy;
import stargazer.compute.cache.ExactCoordinatesKeyPolicy;
import stargazer.compute.cache.ResultCache;
import stargazer.compute.cache.SkyResultCaches;

@Configuration
public class CacheConfig {

    @Bean
    public CacheKeyPolicy cacheKeyPolicy() {
        return new ExactCoordinatesKeyPolicy();
    }

    @Bean
    public SkyResultCaches skyResultCaches(CacheKeyPolicy keyPolicy,
                                           @Value("${stargazer.cache.bodies-capacity:500}") int bodiesCapacity,
                                           @Value("${stargazer.cache.twilight-capacity:500}") int twilightCapacity,
                                           @Value("${stargazer.cache.moon-phase-capacity:500}") int moonPhaseCapacity) {
        return new SkyResultCaches(
                new ResultCache<>("bodies", bodiesCapacity, keyPolicy),
                new ResultCache<>("twilight", twilightCapacity, keyPolicy),
                new ResultCache<>("moon-phase", moonPhaseCapacity, keyPolicy));
    }
}
