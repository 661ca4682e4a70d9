package stargazer.compute.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import stargazer.astro.ephemeris.DiscreteEventFinder;
import stargazer.astro.ephemeris.EphemerisEngine;
import stargazer.astro.event.EventSelector;
import stargazer.astro.sampling.SamplingEngine;
import stargazer.astro.window.NightWindowResolver;
import stargazer.config.SkyConventions;

import java.time.Duration;

/**
 * Cableado del núcleo (clases Java planas, sin dependencia de Spring).
 */
@Configuration
public class SkyEngineConfig {

    @Bean
    public SkyConventions skyConventions(@Value("${stargazer.conventions.night-state:0}") int nightState,
                                         @Value("${stargazer.conventions.rising-state:1}") int risingState) {
        return SkyConventions.builder()
                .nightState(nightState)
                .risingState(risingState)
                .build();
    }

    @Bean
    public DiscreteEventFinder discreteEventFinder(@Value("${stargazer.events.search-step:PT5M}") Duration step,
                                                   @Value("${stargazer.events.tolerance:PT1S}") Duration tolerance) {
        return new DiscreteEventFinder(step, tolerance);
    }

    @Bean
    public EventSelector eventSelector(EphemerisEngine engine, SkyConventions conventions) {
        return new EventSelector(engine, conventions);
    }

    @Bean
    public NightWindowResolver nightWindowResolver(EventSelector eventSelector, SkyConventions conventions) {
        return new NightWindowResolver(eventSelector, conventions);
    }

    @Bean
    public SamplingEngine samplingEngine(EphemerisEngine engine) {
        return new SamplingEngine(engine);
    }
}
