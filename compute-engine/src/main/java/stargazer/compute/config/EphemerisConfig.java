package stargazer.compute.config;

import lombok.extern.slf4j.Slf4j;
import org.orekit.data.DataContext;
import org.orekit.data.DirectoryCrawler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import stargazer.astro.ephemeris.DiscreteEventFinder;
import stargazer.astro.ephemeris.EphemerisEngine;
import stargazer.astro.ephemeris.OrekitEphemerisEngine;
import stargazer.astro.event.SkyStateFunctions;
import stargazer.config.SkyConventions;
import stargazer.domain.exception.EphemerisUnavailableException;
import stargazer.domain.sky.Body;
import stargazer.domain.sky.Observer;

import java.io.File;
import java.time.Instant;

/**
 * Carga única del conjunto de efemérides ("Fail Fast").
 * <p>
 * Si el directorio de datos de Orekit no existe, el contexto no llega a levantarse: es una
 * condición fatal de arranque, nunca un error por petición.
 */
@Slf4j
@Configuration
public class EphemerisConfig {

    // Greenwich, 2000-01-01: a las 12:00Z el Sol está alto y a las 00:00Z es noche cerrada
    private static final Observer PROBE_SITE = new Observer(51.4769, 0.0);
    private static final Instant PROBE_NOON = Instant.parse("2000-01-01T12:00:00Z");
    private static final Instant PROBE_MIDNIGHT = Instant.parse("2000-01-01T00:00:00Z");

    @Bean
    public EphemerisEngine ephemerisEngine(@Value("${stargazer.ephemeris.data-path:orekit-data}") String dataPath,
                                           DiscreteEventFinder eventFinder) {
        File dataDir = new File(dataPath).getAbsoluteFile();
        log.info(">>> BOOTSTRAP: Cargando efemérides desde {}", dataDir);

        if (!dataDir.isDirectory()) {
            log.error(">>> FATAL: No se encuentra el directorio de efemérides: {}", dataDir);
            throw new EphemerisUnavailableException("Ephemeris dataset not found at " + dataDir);
        }

        try {
            DataContext.getDefault().getDataProvidersManager().addProvider(new DirectoryCrawler(dataDir));
            return new OrekitEphemerisEngine(eventFinder);
        } catch (RuntimeException e) {
            log.error(">>> FATAL: Error cargando el conjunto de efemérides.", e);
            throw new EphemerisUnavailableException("Ephemeris dataset could not be loaded from " + dataDir, e);
        }
    }

    /**
     * Verifica contra el motor real las convenciones numéricas (qué estado es "saliendo",
     * cuál es "noche cerrada") antes de aceptar tráfico.
     */
    @Bean
    public CommandLineRunner ephemerisIntegrityCheck(EphemerisEngine engine, SkyConventions conventions) {
        return args -> {
            int noonState = SkyStateFunctions.aboveHorizon(engine, Body.SUN, PROBE_SITE, conventions).stateAt(PROBE_NOON);
            if (noonState != conventions.getRisingState()) {
                throw new IllegalStateException("Rising-state convention " + conventions.getRisingState()
                        + " does not match the engine (Sun at noon reported " + noonState + ")");
            }
            log.info(">>> [PASO 1/2] Convención de orto verificada (estado {}).", noonState);

            int midnightState = SkyStateFunctions.twilight(engine, PROBE_SITE, conventions).stateAt(PROBE_MIDNIGHT);
            if (midnightState != conventions.getNightState()) {
                throw new IllegalStateException("Night-state convention " + conventions.getNightState()
                        + " does not match the engine (midnight reported " + midnightState + ")");
            }
            log.info(">>> [PASO 2/2] Convención de noche cerrada verificada (estado {}).", midnightState);
            log.info(">>> BOOTSTRAP: SISTEMA LISTO PARA CÓMPUTO.");
        };
    }
}
