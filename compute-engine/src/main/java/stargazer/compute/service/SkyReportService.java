package stargazer.compute.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import stargazer.astro.ephemeris.EphemerisEngine;
import stargazer.astro.event.EventSelector;
import stargazer.astro.sampling.SamplingEngine;
import stargazer.astro.window.NightWindowResolver;
import stargazer.compute.cache.SkyResultCaches;
import stargazer.domain.dto.sky.CelestialObjectDTO;
import stargazer.domain.dto.sky.HourlyPointDTO;
import stargazer.domain.dto.sky.LocationDTO;
import stargazer.domain.dto.sky.PositionDTO;
import stargazer.domain.dto.sky.SkyReportDTO;
import stargazer.domain.dto.sky.TwilightTransitionDTO;
import stargazer.domain.dto.sky.ViewingInfoDTO;
import stargazer.domain.exception.InvalidObservationException;
import stargazer.domain.exception.SkyComputationException;
import stargazer.domain.sky.Body;
import stargazer.domain.sky.HorizontalPosition;
import stargazer.domain.sky.HourlySeries;
import stargazer.domain.sky.NightWindow;
import stargazer.domain.sky.ObservationQuery;
import stargazer.domain.sky.Observer;
import stargazer.domain.sky.RiseSetTimes;
import stargazer.domain.sky.Sample;
import stargazer.domain.sky.SkyTimes;
import stargazer.domain.sky.TimeWindow;
import stargazer.domain.sky.TwilightTransition;
import stargazer.domain.sky.ViewingSummary;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Fachada de consulta: orquesta ventana nocturna, muestreo, selección de eventos y caché
 * para una petición (latitud, longitud, instante) y monta la respuesta.
 * <p>
 * El cálculo es síncrono y CPU-bound; {@link #reportAsync} solo lo saca del hilo del servlet.
 */
@Slf4j
@Service
public class SkyReportService {

    private final EphemerisEngine engine;
    private final NightWindowResolver nightWindowResolver;
    private final SamplingEngine samplingEngine;
    private final EventSelector eventSelector;
    private final SkyResultCaches caches;
    private final Executor computeExecutor;

    public SkyReportService(EphemerisEngine engine,
                            NightWindowResolver nightWindowResolver,
                            SamplingEngine samplingEngine,
                            EventSelector eventSelector,
                            SkyResultCaches caches,
                            @Qualifier("skyComputeExecutor") Executor computeExecutor) {
        this.engine = engine;
        this.nightWindowResolver = nightWindowResolver;
        this.samplingEngine = samplingEngine;
        this.eventSelector = eventSelector;
        this.caches = caches;
        this.computeExecutor = computeExecutor;
    }

    public CompletableFuture<SkyReportDTO> reportAsync(ObservationQuery query) {
        return CompletableFuture.supplyAsync(() -> report(query), computeExecutor);
    }

    public SkyReportDTO report(ObservationQuery query) {
        if (query == null) {
            throw new InvalidObservationException("Observation query is required");
        }
        Observer observer = query.observer();
        Instant instant = query.instant();
        log.info(">>> SKY: Informe para lat={} lon={} t={}", observer.latitude(), observer.longitude(), SkyTimes.iso(instant));

        try {
            TimeWindow day = TimeWindow.calendarDayOf(instant);

            List<TwilightTransition> twilight = caches.twilight()
                    .getOrCompute(observer, instant, () -> eventSelector.twilightTimeline(observer, day));
            NightWindow night = nightWindowResolver.resolve(day, twilight);

            List<CelestialObjectDTO> objects = caches.bodies()
                    .getOrCompute(observer, instant, () -> computeBodies(observer, instant, day, night));

            RiseSetTimes sun = eventSelector.sunriseSunset(observer, day);
            HorizontalPosition sunNow = engine.observe(Body.SUN, observer, instant);

            double moonPhase = caches.moonPhase()
                    .getOrCompute(observer, instant, () -> engine.moonPhaseAngle(instant));

            return SkyReportDTO.builder()
                    .time(SkyTimes.iso(instant))
                    .location(new LocationDTO(observer.latitude(), observer.longitude()))
                    .objects(objects)
                    .twilight(twilight.stream()
                            .map(t -> new TwilightTransitionDTO(SkyTimes.iso(t.time()), t.state(), t.phase()))
                            .toList())
                    .sunrise(SkyTimes.iso(sun.rise()))
                    .sunset(SkyTimes.iso(sun.set()))
                    .moonPhaseAngle(moonPhase)
                    .sun(new PositionDTO(sunNow.altitude(), sunNow.azimuth()))
                    .nightStart(SkyTimes.iso(night.window().start()))
                    .nightEnd(SkyTimes.iso(night.window().end()))
                    .nightWindowApproximated(night.approximated())
                    .build();

        } catch (RuntimeException e) {
            log.error("Sky computation failed for lat={} lon={} t={}",
                    observer.latitude(), observer.longitude(), SkyTimes.iso(instant), e);
            throw new SkyComputationException("Sky computation failed: " + e.getMessage(), e);
        }
    }

    private List<CelestialObjectDTO> computeBodies(Observer observer, Instant instant, TimeWindow day, NightWindow night) {
        List<CelestialObjectDTO> objects = new ArrayList<>();
        for (Body body : Body.tracked()) {
            HourlySeries series = samplingEngine.sample(body, observer, night.window());
            RiseSetTimes riseSet = eventSelector.riseSetAround(body, observer, day, instant);
            ViewingSummary summary = new ViewingSummary(
                    series.bestSample().map(Sample::time).orElse(null),
                    riseSet.rise(),
                    riseSet.set());
            HorizontalPosition current = engine.observe(body, observer, instant);

            objects.add(toDto(body, series, summary, current));
        }
        log.debug("Computed {} bodies over night window {} - {}", objects.size(),
                night.window().start(), night.window().end());
        return List.copyOf(objects);
    }

    private static CelestialObjectDTO toDto(Body body, HourlySeries series, ViewingSummary summary,
                                            HorizontalPosition current) {
        return CelestialObjectDTO.builder()
                .name(body.getDisplayName())
                .category(body.getCategory())
                .hourlyData(series.samples().stream()
                        .map(s -> new HourlyPointDTO(SkyTimes.iso(s.time()), s.altitude(), s.azimuth()))
                        .toList())
                .additionalInfo(ViewingInfoDTO.builder()
                        .bestViewingTime(SkyTimes.iso(summary.bestViewingTime()))
                        .riseTime(SkyTimes.iso(summary.riseTime()))
                        .setTime(SkyTimes.iso(summary.setTime()))
                        .build())
                .currentPosition(new PositionDTO(current.altitude(), current.azimuth()))
                .build();
    }
}
