package stargazer.testutil;

import stargazer.astro.ephemeris.DiscreteEventFinder;
import stargazer.astro.ephemeris.EphemerisEngine;
import stargazer.astro.ephemeris.StateFunction;
import stargazer.domain.sky.Body;
import stargazer.domain.sky.DiscreteEvent;
import stargazer.domain.sky.HorizontalPosition;
import stargazer.domain.sky.Observer;
import stargazer.domain.sky.TimeWindow;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Motor determinista para tests: alturas sinusoidales en hora solar local.
 * <p>
 * Sol: {@code alt = 60 cos(H) + (lat - 10)}, con H el ángulo horario desde el mediodía local.
 * A lat 40 la noche cerrada dura unas 5 h centradas en la medianoche local; a lat 70 el Sol
 * nunca baja del horizonte. Cada cuerpo culmina a una hora local distinta.
 * La búsqueda de eventos usa el {@link DiscreteEventFinder} real.
 */
public class SyntheticSkyEngine implements EphemerisEngine {

    private final DiscreteEventFinder finder;
    private final AtomicLong observeCalls = new AtomicLong();

    public SyntheticSkyEngine() {
        this(new DiscreteEventFinder());
    }

    public SyntheticSkyEngine(DiscreteEventFinder finder) {
        this.finder = finder;
    }

    @Override
    public HorizontalPosition observe(Body body, Observer observer, Instant instant) {
        observeCalls.incrementAndGet();
        double localHours = localSolarHours(observer, instant);

        if (body == Body.SUN) {
            double altitude = 60.0 * Math.cos(hourAngle(localHours, 12.0)) + (observer.latitude() - 10.0);
            return new HorizontalPosition(clamp(altitude), azimuth(localHours, 0));
        }

        double culmination = (body.ordinal() * 3.0) % 24.0;
        double altitude = 45.0 * Math.cos(hourAngle(localHours, culmination)) + 5.0;
        return new HorizontalPosition(clamp(altitude), azimuth(localHours, body.ordinal() * 40.0));
    }

    @Override
    public List<DiscreteEvent> findDiscrete(TimeWindow window, StateFunction function) {
        return finder.find(window, function);
    }

    @Override
    public double moonPhaseAngle(Instant instant) {
        double days = instant.getEpochSecond() / 86400.0;
        double angle = (days * 12.190749) % 360.0;
        return angle < 0 ? angle + 360.0 : angle;
    }

    public long observeCalls() {
        return observeCalls.get();
    }

    private static double localSolarHours(Observer observer, Instant instant) {
        double utcHours = (instant.getEpochSecond() % 86400) / 3600.0;
        return utcHours + observer.longitude() / 15.0;
    }

    private static double hourAngle(double localHours, double culminationHour) {
        return 2.0 * Math.PI * (localHours - culminationHour) / 24.0;
    }

    private static double azimuth(double localHours, double offset) {
        double az = (localHours * 15.0 + offset) % 360.0;
        return az < 0 ? az + 360.0 : az;
    }

    private static double clamp(double altitude) {
        return Math.max(-90.0, Math.min(90.0, altitude));
    }
}
