package stargazer.astro.ephemeris;

import lombok.extern.slf4j.Slf4j;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.orekit.bodies.CelestialBody;
import org.orekit.bodies.CelestialBodyFactory;
import org.orekit.bodies.GeodeticPoint;
import org.orekit.bodies.OneAxisEllipsoid;
import org.orekit.frames.Frame;
import org.orekit.frames.FramesFactory;
import org.orekit.frames.TopocentricFrame;
import org.orekit.models.earth.EarthStandardAtmosphereRefraction;
import org.orekit.models.earth.ReferenceEllipsoid;
import org.orekit.time.AbsoluteDate;
import org.orekit.time.TimeScale;
import org.orekit.time.TimeScalesFactory;
import org.orekit.utils.Constants;
import org.orekit.utils.IERSConventions;
import stargazer.domain.sky.Body;
import stargazer.domain.sky.DiscreteEvent;
import stargazer.domain.sky.HorizontalPosition;
import stargazer.domain.sky.Observer;
import stargazer.domain.sky.TimeWindow;

import java.time.Instant;
import java.util.Date;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Motor de efemérides sobre Orekit y las efemérides JPL DE del directorio de datos.
 * <p>
 * Los manejadores de Orekit (marcos, elipsoide, cuerpos) se crean una sola vez al arrancar y
 * se comparten en solo lectura entre peticiones. Requiere que los datos de Orekit ya estén
 * registrados en el {@code DataContext} por defecto (ver {@code EphemerisConfig}).
 */
@Slf4j
public class OrekitEphemerisEngine implements EphemerisEngine {

    // Por debajo de -1° de altitud geométrica no se aplica refracción (la fórmula diverge)
    private static final double REFRACTION_FLOOR = Math.toRadians(-1.0);

    private final TimeScale utc;
    private final Frame gcrf;
    private final Frame icrf;
    private final Frame ecliptic;
    private final OneAxisEllipsoid earthShape;
    private final CelestialBody earth;
    private final Map<Body, CelestialBody> bodies;
    private final EarthStandardAtmosphereRefraction refraction;
    private final DiscreteEventFinder eventFinder;

    public OrekitEphemerisEngine(DiscreteEventFinder eventFinder) {
        this.eventFinder = eventFinder;
        this.utc = TimeScalesFactory.getUTC();
        this.gcrf = FramesFactory.getGCRF();
        this.icrf = FramesFactory.getICRF();
        this.ecliptic = FramesFactory.getEcliptic(IERSConventions.IERS_2010);
        this.earthShape = ReferenceEllipsoid.getWgs84(FramesFactory.getITRF(IERSConventions.IERS_2010, true));
        this.earth = CelestialBodyFactory.getEarth();
        this.refraction = new EarthStandardAtmosphereRefraction();

        Map<Body, CelestialBody> map = new EnumMap<>(Body.class);
        map.put(Body.SUN, CelestialBodyFactory.getSun());
        map.put(Body.MOON, CelestialBodyFactory.getMoon());
        map.put(Body.MERCURY, CelestialBodyFactory.getMercury());
        map.put(Body.VENUS, CelestialBodyFactory.getVenus());
        map.put(Body.MARS, CelestialBodyFactory.getMars());
        map.put(Body.JUPITER, CelestialBodyFactory.getJupiter());
        map.put(Body.SATURN, CelestialBodyFactory.getSaturn());
        map.put(Body.URANUS, CelestialBodyFactory.getUranus());
        map.put(Body.NEPTUNE, CelestialBodyFactory.getNeptune());
        this.bodies = map;

        log.info("Motor de efemérides inicializado: WGS84/ITRF (IERS-2010), {} cuerpos", bodies.size());
    }

    @Override
    public HorizontalPosition observe(Body body, Observer observer, Instant instant) {
        AbsoluteDate date = toDate(instant);
        TopocentricFrame site = siteOf(observer);

        Vector3D geocentric = apparentGeocentricPosition(bodies.get(body), date);
        double trueElevation = site.getElevation(geocentric, gcrf, date);
        double azimuth = site.getAzimuth(geocentric, gcrf, date);

        return new HorizontalPosition(
                Math.toDegrees(apparentElevation(refraction, trueElevation)),
                normalizeDegrees(Math.toDegrees(azimuth)));
    }

    @Override
    public List<DiscreteEvent> findDiscrete(TimeWindow window, StateFunction function) {
        return eventFinder.find(window, function);
    }

    @Override
    public double moonPhaseAngle(Instant instant) {
        AbsoluteDate date = toDate(instant);
        Vector3D moon = bodies.get(Body.MOON).getPVCoordinates(date, ecliptic).getPosition();
        Vector3D sun = bodies.get(Body.SUN).getPVCoordinates(date, ecliptic).getPosition();

        double moonLongitude = Math.toDegrees(Math.atan2(moon.getY(), moon.getX()));
        double sunLongitude = Math.toDegrees(Math.atan2(sun.getY(), sun.getX()));
        return normalizeDegrees(moonLongitude - sunLongitude);
    }

    /**
     * Posición del cuerpo respecto al geocentro, corregida por tiempo de luz (una iteración).
     * Se resta en el ICRF baricéntrico; los ejes coinciden con los del GCRF.
     */
    private Vector3D apparentGeocentricPosition(CelestialBody target, AbsoluteDate date) {
        Vector3D earthAt = earth.getPVCoordinates(date, icrf).getPosition();
        Vector3D targetAt = target.getPVCoordinates(date, icrf).getPosition();
        double lightTime = targetAt.subtract(earthAt).getNorm() / Constants.SPEED_OF_LIGHT;

        Vector3D retarded = target.getPVCoordinates(date.shiftedBy(-lightTime), icrf).getPosition();
        return retarded.subtract(earthAt);
    }

    private TopocentricFrame siteOf(Observer observer) {
        GeodeticPoint point = new GeodeticPoint(
                Math.toRadians(observer.latitude()),
                Math.toRadians(observer.longitude()),
                0.0);
        return new TopocentricFrame(earthShape, point, "observer");
    }

    private AbsoluteDate toDate(Instant instant) {
        return new AbsoluteDate(Date.from(instant), utc);
    }

    /**
     * Elevación aparente en radianes. Sin refracción por debajo de -1° geométricos.
     */
    static double apparentElevation(EarthStandardAtmosphereRefraction refraction, double trueElevation) {
        if (trueElevation <= REFRACTION_FLOOR) {
            return trueElevation;
        }
        return trueElevation + refraction.getRefraction(trueElevation);
    }

    /**
     * Reduce un ángulo a [0, 360).
     */
    static double normalizeDegrees(double degrees) {
        double normalized = degrees % 360.0;
        if (normalized < 0) {
            normalized += 360.0;
        }
        if (normalized >= 360.0 || normalized == 0.0) {
            // también convierte -0.0 en 0.0
            return 0.0;
        }
        return normalized;
    }
}
