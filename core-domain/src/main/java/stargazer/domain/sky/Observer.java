package stargazer.domain.sky;

import stargazer.domain.exception.InvalidObservationException;

/**
 * Posición geográfica del observador (grados, WGS84).
 * <p>
 * Inmutable y construido por petición. Las coordenadas se guardan tal cual llegan:
 * no se redondean (ver {@code ExactCoordinatesKeyPolicy}).
 *
 * @param latitude  Latitud en grados, [-90, 90].
 * @param longitude Longitud en grados, [-180, 180].
 */
public record Observer(double latitude, double longitude) {

    public Observer {
        if (!Double.isFinite(latitude) || latitude < -90.0 || latitude > 90.0) {
            throw new InvalidObservationException("Latitude must be within [-90, 90], got: " + latitude);
        }
        if (!Double.isFinite(longitude) || longitude < -180.0 || longitude > 180.0) {
            throw new InvalidObservationException("Longitude must be within [-180, 180], got: " + longitude);
        }
    }
}
