package stargazer.domain.sky;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import stargazer.domain.exception.InvalidObservationException;

import static org.junit.jupiter.api.Assertions.*;

class ObserverTest {

    @Test
    @DisplayName("Los límites exactos son válidos (polos y antimeridiano)")
    void constructor_shouldAcceptBoundaries() {
        assertDoesNotThrow(() -> new Observer(90.0, 180.0));
        assertDoesNotThrow(() -> new Observer(-90.0, -180.0));
    }

    @Test
    @DisplayName("Fuera de rango o no finito -> InvalidObservationException")
    void constructor_shouldRejectInvalidCoordinates() {
        assertThrows(InvalidObservationException.class, () -> new Observer(90.0001, 0));
        assertThrows(InvalidObservationException.class, () -> new Observer(0, -180.0001));
        assertThrows(InvalidObservationException.class, () -> new Observer(Double.POSITIVE_INFINITY, 0));
        assertThrows(InvalidObservationException.class, () -> new Observer(0, Double.NaN));
    }

    @Test
    @DisplayName("Las coordenadas se conservan sin redondear")
    void constructor_shouldKeepCoordinatesVerbatim() {
        Observer observer = new Observer(40.123456789, -74.000000001);

        assertEquals(40.123456789, observer.latitude());
        assertEquals(-74.000000001, observer.longitude());
    }
}
