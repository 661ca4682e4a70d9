package stargazer.domain.exception;

/**
 * Petición de observación inválida (coordenadas fuera de rango, instante mal formado...).
 * Se lanza antes de cualquier cálculo astronómico y se traduce a un 400.
 */
public class InvalidObservationException extends RuntimeException {

    public InvalidObservationException(String message) {
        super(message);
    }

    public InvalidObservationException(String message, Throwable cause) {
        super(message, cause);
    }
}
