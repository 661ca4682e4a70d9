package stargazer.domain.exception;

/**
 * The ephemeris dataset could not be loaded. Fatal at startup.
 */
public class EphemerisUnavailableException extends RuntimeException {

    public EphemerisUnavailableException(String message) {
        super(message);
    }

    public EphemerisUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
