package stargazer.domain.exception;

/**
 * Fallo inesperado durante el cálculo de un informe del cielo.
 * No hay respuesta parcial: la petición entera falla con un 500.
 */
public class SkyComputationException extends RuntimeException {

    public SkyComputationException(String message, Throwable cause) {
        super(message, cause);
    }
}
