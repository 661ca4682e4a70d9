package stargazer.compute.api;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import stargazer.domain.exception.InvalidObservationException;
import stargazer.domain.exception.SkyComputationException;

import java.time.LocalDateTime;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Coordenadas fuera de rango, parámetros ausentes o instante ilegible.
     * Log: WARN (error de la petición, no del sistema).
     */
    @ExceptionHandler(InvalidObservationException.class)
    public ResponseEntity<Object> handleInvalidObservation(InvalidObservationException ex) {
        // Solo el mensaje, sin stacktrace
        log.warn("Invalid observation request: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
                "timestamp", LocalDateTime.now(),
                "status", 400,
                "error", "Invalid Observation Request",
                "message", ex.getMessage()
        ));
    }

    /**
     * Fallo del motor de efemérides o de la búsqueda de eventos.
     * El servicio ya registró la traza completa.
     */
    @ExceptionHandler(SkyComputationException.class)
    public ResponseEntity<Object> handleSkyComputation(SkyComputationException ex) {
        log.error("Sky computation error: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
                "timestamp", LocalDateTime.now(),
                "status", 500,
                "error", "Sky Computation Failed",
                "message", ex.getMessage()
        ));
    }

    /**
     * Todo lo demás.
     * Log: ERROR (con stacktrace completo).
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleGeneralErrors(Exception ex) {
        log.error("Unexpected System Error occurred", ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
                "timestamp", LocalDateTime.now(),
                "status", 500,
                "error", "Internal Server Error",
                "message", String.valueOf(ex.getMessage())
        ));
    }
}
