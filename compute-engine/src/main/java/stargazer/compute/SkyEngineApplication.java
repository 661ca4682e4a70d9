package stargazer.compute;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Punto de entrada principal del Sky Engine (Backend).
 * <p>
 * Responsabilidades:
 * 1. Arrancar el contexto de Spring Boot (Web, OpenAPI).
 * 2. Cargar el conjunto de efemérides antes de aceptar tráfico (ver {@code EphemerisConfig}).
 */
@SpringBootApplication(scanBasePackages = "stargazer")
public class SkyEngineApplication {

    public static void main(String[] args) {
        // El puerto se puede configurar vía args: --server.port=9090
        SpringApplication.run(SkyEngineApplication.class, args);
    }
}
