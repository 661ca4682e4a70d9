package stargazer.config;

import lombok.Builder;
import lombok.Value;
import stargazer.domain.sky.BodyCategory;

/**
 * Convenciones numéricas que comparten el motor de efemérides y el selector de eventos.
 * <p>
 * Qué entero significa "saliendo" y cuál "noche cerrada" depende del motor de astronomía;
 * se tratan como configuración y se validan contra el motor al arrancar, no se asumen.
 */
@Value
@Builder
public class SkyConventions {

    /**
     * Estado de la función de crepúsculo que representa la oscuridad completa.
     */
    @Builder.Default
    int nightState = 0;

    /**
     * Estado de la función sobre-el-horizonte que marca un orto.
     * El ocaso es cualquier transición a un estado distinto.
     */
    @Builder.Default
    int risingState = 1;

    /**
     * Altitud aparente (grados) del centro del Sol en el orto/ocaso: borde superior en el horizonte.
     */
    @Builder.Default
    double sunHorizonDegrees = -0.2667;

    /**
     * Altitud aparente de la Luna en el orto/ocaso (semidiámetro medio).
     */
    @Builder.Default
    double moonHorizonDegrees = -0.2590;

    /**
     * Los planetas son puntuales: orto cuando su altitud aparente cruza 0.
     */
    @Builder.Default
    double planetHorizonDegrees = 0.0;

    @Builder.Default
    double civilTwilightDegrees = -6.0;

    @Builder.Default
    double nauticalTwilightDegrees = -12.0;

    @Builder.Default
    double astronomicalTwilightDegrees = -18.0;

    /**
     * Altitud aparente del horizonte para el orto/ocaso de un cuerpo según su categoría.
     */
    public double horizonDegreesFor(BodyCategory category) {
        return switch (category) {
            case STAR -> sunHorizonDegrees;
            case MOON -> moonHorizonDegrees;
            case PLANET -> planetHorizonDegrees;
        };
    }

    public static SkyConventions defaults() {
        return SkyConventions.builder().build();
    }
}
