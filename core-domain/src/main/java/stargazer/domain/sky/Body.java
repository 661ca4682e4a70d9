package stargazer.domain.sky;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Conjunto cerrado de cuerpos celestes que el sistema conoce.
 * <p>
 * Los ocho cuerpos seguidos (planetas + Luna) son configuración estática. El Sol existe
 * únicamente como cuerpo auxiliar para calcular crepúsculos y orto/ocaso.
 */
@Getter
@RequiredArgsConstructor
public enum Body {

    MERCURY("Mercury", BodyCategory.PLANET),
    VENUS("Venus", BodyCategory.PLANET),
    MARS("Mars", BodyCategory.PLANET),
    JUPITER("Jupiter", BodyCategory.PLANET),
    SATURN("Saturn", BodyCategory.PLANET),
    URANUS("Uranus", BodyCategory.PLANET),
    NEPTUNE("Neptune", BodyCategory.PLANET),
    MOON("Moon", BodyCategory.MOON),

    SUN("Sun", BodyCategory.STAR);

    private final String displayName;
    private final BodyCategory category;

    private static final List<Body> TRACKED = Arrays.stream(values())
            .filter(b -> b.category != BodyCategory.STAR)
            .collect(Collectors.toUnmodifiableList());

    /**
     * Cuerpos que aparecen en cada informe, en orden fijo.
     */
    public static List<Body> tracked() {
        return TRACKED;
    }
}
