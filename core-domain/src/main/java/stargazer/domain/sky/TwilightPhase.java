package stargazer.domain.sky;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/**
 * Fases del cielo según la altitud del Sol. El código numérico es el "estado" que
 * viaja en las transiciones: 0 es la oscuridad completa, 4 es día.
 */
@Getter
@RequiredArgsConstructor
public enum TwilightPhase {

    NIGHT(0),
    ASTRONOMICAL(1),
    NAUTICAL(2),
    CIVIL(3),
    DAY(4);

    private final int code;

    public static final int MIN_CODE = 0;
    public static final int MAX_CODE = 4;

    public static TwilightPhase fromCode(int code) {
        return Arrays.stream(values())
                .filter(p -> p.code == code)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown twilight state: " + code));
    }
}
