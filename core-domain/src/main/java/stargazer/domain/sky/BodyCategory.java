package stargazer.domain.sky;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum BodyCategory {

    PLANET("Planet"),
    MOON("Moon"),
    // Solo el Sol: referencia para crepúsculos y orto/ocaso, nunca se reporta
    STAR("Star");

    @JsonValue
    private final String label;
}
