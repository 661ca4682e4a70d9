package stargazer.domain.dto.sky;

import lombok.Builder;

import java.util.List;

/**
 * Respuesta completa de {@code GET /v1/sky}.
 */
@Builder
public record SkyReportDTO(
        String time,
        LocationDTO location,
        List<CelestialObjectDTO> objects,
        List<TwilightTransitionDTO> twilight,
        String sunrise,
        String sunset,
        double moonPhaseAngle,
        // Altitud/azimut del Sol en el instante consultado
        PositionDTO sun,
        // Noche usada para las series horarias
        String nightStart,
        String nightEnd,
        boolean nightWindowApproximated
) {}
