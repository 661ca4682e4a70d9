package stargazer.domain.dto.sky;

import lombok.Builder;
import stargazer.domain.sky.BodyCategory;

import java.util.List;

@Builder
public record CelestialObjectDTO(
        String name,
        BodyCategory category,
        List<HourlyPointDTO> hourlyData,
        ViewingInfoDTO additionalInfo,
        PositionDTO currentPosition
) {
    public CelestialObjectDTO {
        hourlyData = hourlyData == null ? List.of() : List.copyOf(hourlyData);
    }
}
