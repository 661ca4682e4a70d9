package stargazer.domain.dto.sky;

public record PositionDTO(double altitude, double azimuth) {}
