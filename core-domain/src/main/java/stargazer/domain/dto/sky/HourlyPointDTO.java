package stargazer.domain.dto.sky;

public record HourlyPointDTO(String time, double altitude, double azimuth) {}
