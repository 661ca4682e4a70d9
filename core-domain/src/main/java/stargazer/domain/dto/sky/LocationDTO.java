package stargazer.domain.dto.sky;

public record LocationDTO(double latitude, double longitude) {}
