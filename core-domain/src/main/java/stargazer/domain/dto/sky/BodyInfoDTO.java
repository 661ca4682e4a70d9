package stargazer.domain.dto.sky;

import stargazer.domain.sky.BodyCategory;

public record BodyInfoDTO(String name, BodyCategory category) {}
