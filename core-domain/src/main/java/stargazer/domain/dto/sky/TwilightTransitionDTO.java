package stargazer.domain.dto.sky;

import stargazer.domain.sky.TwilightPhase;

public record TwilightTransitionDTO(String time, int state, TwilightPhase phase) {}
