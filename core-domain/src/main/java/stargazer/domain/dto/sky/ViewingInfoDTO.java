package stargazer.domain.dto.sky;

import lombok.Builder;

/**
 * Mejor momento de observación y orto/ocaso alrededor del instante pedido (nullables).
 */
@Builder
public record ViewingInfoDTO(String bestViewingTime, String riseTime, String setTime) {}
