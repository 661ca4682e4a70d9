package stargazer.domain.dto.sky;

import lombok.Builder;

@Builder
public record CacheStatsDTO(
        String name,
        int size,
        int capacity,
        long hits,
        long misses,
        long evictions
) {}
