package stargazer.compute.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.test.web.servlet.MockMvc;
import stargazer.compute.cache.ExactCoordinatesKeyPolicy;
import stargazer.compute.cache.ResultCache;
import stargazer.compute.cache.SkyResultCaches;
import stargazer.config.ApiRoutes;
import stargazer.domain.sky.Observer;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = CacheAdminController.class)
class CacheAdminControllerTest {

    @TestConfiguration
    static class Caches {
        @Bean
        SkyResultCaches skyResultCaches() {
            ExactCoordinatesKeyPolicy policy = new ExactCoordinatesKeyPolicy();
            return new SkyResultCaches(
                    new ResultCache<>("bodies", 10, policy),
                    new ResultCache<>("twilight", 10, policy),
                    new ResultCache<>("moon-phase", 10, policy));
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private SkyResultCaches caches;

    @BeforeEach
    void setUp() {
        caches.all().forEach(ResultCache::clear);
        Observer observer = new Observer(40.0, -74.0);
        Instant t = Instant.parse("2024-06-21T22:00:00Z");
        caches.moonPhase().getOrCompute(observer, t, () -> 181.5);
        caches.moonPhase().getOrCompute(observer, t, () -> 181.5);
    }

    @Test
    @DisplayName("GET /v1/admin/cache -> estadísticas de las tres cachés")
    void getStats_ShouldReportEveryCache() throws Exception {
        mockMvc.perform(get(ApiRoutes.ADMIN + "/cache"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(3))
                .andExpect(jsonPath("$[2].name").value("moon-phase"))
                .andExpect(jsonPath("$[2].size").value(1))
                .andExpect(jsonPath("$[2].capacity").value(10))
                .andExpect(jsonPath("$[2].hits").isNumber());
    }

    @Test
    @DisplayName("DELETE /v1/admin/cache -> 204 y cachés vacías")
    void clear_ShouldEmptyAllCaches() throws Exception {
        mockMvc.perform(delete(ApiRoutes.ADMIN + "/cache"))
                .andExpect(status().isNoContent());

        assertEquals(0, caches.moonPhase().size());
    }
}
