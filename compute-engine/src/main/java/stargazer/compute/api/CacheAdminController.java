package stargazer.compute.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import stargazer.compute.cache.ResultCache;
import stargazer.compute.cache.SkyResultCaches;
import stargazer.config.ApiRoutes;
import stargazer.domain.dto.sky.CacheStatsDTO;

import java.util.List;

@Slf4j
@RestController
@RequestMapping(ApiRoutes.ADMIN + "/cache")
@RequiredArgsConstructor
@Tag(name = "Administración", description = "Estado de las cachés de resultados")
public class CacheAdminController {

    private final SkyResultCaches caches;

    @GetMapping
    @Operation(summary = "Estadísticas de las cachés (tamaño, aciertos, fallos, desalojos)")
    public List<CacheStatsDTO> getStats() {
        return caches.all().stream()
                .map(ResultCache::stats)
                .toList();
    }

    @DeleteMapping
    @Operation(summary = "Vaciar todas las cachés")
    public ResponseEntity<Void> clear() {
        caches.all().forEach(ResultCache::clear);
        log.info(">>> ADMIN: Cachés vaciadas.");
        return ResponseEntity.noContent().build();
    }
}
