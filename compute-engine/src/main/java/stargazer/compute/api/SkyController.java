package stargazer.compute.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import stargazer.config.ApiRoutes;
import stargazer.compute.service.SkyReportService;
import stargazer.domain.dto.sky.BodyInfoDTO;
import stargazer.domain.dto.sky.SkyReportDTO;
import stargazer.domain.sky.Body;
import stargazer.domain.sky.ObservationQuery;

import java.util.List;
import java.util.concurrent.CompletableFuture;

@Slf4j
@RestController
@RequestMapping(ApiRoutes.SKY)
@RequiredArgsConstructor
@Tag(name = "Cielo", description = "Visibilidad de cuerpos celestes para un observador")
public class SkyController {

    private final SkyReportService skyReportService;

    /**
     * GET /v1/sky?lat=40.0&lon=-74.0&time=2024-06-21T22:00:00Z
     * <p>
     * La validación es síncrona (400 inmediato); el cálculo se resuelve en el pool de cómputo.
     */
    @GetMapping
    @Operation(summary = "Informe del cielo nocturno",
            description = "Series horarias, orto/ocaso y mejor momento de observación de cada cuerpo, crepúsculos y fase lunar.")
    public CompletableFuture<SkyReportDTO> getSkyReport(
            @Parameter(description = "Latitud en grados [-90, 90]") @RequestParam(name = "lat", required = false) String lat,
            @Parameter(description = "Longitud en grados [-180, 180]") @RequestParam(name = "lon", required = false) String lon,
            @Parameter(description = "Instante ISO-8601; sin zona se asume UTC") @RequestParam(name = "time", required = false) String time
    ) {
        ObservationQuery query = ObservationQuery.parse(lat, lon, time);
        log.info(">>> API: Petición de informe (lat={}, lon={}, time={})", lat, lon, time);
        return skyReportService.reportAsync(query);
    }

    @GetMapping("/bodies")
    @Operation(summary = "Cuerpos incluidos en cada informe")
    public List<BodyInfoDTO> getTrackedBodies() {
        return Body.tracked().stream()
                .map(b -> new BodyInfoDTO(b.getDisplayName(), b.getCategory()))
                .toList();
    }
}
