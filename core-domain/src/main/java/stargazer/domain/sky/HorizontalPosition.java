package stargazer.domain.sky;

/**
 * Coordenadas horizontales aparentes.
 *
 * @param altitude Grados sobre el horizonte, [-90, 90].
 * @param azimuth  Rumbo desde el norte en sentido horario, [0, 360).
 */
public record HorizontalPosition(double altitude, double azimuth) {
}
