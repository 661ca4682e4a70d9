package stargazer.domain.sky;

/**
 * Noche resuelta para un día y lugar.
 *
 * @param window       Intervalo de noche verdadera, o el día natural completo si no la hay.
 * @param approximated true cuando se ha usado el día completo como aproximación
 *                     (día/noche polar, sin noche astronómica en esa latitud y estación).
 */
public record NightWindow(TimeWindow window, boolean approximated) {

    public static NightWindow trueNight(TimeWindow window) {
        return new NightWindow(window, false);
    }

    public static NightWindow fullDayFallback(TimeWindow day) {
        return new NightWindow(day, true);
    }
}
