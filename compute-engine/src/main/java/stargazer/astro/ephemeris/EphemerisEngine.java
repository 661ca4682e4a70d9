package stargazer.astro.ephemeris;

import stargazer.domain.sky.Body;
import stargazer.domain.sky.DiscreteEvent;
import stargazer.domain.sky.HorizontalPosition;
import stargazer.domain.sky.Observer;
import stargazer.domain.sky.TimeWindow;

import java.time.Instant;
import java.util.List;

/**
 * Capacidad mínima que el núcleo necesita del motor de astronomía posicional.
 * <p>
 * Todo lo demás (ventanas, muestreo, selección de eventos, caché) se construye encima
 * de estas tres operaciones, lo que permite probar el núcleo con un motor sintético.
 */
public interface EphemerisEngine {

    /**
     * Posición aparente (altitud/azimut) de un cuerpo visto desde el observador.
     */
    HorizontalPosition observe(Body body, Observer observer, Instant instant);

    /**
     * Transiciones de una función escalonada dentro de la ventana, en orden ascendente.
     * Cada evento indica el instante y el nuevo estado.
     */
    List<DiscreteEvent> findDiscrete(TimeWindow window, StateFunction function);

    /**
     * Ángulo de fase lunar en grados, [0, 360): 0 luna nueva, 180 luna llena.
     */
    double moonPhaseAngle(Instant instant);
}
