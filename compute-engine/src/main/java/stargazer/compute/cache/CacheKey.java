package stargazer.compute.cache;

/**
 * Clave canónica de la caché: (latitud, longitud, instante ISO-8601 UTC al segundo).
 */
public record CacheKey(double latitude, double longitude, String instant) {

    @Override
    public String toString() {
        return latitude + ":" + longitude + ":" + instant;
    }
}
