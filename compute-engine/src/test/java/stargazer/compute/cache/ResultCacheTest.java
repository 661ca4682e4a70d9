package stargazer.compute.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import stargazer.domain.dto.sky.CacheStatsDTO;
import stargazer.domain.sky.Observer;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ResultCacheTest {

    private static final Instant T = Instant.parse("2024-06-21T22:00:00Z");
    private static final Observer A = new Observer(40.0, -74.0);
    private static final Observer B = new Observer(51.5, -0.1);
    private static final Observer C = new Observer(-33.9, 151.2);

    private ResultCache<String> cache;
    private AtomicInteger computations;

    @BeforeEach
    void setUp() {
        cache = new ResultCache<>("test", 2, new ExactCoordinatesKeyPolicy());
        computations = new AtomicInteger();
    }

    private String compute(String value) {
        computations.incrementAndGet();
        return value;
    }

    @Test
    @DisplayName("Fallo y después acierto: el cálculo se ejecuta una sola vez")
    void getOrCompute_shouldMemoize() {
        String first = cache.getOrCompute(A, T, () -> compute("a"));
        String second = cache.getOrCompute(A, T, () -> compute("other"));

        assertEquals("a", first);
        assertEquals("a", second);
        assertEquals(1, computations.get());

        CacheStatsDTO stats = cache.stats();
        assertEquals(1, stats.hits());
        assertEquals(1, stats.misses());
        assertEquals(1, stats.size());
        assertEquals(2, stats.capacity());
    }

    @Test
    @DisplayName("Instantes que difieren en milisegundos comparten entrada (precisión de segundos)")
    void getOrCompute_shouldKeyOnWholeSeconds() {
        cache.getOrCompute(A, T, () -> compute("a"));
        cache.getOrCompute(A, T.plusMillis(400), () -> compute("b"));

        assertEquals(1, computations.get());
    }

    @Test
    @DisplayName("Coordenadas distintas (aunque cercanas) son entradas distintas")
    void getOrCompute_shouldNotRoundCoordinates() {
        cache.getOrCompute(new Observer(40.0, -74.0), T, () -> compute("a"));
        cache.getOrCompute(new Observer(40.0000001, -74.0), T, () -> compute("b"));

        assertEquals(2, computations.get());
    }

    @Test
    @DisplayName("LRU: al superar la capacidad se desaloja la entrada menos usada recientemente")
    void getOrCompute_shouldEvictLeastRecentlyUsed() {
        cache.getOrCompute(A, T, () -> compute("a"));
        cache.getOrCompute(B, T, () -> compute("b"));
        cache.getOrCompute(A, T, () -> compute("a"));   // A pasa a ser la más reciente
        cache.getOrCompute(C, T, () -> compute("c"));   // desaloja B

        assertTrue(cache.contains(A, T));
        assertFalse(cache.contains(B, T));
        assertTrue(cache.contains(C, T));
        assertEquals(2, cache.size());
        assertEquals(1, cache.stats().evictions());
    }

    @Test
    @DisplayName("Un cálculo que devuelve null no se memoiza")
    void getOrCompute_shouldRejectNullResults() {
        assertThrows(NullPointerException.class, () -> cache.getOrCompute(A, T, () -> null));
        assertFalse(cache.contains(A, T));
    }

    @Test
    @DisplayName("clear vacía la caché pero conserva los contadores")
    void clear_shouldEmptyEntries() {
        cache.getOrCompute(A, T, () -> compute("a"));
        cache.clear();

        assertEquals(0, cache.size());
        assertEquals(1, cache.stats().misses());
    }

    @Test
    @DisplayName("Capacidad no positiva -> IllegalArgumentException")
    void constructor_shouldRejectNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new ResultCache<>("bad", 0, new ExactCoordinatesKeyPolicy()));
    }
}
