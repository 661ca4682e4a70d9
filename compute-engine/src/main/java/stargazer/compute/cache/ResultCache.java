package stargazer.compute.cache;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import stargazer.domain.dto.sky.CacheStatsDTO;
import stargazer.domain.sky.Observer;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Memoización acotada (LRU) de un cálculo puro y determinista de (lugar, instante).
 * <p>
 * Sin TTL: con un único conjunto de efemérides el resultado no caduca. Los valores deben ser
 * inmutables. El cálculo se ejecuta fuera del cerrojo: dos fallos concurrentes sobre la misma
 * clave pueden calcular ambos y el último sobrescribe, lo cual es inocuo porque el resultado
 * es idéntico. El cerrojo solo protege la estructura del mapa.
 *
 * @param <V> Tipo del valor memoizado.
 */
@Slf4j
public class ResultCache<V> {

    @Getter
    private final String name;
    @Getter
    private final int capacity;
    private final CacheKeyPolicy keyPolicy;

    private final Map<CacheKey, V> entries;
    private final Object lock = new Object();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public ResultCache(String name, int capacity, CacheKeyPolicy keyPolicy) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Cache capacity must be positive: " + capacity);
        }
        this.name = name;
        this.capacity = capacity;
        this.keyPolicy = keyPolicy;
        // accessOrder=true: cada lectura mueve la entrada al final (más reciente)
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<CacheKey, V> eldest) {
                if (size() > ResultCache.this.capacity) {
                    evictions.incrementAndGet();
                    log.debug("CACHE EVICT [{}] {}", ResultCache.this.name, eldest.getKey());
                    return true;
                }
                return false;
            }
        };
    }

    public V getOrCompute(Observer observer, Instant instant, Supplier<V> computation) {
        CacheKey key = keyPolicy.keyFor(observer, instant);

        V cached;
        synchronized (lock) {
            cached = entries.get(key);
        }
        if (cached != null) {
            hits.incrementAndGet();
            log.debug("CACHE HIT [{}] {}", name, key);
            return cached;
        }

        misses.incrementAndGet();
        log.debug("CACHE MISS [{}] {}", name, key);
        V computed = Objects.requireNonNull(computation.get(), "Cached computations must not return null");

        synchronized (lock) {
            entries.put(key, computed);
        }
        return computed;
    }

    /**
     * Comprueba la presencia sin alterar el orden LRU.
     */
    public boolean contains(Observer observer, Instant instant) {
        CacheKey key = keyPolicy.keyFor(observer, instant);
        synchronized (lock) {
            return entries.containsKey(key);
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public void clear() {
        synchronized (lock) {
            entries.clear();
        }
        log.info("CACHE CLEARED [{}]", name);
    }

    public CacheStatsDTO stats() {
        return CacheStatsDTO.builder()
                .name(name)
                .size(size())
                .capacity(capacity)
                .hits(hits.get())
                .misses(misses.get())
                .evictions(evictions.get())
                .build();
    }
}
