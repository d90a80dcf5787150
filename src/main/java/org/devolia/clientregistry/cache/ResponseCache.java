package org.devolia.clientregistry.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide cache of read projections, keyed by {@link CacheKey}.
 *
 * <p>Contract: after {@link #invalidate(CacheKey)} the next {@link #get(CacheKey)} for that key
 * returns empty until the next successful write.
 *
 * <p>Readers that miss go through {@link #load(CacheKey, Supplier)}. While a load is in flight
 * its key carries a guard with a generation number that every invalidation bumps. If a write
 * invalidated the key while the store query ran, the loaded value is returned to the caller but
 * not cached, so a value read before a delete can never be cached after that delete's
 * invalidation. The guard is dropped when the last load of the key finishes, so guards exist
 * only for keys with loads in flight.
 *
 * <p>Instances are independent; the registry owns one and passes it to the service.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class ResponseCache {

  private static final Logger logger = LoggerFactory.getLogger(ResponseCache.class);

  private final Cache<CacheKey<?>, CachedResponse> cache;

  // Guard updates and cache writes for a key run inside compute() on this map, so they are
  // serialized per key.
  private final ConcurrentMap<CacheKey<?>, LoadGuard> guards = new ConcurrentHashMap<>();

  /**
   * Constructor building the backing cache from configuration.
   *
   * @param cacheConfig cache configuration
   */
  public ResponseCache(CacheConfig cacheConfig) {
    this(cacheConfig.buildCache());
  }

  /**
   * Constructor over an existing Caffeine cache.
   *
   * @param cache the backing cache
   */
  public ResponseCache(Cache<CacheKey<?>, CachedResponse> cache) {
    this.cache = Objects.requireNonNull(cache, "cache cannot be null");
  }

  /**
   * Looks up a cached projection.
   *
   * @param key the cache key
   * @param <T> the cached value type
   * @return the cached value, or empty when absent, expired or invalidated
   */
  public <T> Optional<T> get(CacheKey<T> key) {
    CachedResponse cached = cache.getIfPresent(key);
    if (cached == null) {
      logger.debug("Cache miss: {}", key);
      return Optional.empty();
    }
    logger.debug("Cache hit: {} (cached at {})", key, cached.getCachedAt());
    return Optional.of(key.read(cached.getValue()));
  }

  /**
   * Stores a projection unconditionally.
   *
   * @param key the cache key
   * @param value the immutable projection
   * @param <T> the cached value type
   */
  public <T> void set(CacheKey<T> key, T value) {
    Objects.requireNonNull(value, "value cannot be null");
    guards.compute(
        key,
        (k, guard) -> {
          cache.put(k, new CachedResponse(value));
          return guard;
        });
    logger.debug("Cached: {}", key);
  }

  /**
   * Loads a projection from the store and caches it, unless the key is invalidated while the
   * loader runs. Failures of the loader propagate and cache nothing.
   *
   * @param key the cache key
   * @param loader the store query; must not return null
   * @param <T> the cached value type
   * @return the loaded value, whether or not it was cached
   */
  public <T> T load(CacheKey<T> key, Supplier<T> loader) {
    long generation = enterLoad(key);
    try {
      T value = Objects.requireNonNull(loader.get(), "loaded value cannot be null");
      publishIfCurrent(key, value, generation);
      return value;
    } finally {
      exitLoad(key);
    }
  }

  private long enterLoad(CacheKey<?> key) {
    long[] generation = new long[1];
    guards.compute(
        key,
        (k, current) -> {
          LoadGuard entered = current != null ? current : new LoadGuard();
          entered.inFlight++;
          generation[0] = entered.generation;
          return entered;
        });
    return generation[0];
  }

  private <T> void publishIfCurrent(CacheKey<T> key, T value, long generation) {
    boolean[] stored = new boolean[1];
    guards.computeIfPresent(
        key,
        (k, guard) -> {
          if (guard.generation == generation) {
            cache.put(k, new CachedResponse(value));
            stored[0] = true;
          }
          return guard;
        });

    if (stored[0]) {
      logger.debug("Cached: {}", key);
    } else {
      logger.debug("Dropped load for {} invalidated during the query", key);
    }
  }

  private void exitLoad(CacheKey<?> key) {
    guards.computeIfPresent(
        key,
        (k, guard) -> {
          guard.inFlight--;
          return guard.inFlight > 0 ? guard : null;
        });
  }

  /**
   * Invalidates a key. Loads of the key in flight will not cache their result.
   *
   * @param key the cache key
   */
  public void invalidate(CacheKey<?> key) {
    guards.compute(
        key,
        (k, guard) -> {
          cache.invalidate(k);
          if (guard != null) {
            guard.generation++;
          }
          return guard;
        });
    logger.debug("Invalidated: {}", key);
  }

  /** Invalidates every cached projection and every load in flight. */
  public void invalidateAll() {
    Set<CacheKey<?>> keys = new HashSet<>(cache.asMap().keySet());
    keys.addAll(guards.keySet());
    keys.forEach(this::invalidate);
    logger.debug("Cleared response cache ({} keys)", keys.size());
  }

  /**
   * Gets the approximate number of cached projections.
   *
   * @return estimated entry count
   */
  public long size() {
    return cache.estimatedSize();
  }

  /**
   * Gets the number of keys with a load in flight.
   *
   * @return guarded key count
   */
  int loadsInFlight() {
    return guards.size();
  }

  /**
   * Gets the Caffeine statistics for this cache.
   *
   * @return cache statistics
   */
  public CacheStats stats() {
    return cache.stats();
  }

  /** Per-key load state. Only mutated inside compute() on the guard map. */
  private static final class LoadGuard {
    private long generation;
    private int inFlight;
  }
}
