package org.devolia.clientregistry.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration and factory for the response cache.
 *
 * <p>The core only requires that invalidated keys read as absent. Expiry and size bounds are
 * supplied here by Caffeine:
 *
 * <ul>
 *   <li>Time-based expiration (TTL) - configurable, default 300 seconds
 *   <li>Size-based eviction - configurable, default 1000 entries
 * </ul>
 *
 * @author Devolia
 * @since 1.0.0
 */
public class CacheConfig {

  private static final Logger logger = LoggerFactory.getLogger(CacheConfig.class);

  public static final int DEFAULT_CACHE_TTL = 300;
  public static final int DEFAULT_CACHE_MAX = 1000;

  private final int cacheTtl;
  private final int cacheMaxSize;

  /**
   * Constructor with configuration values.
   *
   * @param cacheTtl cache TTL in seconds
   * @param cacheMaxSize maximum number of cache entries
   */
  public CacheConfig(int cacheTtl, int cacheMaxSize) {
    this.cacheTtl = cacheTtl;
    this.cacheMaxSize = cacheMaxSize;

    logger.debug(
        "Cache configuration initialized - TTL: {}s, Max size: {}", cacheTtl, cacheMaxSize);
  }

  /**
   * Creates configuration with default values.
   *
   * @return default cache configuration
   */
  public static CacheConfig defaultConfig() {
    return new CacheConfig(DEFAULT_CACHE_TTL, DEFAULT_CACHE_MAX);
  }

  /**
   * Builds and configures the Caffeine cache for response projections.
   *
   * @return configured cache instance
   */
  public Cache<CacheKey<?>, CachedResponse> buildCache() {
    Cache<CacheKey<?>, CachedResponse> cache =
        Caffeine.newBuilder()
            .maximumSize(cacheMaxSize)
            .expireAfterWrite(Duration.ofSeconds(cacheTtl))
            .recordStats()
            .build();

    logger.info("Built response cache with TTL: {}s, Max size: {}", cacheTtl, cacheMaxSize);
    return cache;
  }

  public int getCacheTtl() {
    return cacheTtl;
  }

  public int getCacheMaxSize() {
    return cacheMaxSize;
  }

  /**
   * Validates the cache configuration.
   *
   * @throws IllegalArgumentException if configuration is invalid
   */
  public void validate() {
    if (cacheTtl <= 0) {
      throw new IllegalArgumentException("Cache TTL must be positive: " + cacheTtl);
    }

    if (cacheMaxSize <= 0) {
      throw new IllegalArgumentException("Cache max size must be positive: " + cacheMaxSize);
    }

    logger.debug("Cache configuration validation passed");
  }
}
