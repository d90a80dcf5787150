package org.devolia.clientregistry.cache;

import java.time.OffsetDateTime;

/**
 * Wrapper for a cached response projection with the time it was cached.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class CachedResponse {

  private final Object value;
  private final OffsetDateTime cachedAt;

  /**
   * Constructor for a cached projection.
   *
   * @param value the immutable projection to cache
   */
  public CachedResponse(Object value) {
    this.value = value;
    this.cachedAt = OffsetDateTime.now();
  }

  /**
   * Gets the cached projection.
   *
   * @return the cached value
   */
  public Object getValue() {
    return value;
  }

  /**
   * Gets when this projection was cached.
   *
   * @return the cache timestamp
   */
  public OffsetDateTime getCachedAt() {
    return cachedAt;
  }
}
