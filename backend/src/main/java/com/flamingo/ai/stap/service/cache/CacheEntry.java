package com.flamingo.ai.stap.service.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * A single cached value together with its insertion time.
 *
 * <p>The TTL is cache-wide, so expiry is evaluated against the owning cache's TTL rather than
 * stored per entry.
 *
 * @param key normalized query the value is stored under
 * @param value cached payload, never mutated after insertion
 * @param createdAt when the entry was stored
 * @param <V> payload type
 */
public record CacheEntry<V>(String key, V value, Instant createdAt) {

  /**
   * Returns whether this entry has outlived the given TTL.
   *
   * @param now current time
   * @param ttl cache-wide time to live
   * @return true if {@code now - createdAt > ttl}
   */
  public boolean isExpired(Instant now, Duration ttl) {
    return Duration.between(createdAt, now).compareTo(ttl) > 0;
  }

  /** Age of the entry at {@code now}. */
  public Duration age(Instant now) {
    return Duration.between(createdAt, now);
  }
}
