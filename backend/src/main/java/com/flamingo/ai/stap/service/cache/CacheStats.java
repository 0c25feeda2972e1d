package com.flamingo.ai.stap.service.cache;

import java.time.Duration;
import lombok.Builder;

/** Point-in-time statistics for a single {@link QueryCache}. */
@Builder
public record CacheStats(
    String name,
    int size,
    int maxEntries,
    long hits,
    long misses,
    long evictions,
    long expirations,
    Duration ttl) {

  /** Total number of lookups served, hits plus misses. */
  public long totalLookups() {
    return hits + misses;
  }

  /** Hit rate as a percentage in [0, 100], rounded to two decimals; 0 before any lookup. */
  public double hitRate() {
    long total = totalLookups();
    if (total == 0) {
      return 0.0;
    }
    return Math.round(hits * 10000.0 / total) / 100.0;
  }
}
