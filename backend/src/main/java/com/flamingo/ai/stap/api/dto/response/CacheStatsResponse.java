package com.flamingo.ai.stap.api.dto.response;

import com.flamingo.ai.stap.service.cache.CacheStats;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** DTO for a single cache's statistics. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatsResponse {
  private String name;
  private int size;
  private int maxEntries;
  private long hits;
  private long misses;
  private long evictions;
  private long expirations;
  private long totalLookups;
  private double hitRate;
  private long ttlSeconds;

  public static CacheStatsResponse fromStats(CacheStats stats) {
    return CacheStatsResponse.builder()
        .name(stats.name())
        .size(stats.size())
        .maxEntries(stats.maxEntries())
        .hits(stats.hits())
        .misses(stats.misses())
        .evictions(stats.evictions())
        .expirations(stats.expirations())
        .totalLookups(stats.totalLookups())
        .hitRate(stats.hitRate())
        .ttlSeconds(stats.ttl().toSeconds())
        .build();
  }
}
