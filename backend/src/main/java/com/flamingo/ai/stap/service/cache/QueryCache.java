package com.flamingo.ai.stap.service.cache;

import com.flamingo.ai.stap.config.AssistantConfig;
import com.flamingo.ai.stap.exception.InvalidConfigurationException;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Capacity-bounded, time-expiring memoization of {@code normalized query -> value}.
 *
 * <p>Keys are produced by {@link QueryNormalizer}. Entries expire once they are older than the
 * cache-wide TTL and are removed lazily by {@link #lookup(String)} or by {@link #purgeExpired()}.
 *
 * <p>When a store finds the cache at or over capacity it evicts the oldest entries (by creation
 * time) until at least {@code batchEvictionSize} slots are free, then inserts. Evicting in batches
 * keeps the cache from evicting on every single insert once it sits at the capacity boundary.
 *
 * <p>The cache never computes values itself. Callers look up, compute on a miss and store the
 * result only when the computation succeeded.
 *
 * <p>All operations are guarded by a single lock.
 *
 * @param <V> cached value type
 */
@Slf4j
public class QueryCache<V> {

  private static final String METRIC_PREFIX = "query.cache";

  private final String name;
  private final int maxEntries;
  private final Duration ttl;
  private final int batchEvictionSize;
  private final Clock clock;

  // insertion order == createdAt order, overwrites are re-inserted at the tail
  private final LinkedHashMap<String, CacheEntry<V>> entries = new LinkedHashMap<>();
  private final ReentrantLock lock = new ReentrantLock();

  private final Counter hitCounter;
  private final Counter missCounter;
  private final Counter evictionCounter;
  private final Counter expirationCounter;

  private long hits;
  private long misses;
  private long evictions;
  private long expirations;

  /**
   * Creates a cache from its configured settings.
   *
   * @param name cache name, used in logs and metric tags
   * @param settings capacity, TTL and eviction batch size
   * @param clock time source for entry creation and expiry checks
   * @param meterRegistry registry for hit/miss/eviction counters
   * @throws InvalidConfigurationException if the settings are out of range
   */
  public QueryCache(
      String name,
      AssistantConfig.CacheSettings settings,
      Clock clock,
      MeterRegistry meterRegistry) {
    this(
        name,
        settings.getMaxEntries(),
        settings.getTtl(),
        settings.getBatchEvictionSize(),
        clock,
        meterRegistry);
  }

  public QueryCache(
      String name,
      int maxEntries,
      Duration ttl,
      int batchEvictionSize,
      Clock clock,
      MeterRegistry meterRegistry) {
    if (name == null || name.isBlank()) {
      throw new InvalidConfigurationException("name", "cache name must not be blank");
    }
    if (maxEntries <= 0) {
      throw new InvalidConfigurationException(
          name + ".max-entries", "must be positive but was " + maxEntries);
    }
    if (ttl == null || ttl.isNegative()) {
      throw new InvalidConfigurationException(
          name + ".ttl", "must be zero or positive but was " + ttl);
    }
    if (batchEvictionSize <= 0) {
      throw new InvalidConfigurationException(
          name + ".batch-eviction-size", "must be positive but was " + batchEvictionSize);
    }
    this.name = name;
    this.maxEntries = maxEntries;
    this.ttl = ttl;
    this.batchEvictionSize = batchEvictionSize;
    this.clock = clock;

    this.hitCounter = lookupCounter(meterRegistry, "hit");
    this.missCounter = lookupCounter(meterRegistry, "miss");
    this.evictionCounter =
        Counter.builder(METRIC_PREFIX + ".evictions")
            .description("Entries evicted to make room for new ones")
            .tag("cache", name)
            .register(meterRegistry);
    this.expirationCounter =
        Counter.builder(METRIC_PREFIX + ".expirations")
            .description("Entries removed after their TTL elapsed")
            .tag("cache", name)
            .register(meterRegistry);
    Gauge.builder(METRIC_PREFIX + ".size", this, QueryCache::size)
        .description("Current number of cached entries")
        .tag("cache", name)
        .register(meterRegistry);

    log.info(
        "Query cache '{}' initialized: maxEntries={}, ttl={}, batchEvictionSize={}",
        name,
        maxEntries,
        ttl,
        batchEvictionSize);
  }

  /**
   * Looks up the value stored for a query.
   *
   * <p>An entry that is present but expired counts as a miss and is removed.
   *
   * @param rawQuery query as typed by the caller, {@code null} is treated as {@code ""}
   * @return the cached value, or empty on a miss
   */
  public Optional<V> lookup(String rawQuery) {
    String key = QueryNormalizer.normalize(rawQuery);
    lock.lock();
    try {
      CacheEntry<V> entry = entries.get(key);
      if (entry == null) {
        recordMiss();
        log.debug("Cache MISS [{}]: '{}'", name, key);
        return Optional.empty();
      }

      Instant now = clock.instant();
      if (entry.isExpired(now, ttl)) {
        entries.remove(key);
        expirations++;
        expirationCounter.increment();
        recordMiss();
        log.debug("Cache EXPIRED [{}]: '{}' (age: {})", name, key, entry.age(now));
        return Optional.empty();
      }

      hits++;
      hitCounter.increment();
      log.debug("Cache HIT [{}]: '{}' (age: {})", name, key, entry.age(now));
      return Optional.of(entry.value());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Stores a value for a query, replacing and re-timestamping any existing entry for the same key.
   *
   * <p>If the cache is at or over capacity, the oldest entries are evicted first until {@code
   * batchEvictionSize} slots are free. A query that normalizes to {@code ""} is stored like any
   * other key; callers that want to skip degenerate queries must do so themselves.
   *
   * @param rawQuery query as typed by the caller, {@code null} is treated as {@code ""}
   * @param value value to cache
   */
  public void store(String rawQuery, V value) {
    String key = QueryNormalizer.normalize(rawQuery);
    lock.lock();
    try {
      if (entries.size() >= maxEntries) {
        evictOldest();
      }
      entries.remove(key);
      entries.put(key, new CacheEntry<>(key, value, clock.instant()));
      log.debug("Cache SET [{}]: '{}' (size: {})", name, key, entries.size());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes the entry for a single query.
   *
   * @param rawQuery query as typed by the caller, {@code null} is treated as {@code ""}
   * @return true if an entry was removed
   */
  public boolean invalidate(String rawQuery) {
    String key = QueryNormalizer.normalize(rawQuery);
    lock.lock();
    try {
      boolean removed = entries.remove(key) != null;
      if (removed) {
        log.debug("Cache DELETE [{}]: '{}'", name, key);
      }
      return removed;
    } finally {
      lock.unlock();
    }
  }

  /** Removes every entry. Idempotent. */
  public void clear() {
    lock.lock();
    try {
      int count = entries.size();
      entries.clear();
      log.info("Cache CLEARED [{}]: {} entries removed", name, count);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes all entries whose TTL has elapsed.
   *
   * @return number of entries removed
   */
  public int purgeExpired() {
    lock.lock();
    try {
      Instant now = clock.instant();
      int removed = 0;
      Iterator<CacheEntry<V>> it = entries.values().iterator();
      while (it.hasNext()) {
        if (it.next().isExpired(now, ttl)) {
          it.remove();
          removed++;
        }
      }
      if (removed > 0) {
        expirations += removed;
        expirationCounter.increment(removed);
        log.info("Cache CLEANUP [{}]: {} expired entries removed", name, removed);
      }
      return removed;
    } finally {
      lock.unlock();
    }
  }

  /** Current number of entries, including expired ones not yet removed. */
  public int size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  public String getName() {
    return name;
  }

  /** Returns a consistent snapshot of this cache's counters. */
  public CacheStats stats() {
    lock.lock();
    try {
      return CacheStats.builder()
          .name(name)
          .size(entries.size())
          .maxEntries(maxEntries)
          .hits(hits)
          .misses(misses)
          .evictions(evictions)
          .expirations(expirations)
          .ttl(ttl)
          .build();
    } finally {
      lock.unlock();
    }
  }

  /** Keys in creation order, oldest first. */
  @VisibleForTesting
  List<String> keysOldestFirst() {
    lock.lock();
    try {
      return new ArrayList<>(entries.keySet());
    } finally {
      lock.unlock();
    }
  }

  private void evictOldest() {
    int target = Math.max(0, maxEntries - batchEvictionSize);
    int toEvict = entries.size() - target;
    Iterator<Map.Entry<String, CacheEntry<V>>> it = entries.entrySet().iterator();
    int evicted = 0;
    while (evicted < toEvict && it.hasNext()) {
      String evictedKey = it.next().getKey();
      it.remove();
      evicted++;
      log.debug("Cache EVICT [{}]: '{}'", name, evictedKey);
    }
    evictions += evicted;
    evictionCounter.increment(evicted);
  }

  private void recordMiss() {
    misses++;
    missCounter.increment();
  }

  private Counter lookupCounter(MeterRegistry meterRegistry, String result) {
    return Counter.builder(METRIC_PREFIX + ".lookups")
        .description("Cache lookups by outcome")
        .tag("cache", name)
        .tag("result", result)
        .register(meterRegistry);
  }
}
