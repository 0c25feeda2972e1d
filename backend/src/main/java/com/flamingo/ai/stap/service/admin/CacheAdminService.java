package com.flamingo.ai.stap.service.admin;

import com.flamingo.ai.stap.service.cache.CacheStats;
import java.util.List;

/** Service interface for inspecting and invalidating the query caches. */
public interface CacheAdminService {

  /**
   * Gets statistics for every registered cache, ordered by name.
   *
   * @return one snapshot per cache
   */
  List<CacheStats> getAllStats();

  /**
   * Gets statistics for one cache.
   *
   * @param cacheName the cache name
   * @return the cache statistics
   * @throws com.flamingo.ai.stap.exception.CacheNotFoundException if no cache has that name
   */
  CacheStats getStats(String cacheName);

  /**
   * Removes every entry from one cache, e.g. after a manual "clear cache" action.
   *
   * @param cacheName the cache name
   * @throws com.flamingo.ai.stap.exception.CacheNotFoundException if no cache has that name
   */
  void clear(String cacheName);

  /** Removes every entry from every cache, e.g. on logout. */
  void clearAll();
}
