package com.flamingo.ai.stap.service.admin;

import com.flamingo.ai.stap.exception.CacheNotFoundException;
import com.flamingo.ai.stap.service.cache.CacheStats;
import com.flamingo.ai.stap.service.cache.QueryCache;
import io.micrometer.core.annotation.Timed;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of CacheAdminService over all {@link QueryCache} beans. */
@Service
@RequiredArgsConstructor
@Slf4j
public class CacheAdminServiceImpl implements CacheAdminService {

  private final List<QueryCache<?>> caches;

  @Override
  @Timed(value = "cache.admin.stats", description = "Time to collect cache statistics")
  public List<CacheStats> getAllStats() {
    return caches.stream()
        .map(QueryCache::stats)
        .sorted(Comparator.comparing(CacheStats::name))
        .toList();
  }

  @Override
  public CacheStats getStats(String cacheName) {
    return findCache(cacheName).stats();
  }

  @Override
  public void clear(String cacheName) {
    findCache(cacheName).clear();
  }

  @Override
  public void clearAll() {
    caches.forEach(QueryCache::clear);
    log.info("All {} caches cleared", caches.size());
  }

  private QueryCache<?> findCache(String cacheName) {
    return caches.stream()
        .filter(cache -> cache.getName().equals(cacheName))
        .findFirst()
        .orElseThrow(() -> new CacheNotFoundException(cacheName));
  }
}
