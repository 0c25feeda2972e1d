package com.flamingo.ai.stap.service.cache;

import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically sweeps expired entries out of every registered cache, so entries that are never
 * looked up again do not hold capacity until eviction.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CacheMaintenanceScheduler {

  private final List<QueryCache<?>> caches;

  /**
   * Purges expired entries from all caches.
   *
   * @return total number of entries removed
   */
  @Scheduled(
      fixedDelayString = "${assistant.cache.cleanup-interval:PT5M}",
      initialDelayString = "${assistant.cache.cleanup-interval:PT5M}")
  public int purgeExpiredEntries() {
    int removed = 0;
    for (QueryCache<?> cache : caches) {
      removed += cache.purgeExpired();
    }
    if (removed > 0) {
      log.debug("Expired-entry sweep removed {} entries across {} caches", removed, caches.size());
    }
    return removed;
  }
}
