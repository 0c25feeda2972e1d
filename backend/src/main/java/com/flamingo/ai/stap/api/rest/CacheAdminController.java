package com.flamingo.ai.stap.api.rest;

import com.flamingo.ai.stap.api.dto.response.CacheStatsResponse;
import com.flamingo.ai.stap.service.admin.CacheAdminService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for cache statistics and invalidation. */
@RestController
@RequestMapping("/api/caches")
@RequiredArgsConstructor
@Slf4j
public class CacheAdminController {

  private final CacheAdminService cacheAdminService;

  /** Lists statistics for every cache. */
  @GetMapping
  public ResponseEntity<List<CacheStatsResponse>> listCaches() {
    List<CacheStatsResponse> response =
        cacheAdminService.getAllStats().stream().map(CacheStatsResponse::fromStats).toList();
    return ResponseEntity.ok(response);
  }

  /**
   * Gets statistics for a single cache.
   *
   * @param cacheName the cache name
   * @return the cache statistics
   */
  @GetMapping("/{cacheName}")
  public ResponseEntity<CacheStatsResponse> getCache(@PathVariable String cacheName) {
    return ResponseEntity.ok(CacheStatsResponse.fromStats(cacheAdminService.getStats(cacheName)));
  }

  /**
   * Clears a single cache.
   *
   * @param cacheName the cache name
   * @return no content
   */
  @DeleteMapping("/{cacheName}")
  public ResponseEntity<Void> clearCache(@PathVariable String cacheName) {
    log.info("Clearing cache '{}' on request", cacheName);
    cacheAdminService.clear(cacheName);
    return ResponseEntity.noContent().build();
  }

  /** Clears every cache. */
  @DeleteMapping
  public ResponseEntity<Void> clearAllCaches() {
    cacheAdminService.clearAll();
    return ResponseEntity.noContent().build();
  }
}
