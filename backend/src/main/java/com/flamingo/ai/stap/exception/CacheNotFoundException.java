package com.flamingo.ai.stap.exception;

/** Exception thrown when an admin request names a cache that is not registered. */
public class CacheNotFoundException extends RuntimeException {

  private final String cacheName;

  public CacheNotFoundException(String cacheName) {
    super("Cache not found: " + cacheName);
    this.cacheName = cacheName;
  }

  public String getCacheName() {
    return cacheName;
  }
}
