package com.flamingo.ai.stap.service.cache;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.stap.testsupport.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CacheMaintenanceSchedulerTest {

  @Test
  @DisplayName("should purge expired entries from every cache")
  void shouldPurgeAllCaches() {
    MutableClock clock = MutableClock.startingAt("2024-03-01T08:00:00Z");
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    QueryCache<String> shortLived =
        new QueryCache<>("short", 10, Duration.ofMinutes(1), 2, clock, registry);
    QueryCache<String> longLived =
        new QueryCache<>("long", 10, Duration.ofHours(1), 2, clock, registry);
    shortLived.store("a", "1");
    shortLived.store("b", "2");
    longLived.store("c", "3");
    clock.advance(Duration.ofMinutes(5));

    CacheMaintenanceScheduler scheduler =
        new CacheMaintenanceScheduler(List.of(shortLived, longLived));

    assertThat(scheduler.purgeExpiredEntries()).isEqualTo(2);
    assertThat(shortLived.size()).isZero();
    assertThat(longLived.size()).isEqualTo(1);
    assertThat(scheduler.purgeExpiredEntries()).isZero();
  }
}
