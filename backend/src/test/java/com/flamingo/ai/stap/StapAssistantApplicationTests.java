package com.flamingo.ai.stap;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.stap.service.admin.CacheAdminService;
import com.flamingo.ai.stap.service.cache.CacheStats;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

/** Loads the full application context with the packaged application.yml. */
@SpringBootTest
class StapAssistantApplicationTests {

  @Autowired private CacheAdminService cacheAdminService;

  @Test
  void contextLoads() {
    assertThat(cacheAdminService.getAllStats())
        .extracting(CacheStats::name)
        .containsExactly("chat", "search");
  }
}
