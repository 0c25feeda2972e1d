package com.flamingo.ai.stap.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.stap.api.rest.CacheAdminController;
import com.flamingo.ai.stap.api.rest.ConversationContextController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests pinning the controller base paths used by the mobile app and the web dashboard:
 *
 * <ul>
 *   <li>GET /api/caches - List cache statistics
 *   <li>GET /api/caches/{name} - Get one cache's statistics
 *   <li>DELETE /api/caches/{name} - Clear one cache
 *   <li>DELETE /api/caches - Clear all caches
 *   <li>POST /api/conversations/{conversationId}/context - Build conversation context
 * </ul>
 */
class ApiContractTest {

  @Nested
  @DisplayName("CacheAdminController API contract")
  class CacheAdminControllerContract {

    @Test
    @DisplayName("should be mapped to /api/caches")
    void shouldBeMappedToApiCaches() {
      RequestMapping mapping = CacheAdminController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/caches");
    }
  }

  @Nested
  @DisplayName("ConversationContextController API contract")
  class ConversationContextControllerContract {

    @Test
    @DisplayName("should be mapped to /api/conversations/{conversationId}")
    void shouldBeMappedToApiConversationsWithId() {
      RequestMapping mapping =
          ConversationContextController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/conversations/{conversationId}");
    }
  }
}
