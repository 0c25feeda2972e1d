package com.flamingo.ai.stap.config;

import com.flamingo.ai.stap.service.cache.QueryCache;
import com.flamingo.ai.stap.service.context.ConversationContextManager;
import com.flamingo.ai.stap.service.context.KeywordConversationSummarizer;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the caches and the context manager as explicitly constructed, injectable instances. Their
 * lifecycle is the application context's.
 */
@Configuration
@RequiredArgsConstructor
public class CacheConfig {

  public static final String SEARCH_CACHE = "search";
  public static final String CHAT_CACHE = "chat";

  private final AssistantConfig assistantConfig;

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /** Search results keyed by normalized search query. */
  @Bean
  public QueryCache<Object> searchResultCache(Clock clock, MeterRegistry meterRegistry) {
    return new QueryCache<>(
        SEARCH_CACHE, assistantConfig.getCache().getSearch(), clock, meterRegistry);
  }

  /** Assistant replies keyed by normalized user question. */
  @Bean
  public QueryCache<String> chatResponseCache(Clock clock, MeterRegistry meterRegistry) {
    return new QueryCache<>(CHAT_CACHE, assistantConfig.getCache().getChat(), clock, meterRegistry);
  }

  @Bean
  public KeywordConversationSummarizer conversationSummarizer() {
    return new KeywordConversationSummarizer(assistantConfig.getContext());
  }

  @Bean
  public ConversationContextManager conversationContextManager(
      KeywordConversationSummarizer conversationSummarizer, MeterRegistry meterRegistry) {
    return new ConversationContextManager(
        assistantConfig.getContext().getWindowSize(), conversationSummarizer, meterRegistry);
  }
}
