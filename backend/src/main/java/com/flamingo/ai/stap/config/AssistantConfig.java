package com.flamingo.ai.stap.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the query caches and the conversation context manager. */
@Configuration
@ConfigurationProperties(prefix = "assistant")
@Getter
@Setter
public class AssistantConfig {

  private Cache cache = new Cache();
  private Context context = new Context();

  @Getter
  @Setter
  public static class Cache {
    /** Search result cache used by the profile search feature. */
    private CacheSettings search = new CacheSettings(100, Duration.ofMinutes(5), 10);

    /** AI assistant response cache for frequently asked questions. */
    private CacheSettings chat = new CacheSettings(50, Duration.ofHours(24), 10);

    /** How often expired entries are swept from every cache. */
    private Duration cleanupInterval = Duration.ofMinutes(5);
  }

  /** Settings for a single {@code QueryCache}. */
  @Getter
  @Setter
  @NoArgsConstructor
  @AllArgsConstructor
  public static class CacheSettings {
    private int maxEntries = 100;
    private Duration ttl = Duration.ofMinutes(5);

    /** Number of slots freed at once when the cache is full. */
    private int batchEvictionSize = 10;
  }

  @Getter
  @Setter
  public static class Context {
    /** Number of most recent messages kept verbatim (W). */
    private int windowSize = 10;

    /** Maximum number of earlier user questions listed in a summary (N). */
    private int maxRecentQuestions = 3;

    /** Character budget per listed question before it is cut and marked with "...". */
    private int questionCharLimit = 100;

    /**
     * Topic vocabulary, matched case-insensitively against user messages. Order is the order
     * labels appear in the summary.
     */
    private List<Topic> topics = defaultTopics();
  }

  @Getter
  @Setter
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Topic {
    private String label;
    private String pattern;
  }

  private static List<Topic> defaultTopics() {
    List<Topic> topics = new ArrayList<>();
    topics.add(new Topic("Staff/Lecturers", "staff|pensyarah|lecturer"));
    topics.add(new Topic("Academic Programmes", "program|course|kursus"));
    topics.add(new Topic("Research", "research|penyelidikan"));
    topics.add(new Topic("Contact Details", "contact|telefon|email"));
    topics.add(new Topic("Departments", "jabatan|department"));
    return topics;
  }
}
