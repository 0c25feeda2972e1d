package com.flamingo.ai.stap.service.context;

import com.flamingo.ai.stap.config.AssistantConfig;
import com.flamingo.ai.stap.exception.InvalidConfigurationException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Ordered mapping of match patterns to human-readable topic labels. Patterns are regular
 * expressions matched case-insensitively anywhere in a message.
 */
public final class TopicVocabulary {

  private final List<TopicRule> rules;

  private TopicVocabulary(List<TopicRule> rules) {
    this.rules = List.copyOf(rules);
  }

  /** A vocabulary that never matches. */
  public static TopicVocabulary empty() {
    return new TopicVocabulary(List.of());
  }

  /**
   * Compiles the configured topics.
   *
   * @param topics label/pattern pairs, in output order
   * @return the compiled vocabulary
   * @throws InvalidConfigurationException if a label is blank or a pattern does not compile
   */
  public static TopicVocabulary of(Collection<AssistantConfig.Topic> topics) {
    List<TopicRule> rules = new ArrayList<>();
    int index = 0;
    for (AssistantConfig.Topic topic : topics) {
      String property = "assistant.context.topics[" + index++ + "]";
      if (topic.getLabel() == null || topic.getLabel().isBlank()) {
        throw new InvalidConfigurationException(property + ".label", "must not be blank");
      }
      if (topic.getPattern() == null || topic.getPattern().isBlank()) {
        throw new InvalidConfigurationException(property + ".pattern", "must not be blank");
      }
      try {
        rules.add(
            new TopicRule(
                topic.getLabel(),
                Pattern.compile(
                    topic.getPattern(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)));
      } catch (PatternSyntaxException e) {
        throw new InvalidConfigurationException(
            property + ".pattern", "not a valid regular expression: " + e.getDescription(), e);
      }
    }
    return new TopicVocabulary(rules);
  }

  /** Returns the distinct labels matching any of the given texts, in vocabulary order. */
  public Set<String> match(Collection<String> texts) {
    Set<String> labels = new LinkedHashSet<>();
    for (TopicRule rule : rules) {
      for (String text : texts) {
        if (rule.pattern().matcher(text).find()) {
          labels.add(rule.label());
          break;
        }
      }
    }
    return labels;
  }

  private record TopicRule(String label, Pattern pattern) {}
}
