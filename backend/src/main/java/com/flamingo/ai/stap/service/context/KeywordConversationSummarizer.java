package com.flamingo.ai.stap.service.context;

import com.flamingo.ai.stap.config.AssistantConfig;
import com.flamingo.ai.stap.domain.model.ConversationMessage;
import com.flamingo.ai.stap.exception.InvalidConfigurationException;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Summarizes older turns without calling a model: tags the slice with the topics found in user
 * messages and lists the latest user questions.
 *
 * <p>Output shape:
 *
 * <pre>
 * Previous conversation summary:
 * Topics discussed: Staff/Lecturers, Research
 * Earlier questions:
 * - who teaches data mining?
 * - ...
 * </pre>
 *
 * Either section is omitted when empty; with both empty only the header line is returned. Pure:
 * the same messages always produce the same text.
 */
public class KeywordConversationSummarizer implements ConversationSummarizer {

  static final String HEADER = "Previous conversation summary:";
  static final String TOPICS_LABEL = "Topics discussed: ";
  static final String QUESTIONS_LABEL = "Earlier questions:";
  static final String ELLIPSIS = "...";

  private final TopicVocabulary vocabulary;
  private final int maxRecentQuestions;
  private final int questionCharLimit;

  public KeywordConversationSummarizer(AssistantConfig.Context config) {
    this(
        TopicVocabulary.of(config.getTopics()),
        config.getMaxRecentQuestions(),
        config.getQuestionCharLimit());
  }

  public KeywordConversationSummarizer(
      TopicVocabulary vocabulary, int maxRecentQuestions, int questionCharLimit) {
    if (maxRecentQuestions <= 0) {
      throw new InvalidConfigurationException(
          "assistant.context.max-recent-questions",
          "must be positive but was " + maxRecentQuestions);
    }
    if (questionCharLimit <= 0) {
      throw new InvalidConfigurationException(
          "assistant.context.question-char-limit",
          "must be positive but was " + questionCharLimit);
    }
    this.vocabulary = vocabulary;
    this.maxRecentQuestions = maxRecentQuestions;
    this.questionCharLimit = questionCharLimit;
  }

  @Override
  public String summarize(List<ConversationMessage> messages) {
    List<String> userContent =
        messages.stream()
            .filter(ConversationMessage::isFromUser)
            .map(ConversationMessage::content)
            .collect(Collectors.toList());

    Set<String> topics = vocabulary.match(userContent);
    List<String> questions =
        userContent.stream()
            .skip(Math.max(0, userContent.size() - maxRecentQuestions))
            .map(this::shorten)
            .collect(Collectors.toList());

    StringBuilder summary = new StringBuilder(HEADER);
    if (!topics.isEmpty()) {
      summary.append('\n').append(TOPICS_LABEL).append(String.join(", ", topics));
    }
    if (!questions.isEmpty()) {
      summary.append('\n').append(QUESTIONS_LABEL);
      for (String question : questions) {
        summary.append("\n- ").append(question);
      }
    }
    return summary.toString();
  }

  private String shorten(String content) {
    String text = content.strip();
    if (text.length() <= questionCharLimit) {
      return text;
    }
    int end = questionCharLimit;
    if (Character.isHighSurrogate(text.charAt(end - 1))) {
      end--;
    }
    return text.substring(0, end) + ELLIPSIS;
  }
}
