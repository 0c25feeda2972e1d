package com.flamingo.ai.stap.service.context;

import com.flamingo.ai.stap.domain.model.ConversationMessage;
import com.flamingo.ai.stap.exception.InvalidConfigurationException;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps the conversation history passed to the assistant within a fixed window.
 *
 * <p>Sliding window strategy: the last {@code windowSize} messages are kept verbatim and everything
 * before them is reduced to a summary by the configured {@link ConversationSummarizer}.
 *
 * <p>Stateless: the caller owns the message log and passes the full history on every call, and the
 * summary is recomputed from it each time. This assumes short histories. Unbounded logs would need
 * an incremental summary kept per conversation instead.
 */
@Slf4j
public class ConversationContextManager {

  private final int windowSize;
  private final ConversationSummarizer summarizer;
  private final MeterRegistry meterRegistry;

  public ConversationContextManager(
      int windowSize, ConversationSummarizer summarizer, MeterRegistry meterRegistry) {
    if (windowSize <= 0) {
      throw new InvalidConfigurationException(
          "assistant.context.window-size", "must be positive but was " + windowSize);
    }
    this.windowSize = windowSize;
    this.summarizer = summarizer;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Summarizes the part of the history that no longer fits in the window.
   *
   * @param conversationId conversation the history belongs to, used for logging only
   * @param messages full ordered history, oldest first; not modified
   * @return the summary of {@code messages[0 .. size - windowSize)}, or empty when the history fits
   *     in the window and should be sent as is
   */
  public Optional<String> appendAndSummarizeIfNeeded(
      String conversationId, List<ConversationMessage> messages) {
    if (messages == null || messages.size() <= windowSize) {
      return Optional.empty();
    }

    List<ConversationMessage> overflow = messages.subList(0, messages.size() - windowSize);
    String summary = summarizer.summarize(overflow);
    meterRegistry.counter("conversation.context.summaries").increment();

    log.debug(
        "Summarized {} older messages for conversation {} ({} chars)",
        overflow.size(),
        conversationId,
        summary.length());
    return Optional.of(summary);
  }

  /**
   * Splits a history into the summary of its overflow and the verbatim tail.
   *
   * @param conversationId conversation the history belongs to
   * @param messages full ordered history, oldest first
   * @return the context to send downstream
   */
  public ConversationContext buildContext(
      String conversationId, List<ConversationMessage> messages) {
    List<ConversationMessage> history = messages == null ? List.of() : messages;
    String summary = appendAndSummarizeIfNeeded(conversationId, history).orElse(null);
    List<ConversationMessage> recent =
        history.subList(Math.max(0, history.size() - windowSize), history.size());
    return new ConversationContext(summary, recent);
  }

  public int getWindowSize() {
    return windowSize;
  }
}
