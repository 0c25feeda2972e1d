package com.flamingo.ai.stap.service.context;

import com.flamingo.ai.stap.domain.model.ConversationMessage;
import java.util.List;

/** Reduces a slice of older conversation turns to a compact text summary. */
public interface ConversationSummarizer {

  /**
   * Summarizes the given messages.
   *
   * @param messages the overflow slice, oldest first; never empty
   * @return the summary, never {@code null}
   */
  String summarize(List<ConversationMessage> messages);
}
