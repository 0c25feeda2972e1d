package com.flamingo.ai.stap.service.context;

import com.flamingo.ai.stap.domain.model.ConversationMessage;
import java.util.List;

/**
 * What a caller sends downstream for one request: an optional summary of the older turns and the
 * turns kept verbatim.
 *
 * @param summary summary of the overflow, {@code null} when the history fits in the window
 * @param recentMessages the newest messages, at most the window size, oldest first
 */
public record ConversationContext(String summary, List<ConversationMessage> recentMessages) {

  public ConversationContext {
    recentMessages = List.copyOf(recentMessages);
  }

  public boolean isSummarized() {
    return summary != null;
  }
}
