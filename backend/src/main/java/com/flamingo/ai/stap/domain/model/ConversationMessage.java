package com.flamingo.ai.stap.domain.model;

import com.flamingo.ai.stap.domain.enums.MessageRole;
import java.time.Instant;
import java.util.Objects;

/**
 * One turn of a conversation as held in the caller-owned message log.
 *
 * @param role who authored the message
 * @param content message text, never {@code null}
 * @param timestamp when the message was sent, may be {@code null} if the caller does not track it
 */
public record ConversationMessage(MessageRole role, String content, Instant timestamp) {

  public ConversationMessage {
    Objects.requireNonNull(role, "role");
    content = content == null ? "" : content;
  }

  public static ConversationMessage user(String content, Instant timestamp) {
    return new ConversationMessage(MessageRole.USER, content, timestamp);
  }

  public static ConversationMessage assistant(String content, Instant timestamp) {
    return new ConversationMessage(MessageRole.ASSISTANT, content, timestamp);
  }

  public boolean isFromUser() {
    return role == MessageRole.USER;
  }
}
