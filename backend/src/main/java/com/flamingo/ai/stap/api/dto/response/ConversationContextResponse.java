package com.flamingo.ai.stap.api.dto.response;

import com.flamingo.ai.stap.domain.enums.MessageRole;
import com.flamingo.ai.stap.domain.model.ConversationMessage;
import com.flamingo.ai.stap.service.context.ConversationContext;
import java.time.Instant;
import java.util.List;

/**
 * Response DTO for a computed conversation context.
 *
 * @param conversationId the conversation
 * @param summarized whether older turns were folded into {@code summary}
 * @param summary summary of older turns, {@code null} when not summarized
 * @param recentMessages turns to send verbatim
 */
public record ConversationContextResponse(
    String conversationId,
    boolean summarized,
    String summary,
    List<MessageResponse> recentMessages) {

  public static ConversationContextResponse from(
      String conversationId, ConversationContext context) {
    return new ConversationContextResponse(
        conversationId,
        context.isSummarized(),
        context.summary(),
        context.recentMessages().stream().map(MessageResponse::from).toList());
  }

  /** A single verbatim turn. */
  public record MessageResponse(MessageRole role, String content, Instant timestamp) {

    static MessageResponse from(ConversationMessage message) {
      return new MessageResponse(message.role(), message.content(), message.timestamp());
    }
  }
}
