package com.flamingo.ai.stap.api.dto.request;

import com.flamingo.ai.stap.domain.enums.MessageRole;
import com.flamingo.ai.stap.domain.model.ConversationMessage;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A single conversation turn in a context request. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageRequest {

  @NotNull(message = "Role is required")
  private MessageRole role;

  @NotNull(message = "Content is required")
  @Size(max = 10000, message = "Content must not exceed 10000 characters")
  private String content;

  private Instant timestamp;

  public ConversationMessage toMessage() {
    return new ConversationMessage(role, content, timestamp);
  }
}
