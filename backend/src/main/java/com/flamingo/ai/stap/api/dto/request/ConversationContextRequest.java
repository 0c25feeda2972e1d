package com.flamingo.ai.stap.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO carrying a conversation's full message history, oldest first. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationContextRequest {

  @NotNull(message = "Messages are required")
  @Size(max = 500, message = "History must not exceed 500 messages")
  private List<@NotNull(message = "Messages must not be null") @Valid MessageRequest> messages;
}
