package com.flamingo.ai.stap.api.rest;

import com.flamingo.ai.stap.api.dto.request.ConversationContextRequest;
import com.flamingo.ai.stap.api.dto.request.MessageRequest;
import com.flamingo.ai.stap.api.dto.response.ConversationContextResponse;
import com.flamingo.ai.stap.domain.model.ConversationMessage;
import com.flamingo.ai.stap.service.context.ConversationContext;
import com.flamingo.ai.stap.service.context.ConversationContextManager;
import io.micrometer.core.annotation.Timed;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller that lets the mobile and web clients compact a conversation before sending it to
 * the assistant.
 */
@RestController
@RequestMapping("/api/conversations/{conversationId}")
@RequiredArgsConstructor
public class ConversationContextController {

  private final ConversationContextManager contextManager;

  /**
   * Builds the context (summary plus verbatim tail) for a conversation history.
   *
   * @param conversationId the conversation ID
   * @param request the full history, oldest first
   * @return the context to send downstream
   */
  @PostMapping("/context")
  @Timed(value = "conversation.context.build", description = "Time to build conversation context")
  public ResponseEntity<ConversationContextResponse> buildContext(
      @PathVariable String conversationId, @Valid @RequestBody ConversationContextRequest request) {
    List<ConversationMessage> messages =
        request.getMessages().stream().map(MessageRequest::toMessage).toList();
    ConversationContext context = contextManager.buildContext(conversationId, messages);
    return ResponseEntity.ok(ConversationContextResponse.from(conversationId, context));
  }
}
