package com.flamingo.ai.stap.domain.enums;

/** Author of a conversation message. */
public enum MessageRole {
  /** Message typed by the student or staff member. */
  USER,

  /** Reply produced by the AI assistant. */
  ASSISTANT
}
