package com.flamingo.ai.raggateway.query;

/**
 * One earlier message of the conversation.
 *
 * @param role {@code user} or {@code assistant}
 * @param content message text
 */
public record ConversationTurn(String role, String content) {

  public boolean isAssistant() {
    return "assistant".equalsIgnoreCase(role);
  }
}
