package com.flamingo.ai.knowledge.exception;

/**
 * Base class for every failure raised by the retrieval engine.
 *
 * <p>Carries a user-facing message next to the technical one so callers can surface the former
 * without leaking backend details.
 */
public class KnowledgeRetrievalException extends RuntimeException {

  private final String userMessage;

  protected KnowledgeRetrievalException(String message, String userMessage) {
    super(message);
    this.userMessage = userMessage;
  }

  protected KnowledgeRetrievalException(String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.userMessage = userMessage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
