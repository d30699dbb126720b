package com.flamingo.ai.knowledge.exception;

/** Exception thrown when the embedding backend is unreachable or times out. */
public class EmbeddingUnavailableException extends KnowledgeRetrievalException {

  public EmbeddingUnavailableException(String message) {
    super(message, "The embedding service is temporarily unavailable. Please try again later.");
  }

  public EmbeddingUnavailableException(String message, Throwable cause) {
    super(
        message,
        "The embedding service is temporarily unavailable. Please try again later.",
        cause);
  }
}
