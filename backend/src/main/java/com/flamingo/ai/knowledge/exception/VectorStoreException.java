package com.flamingo.ai.knowledge.exception;

/** Exception thrown when the vector store rejects or fails an operation. */
public class VectorStoreException extends KnowledgeRetrievalException {

  public VectorStoreException(String message) {
    super(message, "Vector search is temporarily unavailable. Please try again later.");
  }

  public VectorStoreException(String message, Throwable cause) {
    super(message, "Vector search is temporarily unavailable. Please try again later.", cause);
  }
}
