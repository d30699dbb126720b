package com.flamingo.ai.knowledge.exception;

/**
 * Exception thrown when the vector store cannot be reached. Raised without a network round trip
 * while the adapter is degraded.
 */
public class BackendUnavailableException extends VectorStoreException {

  public BackendUnavailableException(String message) {
    super(message);
  }

  public BackendUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
