package com.flamingo.ai.knowledge.exception;

/** Exception thrown when neither the vector path nor the text fallback could answer a search. */
public class RetrievalFailedException extends KnowledgeRetrievalException {

  public RetrievalFailedException(String message, Throwable cause) {
    super(message, "Search is temporarily unavailable. Please try again.", cause);
  }
}
