package com.flamingo.ai.knowledge.exception;

/**
 * Exception thrown when chunking, embedding or index settings are invalid or inconsistent (for
 * example a vector dimension that does not match the knowledge base). Never retried and never
 * masked by the text fallback.
 */
public class ConfigException extends KnowledgeRetrievalException {

  public ConfigException(String message) {
    super(message, "The knowledge base configuration is invalid: " + message);
  }
}
