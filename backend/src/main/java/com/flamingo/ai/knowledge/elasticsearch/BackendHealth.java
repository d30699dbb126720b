package com.flamingo.ai.knowledge.elasticsearch;

/** Result of a vector store health check. */
public record BackendHealth(boolean healthy, String detail) {

  public static BackendHealth up(String detail) {
    return new BackendHealth(true, detail);
  }

  public static BackendHealth down(String detail) {
    return new BackendHealth(false, detail);
  }
}
