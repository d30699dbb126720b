package com.flamingo.ai.knowledge.elasticsearch;

/** Size and state of a tenant index. */
public record CollectionStats(String collection, long count, Status status) {

  /** Index state as seen by the adapter. */
  public enum Status {
    GREEN,
    YELLOW,
    RED,
    /** No vector has been written for the tenant yet. */
    MISSING,
    /** The vector store is degraded or unreachable. */
    UNAVAILABLE
  }

  public static CollectionStats unavailable(String collection) {
    return new CollectionStats(collection, 0L, Status.UNAVAILABLE);
  }
}
