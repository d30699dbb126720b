package com.flamingo.ai.knowledge.service.reindex;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Outcome of a knowledge base rebuild.
 *
 * @param failedChunkIds chunks that could not be embedded or written, in enumeration order
 * @param failureReasons error message per failed chunk
 * @param skipped chunks not started because the rebuild was cancelled
 * @param orphansRemoved vectors deleted because their chunk no longer exists
 */
public record RebuildReport(
    UUID knowledgeBaseId,
    int indexed,
    int total,
    List<UUID> failedChunkIds,
    Map<UUID, String> failureReasons,
    int skipped,
    boolean cancelled,
    long orphansRemoved,
    Duration duration) {

  /** Whether every chunk of the knowledge base has an up-to-date vector. */
  public boolean isComplete() {
    return indexed == total;
  }
}
