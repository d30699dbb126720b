package com.flamingo.ai.knowledge.exception;

import java.util.UUID;

/** Exception recorded when a single chunk could not be embedded or written during a rebuild. */
public class ChunkProcessingException extends KnowledgeRetrievalException {

  private final UUID chunkId;

  public ChunkProcessingException(UUID chunkId, String message, Throwable cause) {
    super(message, "Failed to index part of the knowledge base.", cause);
    this.chunkId = chunkId;
  }

  public UUID getChunkId() {
    return chunkId;
  }
}
