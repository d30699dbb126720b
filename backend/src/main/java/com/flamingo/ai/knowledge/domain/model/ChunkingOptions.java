package com.flamingo.ai.knowledge.domain.model;

import com.flamingo.ai.knowledge.domain.enums.ChunkingStrategy;
import com.flamingo.ai.knowledge.exception.ConfigException;

/**
 * Chunking parameters of a knowledge base.
 *
 * @param strategy how cut points are chosen
 * @param chunkSize maximum chunk length in characters
 * @param overlap number of characters repeated at the start of the next chunk
 */
public record ChunkingOptions(ChunkingStrategy strategy, int chunkSize, int overlap) {

  /**
   * Checks that the options can produce a terminating chunk sequence.
   *
   * @return these options
   * @throws ConfigException if the strategy is missing, the size is not positive or the overlap
   *     is negative or not smaller than the size
   */
  public ChunkingOptions validate() {
    if (strategy == null) {
      throw new ConfigException("chunking strategy is required");
    }
    if (chunkSize <= 0) {
      throw new ConfigException("chunk size must be positive, was " + chunkSize);
    }
    if (overlap < 0) {
      throw new ConfigException("chunk overlap must not be negative, was " + overlap);
    }
    if (overlap >= chunkSize) {
      throw new ConfigException(
          "chunk overlap (" + overlap + ") must be smaller than chunk size (" + chunkSize + ")");
    }
    return this;
  }
}
