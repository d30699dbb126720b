package com.flamingo.ai.knowledge.domain.enums;

/** Strategy used to cut document text into chunks. */
public enum ChunkingStrategy {
  /** Cut every {@code chunkSize} characters. */
  FIXED,

  /**
   * Cut at the last paragraph break that fits, falling back to sentence ends, whitespace and
   * finally a raw character position.
   */
  RECURSIVE,

  /** Pack whole sentences up to the size budget; an oversized sentence is kept whole. */
  SEMANTIC
}
