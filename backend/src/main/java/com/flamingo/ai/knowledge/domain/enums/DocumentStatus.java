package com.flamingo.ai.knowledge.domain.enums;

/** Defines the indexing status of a knowledge-base document. */
public enum DocumentStatus {
  /** Document has been registered but not yet chunked. */
  PENDING,

  /** Document is currently being chunked and embedded. */
  PROCESSING,

  /** Document chunks are persisted and indexed for search. */
  READY,

  /** Chunking or vector indexing failed; see the processing error. */
  FAILED
}
