package com.flamingo.ai.knowledge.service.indexing;

import com.flamingo.ai.knowledge.domain.enums.DocumentStatus;
import java.util.UUID;

/**
 * Outcome of indexing one document.
 *
 * @param chunkCount chunks persisted for the document, also when vector indexing failed
 * @param error failure message, null when the document is ready
 */
public record IndexingResult(UUID documentId, DocumentStatus status, int chunkCount, String error) {

  public boolean isReady() {
    return status == DocumentStatus.READY;
  }
}
