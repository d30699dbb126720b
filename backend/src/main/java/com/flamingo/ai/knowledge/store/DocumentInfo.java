package com.flamingo.ai.knowledge.store;

import com.flamingo.ai.knowledge.domain.entity.KnowledgeDocument;
import com.flamingo.ai.knowledge.domain.enums.DocumentStatus;
import com.flamingo.ai.knowledge.domain.enums.DocumentType;
import java.time.LocalDateTime;
import java.util.UUID;

/** Read-only view of a knowledge-base document, without its text. */
public record DocumentInfo(
    UUID id,
    UUID knowledgeBaseId,
    String title,
    String filename,
    DocumentType type,
    DocumentStatus status,
    LocalDateTime createdAt) {

  public static DocumentInfo from(KnowledgeDocument document) {
    return new DocumentInfo(
        document.getId(),
        document.getKnowledgeBase().getId(),
        document.getTitle(),
        document.getFilename(),
        document.getType(),
        document.getStatus(),
        document.getCreatedAt());
  }
}
