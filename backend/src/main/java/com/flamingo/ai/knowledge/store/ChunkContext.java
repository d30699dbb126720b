package com.flamingo.ai.knowledge.store;

import com.flamingo.ai.knowledge.domain.entity.DocumentChunk;
import com.flamingo.ai.knowledge.domain.entity.KnowledgeBase;
import com.flamingo.ai.knowledge.domain.entity.KnowledgeDocument;
import com.flamingo.ai.knowledge.domain.enums.DocumentType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/** A chunk joined with the document and knowledge base it belongs to. */
public record ChunkContext(
    UUID chunkId,
    int orderIndex,
    String content,
    int characterCount,
    int tokenCount,
    Map<String, Object> metadata,
    UUID documentId,
    String documentTitle,
    String documentFilename,
    DocumentType documentType,
    UUID knowledgeBaseId,
    String knowledgeBaseName,
    UUID tenantId) {

  public static ChunkContext from(DocumentChunk chunk) {
    KnowledgeDocument document = chunk.getDocument();
    KnowledgeBase knowledgeBase = document.getKnowledgeBase();
    return new ChunkContext(
        chunk.getId(),
        chunk.getOrderIndex(),
        chunk.getContent(),
        chunk.getCharacterCount(),
        chunk.getTokenCount(),
        chunk.getMetadata() == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(chunk.getMetadata())),
        document.getId(),
        document.getTitle(),
        document.getFilename(),
        document.getType(),
        knowledgeBase.getId(),
        knowledgeBase.getName(),
        knowledgeBase.getTenantId());
  }
}
