package com.flamingo.ai.knowledge.service.retrieval;

import com.flamingo.ai.knowledge.domain.enums.DocumentType;
import com.flamingo.ai.knowledge.store.ChunkContext;
import java.util.Map;
import java.util.UUID;

/**
 * A ranked chunk with the metadata of its document and knowledge base.
 *
 * @param content null unless the request asked for content
 * @param score cosine similarity, or the fixed fallback score
 */
public record SearchHit(
    UUID chunkId,
    int orderIndex,
    String content,
    int characterCount,
    Map<String, Object> metadata,
    double score,
    UUID documentId,
    String documentTitle,
    String documentFilename,
    DocumentType documentType,
    UUID knowledgeBaseId,
    String knowledgeBaseName) {

  static SearchHit of(ChunkContext chunk, double score, boolean includeContent) {
    return new SearchHit(
        chunk.chunkId(),
        chunk.orderIndex(),
        includeContent ? chunk.content() : null,
        chunk.characterCount(),
        chunk.metadata(),
        score,
        chunk.documentId(),
        chunk.documentTitle(),
        chunk.documentFilename(),
        chunk.documentType(),
        chunk.knowledgeBaseId(),
        chunk.knowledgeBaseName());
  }
}
