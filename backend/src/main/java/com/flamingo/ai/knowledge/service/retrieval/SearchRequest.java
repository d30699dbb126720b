package com.flamingo.ai.knowledge.service.retrieval;

import java.util.List;
import java.util.UUID;
import lombok.Builder;

/**
 * A retrieval request.
 *
 * @param knowledgeBaseIds restricts the search; empty or null means all of the tenant's knowledge
 *     bases
 * @param limit maximum hits; null uses the knowledge base or global default
 * @param threshold minimum cosine similarity; null uses the knowledge base or global default
 * @param includeContent whether hits carry the chunk text
 */
@Builder
public record SearchRequest(
    String query,
    UUID tenantId,
    List<UUID> knowledgeBaseIds,
    Integer limit,
    Double threshold,
    boolean includeContent) {

  public SearchRequest {
    knowledgeBaseIds = knowledgeBaseIds == null ? List.of() : List.copyOf(knowledgeBaseIds);
  }

  public boolean scopedToKnowledgeBases() {
    return !knowledgeBaseIds.isEmpty();
  }
}
