package com.flamingo.ai.knowledge.elasticsearch;

import java.util.Collection;
import java.util.Set;
import java.util.UUID;

/** Restricts a vector search to some knowledge bases; an empty set means the whole tenant. */
public record VectorFilter(Set<UUID> knowledgeBaseIds) {

  private static final VectorFilter NONE = new VectorFilter(Set.of());

  public VectorFilter {
    knowledgeBaseIds = Set.copyOf(knowledgeBaseIds);
  }

  public static VectorFilter none() {
    return NONE;
  }

  public static VectorFilter forKnowledgeBases(Collection<UUID> knowledgeBaseIds) {
    return new VectorFilter(Set.copyOf(knowledgeBaseIds));
  }

  public boolean isEmpty() {
    return knowledgeBaseIds.isEmpty();
  }

  public boolean accepts(UUID knowledgeBaseId) {
    return isEmpty() || knowledgeBaseIds.contains(knowledgeBaseId);
  }
}
