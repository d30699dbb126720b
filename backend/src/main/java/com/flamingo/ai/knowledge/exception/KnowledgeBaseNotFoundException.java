package com.flamingo.ai.knowledge.exception;

import java.util.UUID;

/** Exception thrown when a knowledge base is not found. */
public class KnowledgeBaseNotFoundException extends KnowledgeRetrievalException {

  private final UUID knowledgeBaseId;

  public KnowledgeBaseNotFoundException(UUID knowledgeBaseId) {
    super("Knowledge base not found: " + knowledgeBaseId, "The knowledge base does not exist.");
    this.knowledgeBaseId = knowledgeBaseId;
  }

  public UUID getKnowledgeBaseId() {
    return knowledgeBaseId;
  }
}
