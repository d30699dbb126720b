package com.flamingo.ai.knowledge.domain.enums;

/** Lifecycle status of a knowledge base. */
public enum KnowledgeBaseStatus {
  ACTIVE,
  INACTIVE,
  PROCESSING
}
