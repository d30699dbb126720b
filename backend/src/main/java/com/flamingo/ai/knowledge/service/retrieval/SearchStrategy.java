package com.flamingo.ai.knowledge.service.retrieval;

/** Path that produced a search result. */
public enum SearchStrategy {
  /** kNN search over the tenant's vector index. */
  VECTOR,

  /** Term-frequency text search over the relational store; scores are a fixed placeholder. */
  FALLBACK
}
