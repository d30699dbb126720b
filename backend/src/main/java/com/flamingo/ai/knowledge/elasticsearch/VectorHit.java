package com.flamingo.ai.knowledge.elasticsearch;

import java.util.UUID;

/**
 * A vector search match.
 *
 * @param score cosine similarity in [-1, 1]
 */
public record VectorHit(
    UUID chunkId,
    UUID documentId,
    UUID knowledgeBaseId,
    int orderIndex,
    String content,
    double score) {}
