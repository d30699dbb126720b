package com.flamingo.ai.knowledge.service.chunking;

/**
 * One chunk produced by {@link DocumentChunker}: the exact slice {@code text[startPosition,
 * endPosition)} of the source text.
 */
public record ChunkPiece(
    String content,
    int orderIndex,
    int characterCount,
    int tokenEstimate,
    int startPosition,
    int endPosition) {}
