package com.flamingo.ai.knowledge.domain.model;

import com.flamingo.ai.knowledge.domain.enums.ChunkingStrategy;
import com.flamingo.ai.knowledge.exception.ConfigException;
import lombok.Builder;

/**
 * Chunking, embedding and search settings of a knowledge base.
 *
 * <p>Changing any of them invalidates the existing vectors of the knowledge base.
 */
@Builder(toBuilder = true)
public record KnowledgeBaseSettings(
    ChunkingStrategy chunkingStrategy,
    int chunkSize,
    int chunkOverlap,
    String embeddingModel,
    int embeddingDimensions,
    double similarityThreshold,
    int maxResults) {

  public ChunkingOptions chunkingOptions() {
    return new ChunkingOptions(chunkingStrategy, chunkSize, chunkOverlap);
  }

  /**
   * Validates value ranges that do not depend on the embedding model catalogue.
   *
   * @param maxResultsLimit upper bound for {@link #maxResults()}
   * @return these settings
   */
  public KnowledgeBaseSettings validate(int maxResultsLimit) {
    chunkingOptions().validate();
    if (embeddingModel == null || embeddingModel.isBlank()) {
      throw new ConfigException("embedding model is required");
    }
    if (embeddingDimensions <= 0) {
      throw new ConfigException(
          "embedding dimensions must be positive, was " + embeddingDimensions);
    }
    if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
      throw new ConfigException(
          "similarity threshold must be within [0, 1], was " + similarityThreshold);
    }
    if (maxResults < 1 || maxResults > maxResultsLimit) {
      throw new ConfigException(
          "max results must be within [1, " + maxResultsLimit + "], was " + maxResults);
    }
    return this;
  }
}
