package com.flamingo.ai.knowledge.elasticsearch;

import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;

/**
 * Similarity function of a tenant index, fixed when the index is created. Both functions are
 * reported by Elasticsearch as {@code (1 + similarity) / 2}.
 */
public enum DistanceMetric {
  COSINE(DenseVectorSimilarity.Cosine),
  DOT_PRODUCT(DenseVectorSimilarity.DotProduct);

  private final DenseVectorSimilarity similarity;

  DistanceMetric(DenseVectorSimilarity similarity) {
    this.similarity = similarity;
  }

  DenseVectorSimilarity similarity() {
    return similarity;
  }
}
