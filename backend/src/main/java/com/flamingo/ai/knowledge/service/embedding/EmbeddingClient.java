package com.flamingo.ai.knowledge.service.embedding;

import com.flamingo.ai.knowledge.exception.ConfigException;
import com.flamingo.ai.knowledge.exception.EmbeddingUnavailableException;
import java.util.List;
import java.util.OptionalInt;

/**
 * Turns text into vectors with a named embedding model.
 *
 * <p>Implementations retry transient backend failures themselves and surface {@link
 * EmbeddingUnavailableException} once retries are exhausted.
 */
public interface EmbeddingClient {

  /**
   * Embeds one text.
   *
   * @throws EmbeddingUnavailableException if the backend is unreachable after retries
   */
  float[] embed(String text, String model);

  /**
   * Embeds several texts in one request. The result has the same order as the input.
   *
   * @throws EmbeddingUnavailableException if the backend is unreachable after retries
   */
  List<float[]> embedBatch(List<String> texts, String model);

  /** Dimensions of a model according to the configured catalogue, if known. */
  OptionalInt dimensions(String model);

  /**
   * Checks a vector against the dimensions a knowledge base was indexed with.
   *
   * @throws ConfigException if the lengths differ; vectors are never truncated or padded
   */
  static float[] requireDimensions(float[] vector, int expected, String model) {
    if (vector.length != expected) {
      throw new ConfigException(
          "Embedding model '"
              + model
              + "' returned "
              + vector.length
              + " dimensions, knowledge base expects "
              + expected);
    }
    return vector;
  }
}
