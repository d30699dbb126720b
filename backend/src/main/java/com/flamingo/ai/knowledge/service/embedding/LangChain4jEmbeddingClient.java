package com.flamingo.ai.knowledge.service.embedding;

import com.flamingo.ai.knowledge.config.RetrievalConfig;
import com.flamingo.ai.knowledge.exception.ConfigException;
import com.flamingo.ai.knowledge.exception.EmbeddingUnavailableException;
import com.google.common.annotations.VisibleForTesting;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Embedding client backed by LangChain4j models.
 *
 * <p>One model instance is built per model name and reused. Backend failures are retried by the
 * {@code embedding} Resilience4j retry (3 attempts, exponential backoff).
 */
@Service
@Slf4j
public class LangChain4jEmbeddingClient implements EmbeddingClient {

  static final String RETRY_NAME = "embedding";

  private final EmbeddingModelProvider modelProvider;
  private final RetrievalConfig retrievalConfig;
  private final Retry retry;
  private final MeterRegistry meterRegistry;
  private final Map<String, EmbeddingModel> models = new ConcurrentHashMap<>();

  @Autowired
  public LangChain4jEmbeddingClient(
      EmbeddingModelProvider modelProvider,
      RetrievalConfig retrievalConfig,
      RetryRegistry retryRegistry,
      MeterRegistry meterRegistry) {
    this(modelProvider, retrievalConfig, retryRegistry.retry(RETRY_NAME), meterRegistry);
  }

  @VisibleForTesting
  LangChain4jEmbeddingClient(
      EmbeddingModelProvider modelProvider,
      RetrievalConfig retrievalConfig,
      Retry retry,
      MeterRegistry meterRegistry) {
    this.modelProvider = modelProvider;
    this.retrievalConfig = retrievalConfig;
    this.retry = retry;
    this.meterRegistry = meterRegistry;
    retry
        .getEventPublisher()
        .onRetry(
            event ->
                log.warn(
                    "Embedding call failed (attempt {}), retrying in {} ms: {}",
                    event.getNumberOfRetryAttempts(),
                    event.getWaitInterval().toMillis(),
                    event.getLastThrowable() == null
                        ? "unknown"
                        : event.getLastThrowable().getMessage()));
  }

  @Override
  public float[] embed(String text, String model) {
    EmbeddingModel embeddingModel = model(model);
    String input = truncate(text);
    log.debug("Embedding {} chars with model {}", input.length(), model);

    Response<Embedding> response = withRetry(() -> embeddingModel.embed(input));
    meterRegistry.counter("embedding.requests.success", "type", "single").increment();
    return vectorOf(response == null ? null : response.content(), model);
  }

  @Override
  public List<float[]> embedBatch(List<String> texts, String model) {
    if (texts.isEmpty()) {
      return List.of();
    }
    EmbeddingModel embeddingModel = model(model);
    List<TextSegment> segments = new ArrayList<>(texts.size());
    for (String text : texts) {
      segments.add(TextSegment.from(truncate(text)));
    }
    log.debug("Embedding batch of {} texts with model {}", segments.size(), model);

    Response<List<Embedding>> response = withRetry(() -> embeddingModel.embedAll(segments));
    List<Embedding> embeddings = response == null ? null : response.content();
    if (embeddings == null || embeddings.size() != texts.size()) {
      throw new EmbeddingUnavailableException(
          "Embedding backend returned "
              + (embeddings == null ? 0 : embeddings.size())
              + " vectors for "
              + texts.size()
              + " texts");
    }
    meterRegistry.counter("embedding.requests.success", "type", "batch").increment();

    List<float[]> vectors = new ArrayList<>(embeddings.size());
    for (Embedding embedding : embeddings) {
      vectors.add(vectorOf(embedding, model));
    }
    return vectors;
  }

  @Override
  public OptionalInt dimensions(String model) {
    Integer dimensions = retrievalConfig.getEmbedding().getModels().get(model);
    return dimensions == null ? OptionalInt.empty() : OptionalInt.of(dimensions);
  }

  private EmbeddingModel model(String model) {
    if (model == null || model.isBlank()) {
      throw new ConfigException("embedding model name is required");
    }
    return models.computeIfAbsent(
        model,
        name -> {
          log.info("Creating embedding model client for {}", name);
          return modelProvider.create(name);
        });
  }

  private <T> T withRetry(Supplier<T> call) {
    Supplier<T> guarded =
        () -> {
          if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Embedding call interrupted");
          }
          try {
            return call.get();
          } catch (ConfigException | EmbeddingUnavailableException | CancellationException e) {
            throw e;
          } catch (RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
              throw new CancellationException("Embedding call interrupted");
            }
            meterRegistry.counter("embedding.requests.failure").increment();
            throw new EmbeddingUnavailableException(
                "Embedding backend call failed: " + e.getMessage(), e);
          }
        };
    return Retry.decorateSupplier(retry, guarded).get();
  }

  private String truncate(String text) {
    String input = text == null ? "" : text;
    int maxChars = retrievalConfig.getEmbedding().getMaxInputChars();
    if (input.length() > maxChars) {
      log.warn(
          "Text too long for embedding, truncating from {} chars to {} chars",
          input.length(),
          maxChars);
      return input.substring(0, maxChars);
    }
    return input;
  }

  private static float[] vectorOf(Embedding embedding, String model) {
    if (embedding == null || embedding.vector() == null) {
      throw new EmbeddingUnavailableException(
          "Embedding backend returned no vector for model " + model);
    }
    return embedding.vector();
  }
}
