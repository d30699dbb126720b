package com.flamingo.ai.knowledge.config;

import com.flamingo.ai.knowledge.exception.ConfigException;
import com.flamingo.ai.knowledge.service.embedding.EmbeddingModelProvider;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for LangChain4j embedding models.
 *
 * <p>Models are built on first use per model name so the service can start, and fall back to text
 * search, without an embedding backend.
 */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.base-url:}")
  private String baseUrl;

  @Value("${langchain4j.openai.embedding-model.timeout-seconds:5}")
  private int timeoutSeconds;

  @Bean
  public EmbeddingModelProvider embeddingModelProvider(RetrievalConfig retrievalConfig) {
    return modelName -> {
      validateApiKey();

      OpenAiEmbeddingModel.OpenAiEmbeddingModelBuilder builder =
          OpenAiEmbeddingModel.builder()
              .apiKey(openAiApiKey)
              .modelName(modelName)
              .timeout(Duration.ofSeconds(timeoutSeconds))
              // retries are owned by the embedding client
              .maxRetries(0)
              .logRequests(false)
              .logResponses(false);
      if (baseUrl != null && !baseUrl.isBlank()) {
        builder.baseUrl(baseUrl);
      }
      Integer dimensions = retrievalConfig.getEmbedding().getModels().get(modelName);
      if (dimensions != null && modelName.startsWith("text-embedding-3")) {
        builder.dimensions(dimensions);
      }
      return builder.build();
    };
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new ConfigException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
