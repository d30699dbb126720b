package com.flamingo.ai.knowledge.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.knowledge.exception.EmbeddingUnavailableException;
import io.github.resilience4j.common.CompositeCustomizer;
import io.github.resilience4j.common.retry.configuration.RetryConfigCustomizer;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.springboot3.retry.autoconfigure.RetryProperties;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.FileSystemResource;

/**
 * Binds the {@code embedding} retry from the shipped application.yml. The test resources carry
 * their own application.yml with short waits, so the main file is read from the source tree.
 */
@DisplayName("Embedding retry configuration Tests")
class EmbeddingRetryConfigurationTest {

  private static final String MAIN_CONFIG = "src/main/resources/application.yml";

  private RetryConfig config;

  @BeforeEach
  void setUp() throws IOException {
    List<PropertySource<?>> sources =
        new YamlPropertySourceLoader().load("main", new FileSystemResource(MAIN_CONFIG));
    RetryProperties properties =
        new Binder(ConfigurationPropertySources.from(sources))
            .bind("resilience4j.retry", RetryProperties.class)
            .get();
    config =
        properties.createRetryConfig(
            properties.getInstances().get(LangChain4jEmbeddingClient.RETRY_NAME),
            new CompositeCustomizer<RetryConfigCustomizer>(List.of()),
            LangChain4jEmbeddingClient.RETRY_NAME);
  }

  @Test
  @DisplayName("should make three attempts in total")
  void shouldMakeThreeAttempts() {
    assertThat(config.getMaxAttempts()).isEqualTo(3);
  }

  @Test
  @DisplayName("should wait 200 ms and then 800 ms between attempts")
  void shouldBackOffExponentially() {
    assertThat(config.getIntervalBiFunction().apply(1, null)).isEqualTo(200L);
    assertThat(config.getIntervalBiFunction().apply(2, null)).isEqualTo(800L);
  }

  @Test
  @DisplayName("should retry only when the embedding backend is unavailable")
  void shouldRetryOnlyUnavailableBackend() {
    assertThat(config.getExceptionPredicate().test(new EmbeddingUnavailableException("down")))
        .isTrue();
    assertThat(config.getExceptionPredicate().test(new IllegalArgumentException("bad input")))
        .isFalse();
  }
}
