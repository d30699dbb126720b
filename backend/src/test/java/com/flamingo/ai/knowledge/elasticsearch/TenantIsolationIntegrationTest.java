package com.flamingo.ai.knowledge.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.rest5_client.Rest5ClientTransport;
import co.elastic.clients.transport.rest5_client.low_level.Rest5Client;
import com.flamingo.ai.knowledge.config.RetrievalConfig;
import com.flamingo.ai.knowledge.exception.ConfigException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.apache.hc.core5.http.HttpHost;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.elasticsearch.ElasticsearchContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Runs the vector store against a real Elasticsearch node and checks that each tenant only ever
 * sees its own vectors.
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Tenant Isolation Integration Test")
class TenantIsolationIntegrationTest {

  @Container
  private static final ElasticsearchContainer ELASTICSEARCH_CONTAINER =
      new ElasticsearchContainer("docker.elastic.co/elasticsearch/elasticsearch:9.0.0")
          .withEnv("xpack.security.enabled", "false")
          .withEnv("xpack.security.http.ssl.enabled", "false")
          .withStartupTimeout(Duration.ofMinutes(2));

  private static final float[] REFUNDS = {0.9f, 0.1f, 0.2f};
  private static final float[] SHIPPING = {0.1f, 0.9f, 0.3f};

  private Rest5Client restClient;
  private ElasticsearchClient elasticsearchClient;
  private TenantCollections tenantCollections;
  private ElasticsearchVectorStore vectorStore;

  private final UUID tenantA = UUID.randomUUID();
  private final UUID tenantB = UUID.randomUUID();
  private final UUID handbookA = UUID.randomUUID();
  private final UUID faqA = UUID.randomUUID();
  private final UUID handbookB = UUID.randomUUID();

  @BeforeEach
  void setUp() {
    restClient =
        Rest5Client.builder(
                new HttpHost(
                    "http",
                    ELASTICSEARCH_CONTAINER.getHost(),
                    ELASTICSEARCH_CONTAINER.getMappedPort(9200)))
            .build();
    elasticsearchClient =
        new ElasticsearchClient(new Rest5ClientTransport(restClient, new JacksonJsonpMapper()));

    RetrievalConfig retrievalConfig = new RetrievalConfig();
    tenantCollections = new TenantCollections(retrievalConfig);
    vectorStore =
        new ElasticsearchVectorStore(
            elasticsearchClient, tenantCollections, retrievalConfig, new SimpleMeterRegistry());
    vectorStore.initialize();

    vectorStore.ensureCollection(tenantA, 3, DistanceMetric.COSINE);
    vectorStore.ensureCollection(tenantB, 3, DistanceMetric.COSINE);
  }

  @AfterEach
  void tearDown() throws IOException {
    for (UUID tenant : List.of(tenantA, tenantB)) {
      String collection = tenantCollections.nameFor(tenant);
      elasticsearchClient.indices().delete(d -> d.index(collection).ignoreUnavailable(true));
    }
    restClient.close();
  }

  private VectorRecord record(UUID knowledgeBaseId, int orderIndex, String content, float[] v) {
    return VectorRecord.builder()
        .chunkId(UUID.randomUUID())
        .documentId(UUID.randomUUID())
        .knowledgeBaseId(knowledgeBaseId)
        .content(content)
        .orderIndex(orderIndex)
        .charCount(content.length())
        .tokenCount(content.length() / 4)
        .vector(v)
        .build();
  }

  @Test
  @DisplayName("Should only return vectors of the searching tenant")
  void shouldOnlyReturnVectorsOfTheSearchingTenant() {
    VectorRecord ownRefund = record(handbookA, 0, "Refunds take five days.", REFUNDS);
    VectorRecord ownShipping = record(handbookA, 1, "Shipping is free.", SHIPPING);
    VectorRecord foreignRefund = record(handbookB, 0, "Refunds of tenant B.", REFUNDS);
    vectorStore.upsert(tenantA, List.of(ownRefund, ownShipping));
    vectorStore.upsert(tenantB, List.of(foreignRefund));

    List<VectorHit> hits = vectorStore.search(tenantA, REFUNDS, 10, 0.0, VectorFilter.none());

    assertThat(hits)
        .extracting(VectorHit::chunkId)
        .containsExactly(ownRefund.getChunkId(), ownShipping.getChunkId());
    assertThat(hits.get(0).score()).isGreaterThan(0.99);
    assertThat(hits).extracting(VectorHit::knowledgeBaseId).containsOnly(handbookA);
  }

  @Test
  @DisplayName("Should restrict a search to the requested knowledge bases")
  void shouldRestrictSearchToKnowledgeBases() {
    VectorRecord handbook = record(handbookA, 0, "Refunds take five days.", REFUNDS);
    VectorRecord faq = record(faqA, 0, "Refund FAQ.", REFUNDS);
    vectorStore.upsert(tenantA, List.of(handbook, faq));

    List<VectorHit> hits =
        vectorStore.search(tenantA, REFUNDS, 10, 0.0, VectorFilter.forKnowledgeBases(Set.of(faqA)));

    assertThat(hits).extracting(VectorHit::chunkId).containsExactly(faq.getChunkId());
  }

  @Test
  @DisplayName("Should drop hits below the similarity threshold")
  void shouldDropHitsBelowThreshold() {
    vectorStore.upsert(
        tenantA,
        List.of(
            record(handbookA, 0, "Refunds take five days.", REFUNDS),
            record(handbookA, 1, "Shipping is free.", SHIPPING)));

    List<VectorHit> hits = vectorStore.search(tenantA, REFUNDS, 10, 0.9, VectorFilter.none());

    assertThat(hits).extracting(VectorHit::content).containsExactly("Refunds take five days.");
  }

  @Test
  @DisplayName("Should delete a knowledge base without touching the other tenant")
  void shouldDeleteKnowledgeBaseWithinTenant() {
    vectorStore.upsert(tenantA, List.of(record(handbookA, 0, "Refunds.", REFUNDS)));
    vectorStore.upsert(tenantA, List.of(record(faqA, 0, "FAQ.", SHIPPING)));
    vectorStore.upsert(tenantB, List.of(record(handbookB, 0, "Other.", REFUNDS)));

    vectorStore.deleteByKnowledgeBase(tenantA, handbookA);

    assertThat(vectorStore.stats(tenantA).count()).isEqualTo(1);
    assertThat(vectorStore.stats(tenantB).count()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should remove only orphan vectors of one knowledge base")
  void shouldRetainLiveVectors() {
    VectorRecord live = record(handbookA, 0, "Live.", REFUNDS);
    VectorRecord orphan = record(handbookA, 1, "Orphan.", SHIPPING);
    VectorRecord otherKnowledgeBase = record(faqA, 0, "FAQ.", SHIPPING);
    vectorStore.upsert(tenantA, List.of(live, orphan, otherKnowledgeBase));

    long removed = vectorStore.retainOnly(tenantA, handbookA, Set.of(live.getChunkId()));

    assertThat(removed).isEqualTo(1);
    assertThat(vectorStore.search(tenantA, SHIPPING, 10, 0.0, VectorFilter.none()))
        .extracting(VectorHit::chunkId)
        .containsExactlyInAnyOrder(live.getChunkId(), otherKnowledgeBase.getChunkId());
  }

  @Test
  @DisplayName("Should reject a collection with different dimensions")
  void shouldRejectDimensionChange() {
    assertThatThrownBy(() -> vectorStore.ensureCollection(tenantA, 4, DistanceMetric.COSINE))
        .isInstanceOf(ConfigException.class);
  }

  @Test
  @DisplayName("Should report a missing collection for an unknown tenant")
  void shouldReportMissingCollection() {
    CollectionStats stats = vectorStore.stats(UUID.randomUUID());

    assertThat(stats.status()).isEqualTo(CollectionStats.Status.MISSING);
    assertThat(stats.count()).isZero();
  }
}
