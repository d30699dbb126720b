package com.flamingo.ai.knowledge.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.Conflicts;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.HealthStatus;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.cluster.HealthRequest;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.CountRequest;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.ExistsRequest;
import co.elastic.clients.elasticsearch.indices.GetMappingRequest;
import co.elastic.clients.elasticsearch.indices.GetMappingResponse;
import co.elastic.clients.elasticsearch.indices.get_mapping.IndexMappingRecord;
import co.elastic.clients.transport.endpoints.BooleanResponse;
import com.flamingo.ai.knowledge.config.RetrievalConfig;
import com.flamingo.ai.knowledge.exception.BackendUnavailableException;
import com.flamingo.ai.knowledge.exception.ConfigException;
import com.flamingo.ai.knowledge.exception.VectorStoreException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Vector store backed by one Elasticsearch index per tenant.
 *
 * <p>Vectors live in a {@code dense_vector} field searched with kNN. Elasticsearch reports cosine
 * matches as {@code (1 + cos) / 2}; hits are converted back to cosine similarity before they leave
 * the adapter.
 *
 * <p>Connectivity is probed at startup and on a fixed delay while degraded. A transport failure at
 * runtime also moves the adapter to the degraded state.
 */
@Service
@Slf4j
public class ElasticsearchVectorStore implements VectorStore {

  static final String EMBEDDING_FIELD = "embedding";
  private static final int MAX_NUM_CANDIDATES = 10_000;

  private static final Comparator<VectorHit> HIT_ORDER =
      Comparator.comparingDouble(VectorHit::score)
          .reversed()
          .thenComparingInt(VectorHit::orderIndex)
          .thenComparing(hit -> hit.chunkId().toString());

  private final ElasticsearchClient elasticsearchClient;
  private final TenantCollections tenantCollections;
  private final RetrievalConfig retrievalConfig;
  private final MeterRegistry meterRegistry;

  private final AtomicBoolean available = new AtomicBoolean(false);
  private volatile String lastFailure = "not probed yet";

  public ElasticsearchVectorStore(
      ElasticsearchClient elasticsearchClient,
      TenantCollections tenantCollections,
      RetrievalConfig retrievalConfig,
      MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.tenantCollections = tenantCollections;
    this.retrievalConfig = retrievalConfig;
    this.meterRegistry = meterRegistry;
  }

  @PostConstruct
  public void initialize() {
    if (!probe()) {
      log.warn(
          "Elasticsearch unreachable at startup, vector store starts DEGRADED: {}", lastFailure);
    }
  }

  /** Re-probes the backend while degraded. */
  @Scheduled(
      initialDelayString = "${retrieval.vector-store.reconnect-interval-ms:30000}",
      fixedDelayString = "${retrieval.vector-store.reconnect-interval-ms:30000}")
  public void reconnectIfDegraded() {
    if (!available.get()) {
      probe();
    }
  }

  @Override
  public boolean probe() {
    boolean reachable;
    try {
      BooleanResponse response = elasticsearchClient.ping();
      reachable = response != null && response.value();
      if (!reachable) {
        lastFailure = "ping returned false";
      }
    } catch (IOException | RuntimeException e) {
      reachable = false;
      lastFailure = e.getMessage();
      log.debug("Elasticsearch ping failed: {}", e.getMessage());
    }
    boolean previous = available.getAndSet(reachable);
    if (reachable && !previous) {
      log.info("Vector store is HEALTHY");
      meterRegistry.counter("vector_store.state_changes", "state", "healthy").increment();
    } else if (!reachable && previous) {
      log.warn("Vector store is DEGRADED: {}", lastFailure);
      meterRegistry.counter("vector_store.state_changes", "state", "degraded").increment();
    }
    return reachable;
  }

  @Override
  public boolean isAvailable() {
    return available.get();
  }

  @Override
  @Timed(value = "vector_store.ensure_collection", description = "Time to ensure tenant index")
  public void ensureCollection(UUID tenantId, int dimensions, DistanceMetric metric) {
    if (dimensions <= 0) {
      throw new ConfigException("vector dimensions must be positive, was " + dimensions);
    }
    String collection = tenantCollections.nameFor(tenantId);
    execute(
        "ensureCollection",
        collection,
        () -> {
          BooleanResponse exists =
              elasticsearchClient.indices().exists(ExistsRequest.of(e -> e.index(collection)));
          if (exists.value()) {
            verifyDimensions(collection, dimensions);
            return null;
          }
          Map<String, Property> properties = defineIndexProperties(dimensions, metric);
          try {
            elasticsearchClient
                .indices()
                .create(
                    CreateIndexRequest.of(
                        c ->
                            c.index(collection)
                                .mappings(
                                    m -> m.dynamic(DynamicMapping.False).properties(properties))));
            log.info(
                "Created vector collection {} ({} dims, {})", collection, dimensions, metric);
            meterRegistry.counter("vector_store.collections.created").increment();
          } catch (ElasticsearchException e) {
            if (!"resource_already_exists_exception".equals(errorType(e))) {
              throw e;
            }
            log.debug("Collection {} was created concurrently", collection);
            verifyDimensions(collection, dimensions);
          }
          return null;
        });
  }

  @Override
  @Timed(value = "vector_store.upsert", description = "Time to upsert vectors")
  public void upsert(UUID tenantId, List<VectorRecord> records) {
    if (records.isEmpty()) {
      return;
    }
    String collection = tenantCollections.nameFor(tenantId);
    BulkResponse response =
        execute(
            "upsert",
            collection,
            () -> {
              BulkRequest.Builder bulkBuilder = new BulkRequest.Builder().refresh(Refresh.WaitFor);
              for (VectorRecord record : records) {
                Map<String, Object> document = toDocument(record);
                bulkBuilder.operations(
                    op ->
                        op.index(
                            idx -> idx.index(collection).id(record.getId()).document(document)));
              }
              return elasticsearchClient.bulk(bulkBuilder.build());
            });

    if (response.errors()) {
      List<String> failures = new ArrayList<>();
      for (BulkResponseItem item : response.items()) {
        if (item.error() != null) {
          failures.add(item.id() + ": " + item.error().reason());
        }
      }
      meterRegistry.counter("vector_store.upsert.errors").increment(failures.size());
      throw new VectorStoreException(
          "Rejected "
              + failures.size()
              + " of "
              + records.size()
              + " vectors in "
              + collection
              + ": "
              + failures);
    }
    log.debug("Upserted {} vectors into {}", records.size(), collection);
    meterRegistry.counter("vector_store.upserted").increment(records.size());
  }

  @Override
  public void delete(UUID tenantId, Collection<UUID> chunkIds) {
    if (chunkIds.isEmpty()) {
      return;
    }
    List<String> ids = chunkIds.stream().map(UUID::toString).toList();
    deleteByQuery(tenantId, Query.of(q -> q.ids(i -> i.values(ids))), "ids");
  }

  @Override
  public void deleteByDocument(UUID tenantId, UUID documentId) {
    deleteByQuery(tenantId, termQuery("documentId", documentId), "document " + documentId);
  }

  @Override
  public void deleteByKnowledgeBase(UUID tenantId, UUID knowledgeBaseId) {
    deleteByQuery(
        tenantId,
        termQuery("knowledgeBaseId", knowledgeBaseId),
        "knowledge base " + knowledgeBaseId);
  }

  @Override
  public long retainOnly(UUID tenantId, UUID knowledgeBaseId, Set<UUID> liveChunkIds) {
    List<String> liveIds = liveChunkIds.stream().map(UUID::toString).toList();
    Query orphans =
        Query.of(
            q ->
                q.bool(
                    b ->
                        b.filter(termQuery("knowledgeBaseId", knowledgeBaseId))
                            .mustNot(Query.of(m -> m.ids(i -> i.values(liveIds))))));
    long removed = deleteByQuery(tenantId, orphans, "orphans of " + knowledgeBaseId);
    if (removed > 0) {
      log.info("Removed {} orphan vectors of knowledge base {}", removed, knowledgeBaseId);
    }
    return removed;
  }

  @Override
  @Timed(value = "vector_store.search", description = "Time for kNN search")
  public List<VectorHit> search(
      UUID tenantId, float[] queryVector, int limit, double scoreThreshold, VectorFilter filter) {
    if (limit <= 0) {
      return List.of();
    }
    String collection = tenantCollections.nameFor(tenantId);
    int numCandidates =
        Math.min(
            MAX_NUM_CANDIDATES,
            Math.max(limit, limit * retrievalConfig.getVectorStore().getNumCandidatesMultiplier()));
    List<Float> vector = toFloatList(queryVector);

    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(collection)
                    .knn(
                        k -> {
                          k.field(EMBEDDING_FIELD)
                              .queryVector(vector)
                              .k(limit)
                              .numCandidates(numCandidates)
                              .similarity((float) scoreThreshold);
                          if (!filter.isEmpty()) {
                            k.filter(knowledgeBaseFilter(filter));
                          }
                          return k;
                        })
                    .size(limit)
                    .source(src -> src.filter(f -> f.excludes(EMBEDDING_FIELD))));

    @SuppressWarnings("unchecked")
    Class<Map<String, Object>> sourceType = (Class<Map<String, Object>>) (Class<?>) Map.class;
    List<Hit<Map<String, Object>>> rawHits =
        execute(
            "search",
            collection,
            () -> {
              try {
                SearchResponse<Map<String, Object>> response =
                    elasticsearchClient.search(request, sourceType);
                return response.hits().hits();
              } catch (ElasticsearchException e) {
                if (isIndexMissing(e)) {
                  log.debug("Collection {} does not exist yet, no vector hits", collection);
                  return List.of();
                }
                throw e;
              }
            });

    List<VectorHit> hits = new ArrayList<>(rawHits.size());
    for (Hit<Map<String, Object>> hit : rawHits) {
      Map<String, Object> source = hit.source();
      if (source == null || hit.score() == null) {
        continue;
      }
      double cosine = toCosine(hit.score());
      if (cosine < scoreThreshold) {
        continue;
      }
      hits.add(
          new VectorHit(
              UUID.fromString(hit.id()),
              uuidOf(source.get("documentId")),
              uuidOf(source.get("knowledgeBaseId")),
              intOf(source.get("orderIndex")),
              (String) source.get("content"),
              cosine));
    }
    hits.sort(HIT_ORDER);
    meterRegistry.counter("vector_store.searches").increment();
    log.debug("kNN search on {} returned {} hits (limit {})", collection, hits.size(), limit);
    return hits;
  }

  @Override
  public CollectionStats stats(UUID tenantId) {
    String collection = tenantCollections.nameFor(tenantId);
    return execute(
        "stats",
        collection,
        () -> {
          BooleanResponse exists =
              elasticsearchClient.indices().exists(ExistsRequest.of(e -> e.index(collection)));
          if (!exists.value()) {
            return new CollectionStats(collection, 0L, CollectionStats.Status.MISSING);
          }
          long count =
              elasticsearchClient.count(CountRequest.of(c -> c.index(collection))).count();
          HealthStatus health =
              elasticsearchClient
                  .cluster()
                  .health(HealthRequest.of(h -> h.index(collection)))
                  .status();
          return new CollectionStats(collection, count, statusOf(health));
        });
  }

  @Override
  public BackendHealth healthCheck() {
    if (!probe()) {
      return BackendHealth.down("Elasticsearch unreachable: " + lastFailure);
    }
    return BackendHealth.up("Elasticsearch reachable");
  }

  private long deleteByQuery(UUID tenantId, Query query, String description) {
    String collection = tenantCollections.nameFor(tenantId);
    Long deleted =
        execute(
            "delete",
            collection,
            () -> {
              try {
                return elasticsearchClient
                    .deleteByQuery(
                        DeleteByQueryRequest.of(
                            d ->
                                d.index(collection)
                                    .query(query)
                                    .conflicts(Conflicts.Proceed)
                                    .refresh(true)
                                    .ignoreUnavailable(true)))
                    .deleted();
              } catch (ElasticsearchException e) {
                if (isIndexMissing(e)) {
                  return 0L;
                }
                throw e;
              }
            });
    long removed = deleted == null ? 0L : deleted;
    log.debug("Deleted {} vectors from {} ({})", removed, collection, description);
    meterRegistry.counter("vector_store.deleted").increment(removed);
    return removed;
  }

  private void verifyDimensions(String collection, int dimensions) throws IOException {
    GetMappingResponse mapping =
        elasticsearchClient.indices().getMapping(GetMappingRequest.of(g -> g.index(collection)));
    IndexMappingRecord record = mapping.get(collection);
    if (record == null || record.mappings() == null) {
      return;
    }
    Property embedding = record.mappings().properties().get(EMBEDDING_FIELD);
    if (embedding == null || !embedding.isDenseVector()) {
      throw new ConfigException(
          "Collection " + collection + " has no dense_vector field '" + EMBEDDING_FIELD + "'");
    }
    Integer actual = embedding.denseVector().dims();
    if (actual != null && actual != dimensions) {
      throw new ConfigException(
          "Collection "
              + collection
              + " stores "
              + actual
              + "-dimension vectors, requested "
              + dimensions
              + ". Rebuild the tenant collection to change models.");
    }
  }

  private Map<String, Property> defineIndexProperties(int dimensions, DistanceMetric metric) {
    Map<String, Property> properties = new HashMap<>();
    properties.put("chunkId", Property.of(p -> p.keyword(k -> k)));
    properties.put("documentId", Property.of(p -> p.keyword(k -> k)));
    properties.put("knowledgeBaseId", Property.of(p -> p.keyword(k -> k)));
    properties.put("content", Property.of(p -> p.text(t -> t)));
    properties.put("orderIndex", Property.of(p -> p.integer(i -> i)));
    properties.put("charCount", Property.of(p -> p.integer(i -> i)));
    properties.put("tokenCount", Property.of(p -> p.integer(i -> i)));
    properties.put("metadata", Property.of(p -> p.object(o -> o.enabled(false))));
    properties.put(
        EMBEDDING_FIELD,
        Property.of(
            p ->
                p.denseVector(
                    d -> d.dims(dimensions).index(true).similarity(metric.similarity()))));
    return properties;
  }

  private Map<String, Object> toDocument(VectorRecord record) {
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("chunkId", record.getChunkId().toString());
    document.put("documentId", record.getDocumentId().toString());
    document.put("knowledgeBaseId", record.getKnowledgeBaseId().toString());
    document.put("content", record.getContent());
    document.put("orderIndex", record.getOrderIndex());
    document.put("charCount", record.getCharCount());
    document.put("tokenCount", record.getTokenCount());
    document.put("metadata", record.getMetadata() == null ? Map.of() : record.getMetadata());
    document.put(EMBEDDING_FIELD, record.getVector());
    return document;
  }

  private <T> T execute(String operation, String collection, IoCall<T> call) {
    if (!available.get()) {
      meterRegistry.counter("vector_store.short_circuit", "operation", operation).increment();
      throw new BackendUnavailableException(
          "Vector store is degraded, " + operation + " on " + collection + " skipped");
    }
    try {
      return call.run();
    } catch (IOException e) {
      lastFailure = e.getMessage();
      if (available.compareAndSet(true, false)) {
        log.warn("Vector store is DEGRADED after {} failure: {}", operation, e.getMessage());
        meterRegistry.counter("vector_store.state_changes", "state", "degraded").increment();
      }
      throw new BackendUnavailableException(
          "Vector store " + operation + " on " + collection + " failed: " + e.getMessage(), e);
    } catch (ElasticsearchException e) {
      log.error("Vector store {} on {} rejected: {}", operation, collection, e.getMessage());
      meterRegistry.counter("vector_store.errors", "operation", operation).increment();
      throw new VectorStoreException(
          "Vector store " + operation + " on " + collection + " failed: " + e.getMessage(), e);
    }
  }

  private static Query termQuery(String field, UUID value) {
    return Query.of(q -> q.term(t -> t.field(field).value(value.toString())));
  }

  private static Query knowledgeBaseFilter(VectorFilter filter) {
    List<FieldValue> values =
        filter.knowledgeBaseIds().stream()
            .map(UUID::toString)
            .sorted()
            .map(FieldValue::of)
            .toList();
    return Query.of(q -> q.terms(t -> t.field("knowledgeBaseId").terms(v -> v.value(values))));
  }

  /** Converts an Elasticsearch cosine score {@code (1 + cos) / 2} back to cosine similarity. */
  static double toCosine(double score) {
    return 2.0 * score - 1.0;
  }

  private static CollectionStats.Status statusOf(HealthStatus health) {
    if (health == HealthStatus.Green) {
      return CollectionStats.Status.GREEN;
    }
    if (health == HealthStatus.Red) {
      return CollectionStats.Status.RED;
    }
    return CollectionStats.Status.YELLOW;
  }

  private static boolean isIndexMissing(ElasticsearchException e) {
    return "index_not_found_exception".equals(errorType(e));
  }

  private static String errorType(ElasticsearchException e) {
    return e.error() == null ? null : e.error().type();
  }

  private static List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }

  private static UUID uuidOf(Object value) {
    return value == null ? null : UUID.fromString(value.toString());
  }

  private static int intOf(Object value) {
    return value instanceof Number n ? n.intValue() : 0;
  }

  @FunctionalInterface
  private interface IoCall<T> {
    T run() throws IOException;
  }
}
