package com.flamingo.ai.knowledge.testsupport;

import com.flamingo.ai.knowledge.elasticsearch.BackendHealth;
import com.flamingo.ai.knowledge.elasticsearch.CollectionStats;
import com.flamingo.ai.knowledge.elasticsearch.DistanceMetric;
import com.flamingo.ai.knowledge.elasticsearch.VectorFilter;
import com.flamingo.ai.knowledge.elasticsearch.VectorHit;
import com.flamingo.ai.knowledge.elasticsearch.VectorRecord;
import com.flamingo.ai.knowledge.elasticsearch.VectorStore;
import com.flamingo.ai.knowledge.exception.BackendUnavailableException;
import com.flamingo.ai.knowledge.exception.ConfigException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/** Vector store keeping one map of records per tenant, scored by exact cosine similarity. */
public class InMemoryVectorStore implements VectorStore {

  private final Map<UUID, Map<UUID, VectorRecord>> collections = new ConcurrentHashMap<>();
  private final Map<UUID, Integer> dimensionsByTenant = new ConcurrentHashMap<>();
  private final Set<UUID> failingChunkIds = ConcurrentHashMap.newKeySet();
  private final AtomicInteger upserts = new AtomicInteger();
  private volatile boolean available = true;
  private volatile boolean searchFails;

  public void setAvailable(boolean available) {
    this.available = available;
  }

  /** Makes searches throw while other operations keep working. */
  public void setSearchFails(boolean searchFails) {
    this.searchFails = searchFails;
  }

  /** Makes upserts containing this chunk fail. */
  public void failUpsertsOf(UUID chunkId) {
    failingChunkIds.add(chunkId);
  }

  public int upsertCalls() {
    return upserts.get();
  }

  public Map<UUID, VectorRecord> records(UUID tenantId) {
    return collections.getOrDefault(tenantId, Map.of());
  }

  /** Writes a record directly, bypassing availability checks. */
  public void put(UUID tenantId, VectorRecord record) {
    collections
        .computeIfAbsent(tenantId, id -> new ConcurrentHashMap<>())
        .put(record.getChunkId(), record);
  }

  @Override
  public void ensureCollection(UUID tenantId, int dimensions, DistanceMetric metric) {
    checkAvailable();
    Integer existing = dimensionsByTenant.putIfAbsent(tenantId, dimensions);
    if (existing != null && existing != dimensions) {
      throw new ConfigException("collection has " + existing + " dimensions, not " + dimensions);
    }
    collections.computeIfAbsent(tenantId, id -> new ConcurrentHashMap<>());
  }

  @Override
  public void upsert(UUID tenantId, List<VectorRecord> records) {
    checkAvailable();
    upserts.incrementAndGet();
    for (VectorRecord record : records) {
      if (failingChunkIds.contains(record.getChunkId())) {
        throw new BackendUnavailableException("upsert rejected for " + record.getChunkId());
      }
    }
    for (VectorRecord record : records) {
      put(tenantId, record);
    }
  }

  @Override
  public void delete(UUID tenantId, Collection<UUID> chunkIds) {
    checkAvailable();
    Map<UUID, VectorRecord> records = collections.get(tenantId);
    if (records != null) {
      chunkIds.forEach(records::remove);
    }
  }

  @Override
  public void deleteByDocument(UUID tenantId, UUID documentId) {
    checkAvailable();
    Map<UUID, VectorRecord> records = collections.get(tenantId);
    if (records != null) {
      records.values().removeIf(record -> documentId.equals(record.getDocumentId()));
    }
  }

  @Override
  public void deleteByKnowledgeBase(UUID tenantId, UUID knowledgeBaseId) {
    checkAvailable();
    Map<UUID, VectorRecord> records = collections.get(tenantId);
    if (records != null) {
      records.values().removeIf(record -> knowledgeBaseId.equals(record.getKnowledgeBaseId()));
    }
  }

  @Override
  public long retainOnly(UUID tenantId, UUID knowledgeBaseId, Set<UUID> liveChunkIds) {
    checkAvailable();
    Map<UUID, VectorRecord> records = collections.get(tenantId);
    if (records == null) {
      return 0;
    }
    long before = records.size();
    records
        .values()
        .removeIf(
            record ->
                knowledgeBaseId.equals(record.getKnowledgeBaseId())
                    && !liveChunkIds.contains(record.getChunkId()));
    return before - records.size();
  }

  @Override
  public List<VectorHit> search(
      UUID tenantId, float[] queryVector, int limit, double scoreThreshold, VectorFilter filter) {
    checkAvailable();
    if (searchFails) {
      throw new BackendUnavailableException("search failed");
    }
    List<VectorHit> hits = new ArrayList<>();
    for (VectorRecord record : records(tenantId).values()) {
      if (!filter.accepts(record.getKnowledgeBaseId())) {
        continue;
      }
      double score = cosine(queryVector, record.getVector());
      if (score >= scoreThreshold) {
        hits.add(
            new VectorHit(
                record.getChunkId(),
                record.getDocumentId(),
                record.getKnowledgeBaseId(),
                record.getOrderIndex(),
                record.getContent(),
                score));
      }
    }
    hits.sort(
        Comparator.comparingDouble(VectorHit::score)
            .reversed()
            .thenComparingInt(VectorHit::orderIndex)
            .thenComparing(hit -> hit.chunkId().toString()));
    return hits.size() > limit ? new ArrayList<>(hits.subList(0, limit)) : hits;
  }

  @Override
  public CollectionStats stats(UUID tenantId) {
    checkAvailable();
    Map<UUID, VectorRecord> records = collections.get(tenantId);
    if (records == null) {
      return new CollectionStats(tenantId.toString(), 0, CollectionStats.Status.MISSING);
    }
    return new CollectionStats(tenantId.toString(), records.size(), CollectionStats.Status.GREEN);
  }

  @Override
  public BackendHealth healthCheck() {
    return available ? BackendHealth.up("in-memory") : BackendHealth.down("in-memory down");
  }

  @Override
  public boolean isAvailable() {
    return available;
  }

  @Override
  public boolean probe() {
    return available;
  }

  private void checkAvailable() {
    if (!available) {
      throw new BackendUnavailableException("in-memory vector store is down");
    }
  }

  static double cosine(float[] a, float[] b) {
    double dot = 0;
    double normA = 0;
    double normB = 0;
    for (int i = 0; i < a.length; i++) {
      dot += a[i] * b[i];
      normA += a[i] * a[i];
      normB += b[i] * b[i];
    }
    return normA == 0 || normB == 0 ? 0 : dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }
}
