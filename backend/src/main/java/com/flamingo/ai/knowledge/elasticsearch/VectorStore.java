package com.flamingo.ai.knowledge.elasticsearch;

import com.flamingo.ai.knowledge.exception.BackendUnavailableException;
import com.flamingo.ai.knowledge.exception.ConfigException;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Tenant-partitioned vector index. Every operation is confined to the collection of the tenant
 * passed as first argument.
 *
 * <p>While the store is degraded every data operation throws {@link BackendUnavailableException}
 * without contacting the backend.
 */
public interface VectorStore {

  /**
   * Creates the tenant collection if it does not exist.
   *
   * @throws ConfigException if the collection exists with other dimensions
   */
  void ensureCollection(UUID tenantId, int dimensions, DistanceMetric metric);

  /** Inserts or replaces records by chunk id. */
  void upsert(UUID tenantId, List<VectorRecord> records);

  /** Deletes records by chunk id. Missing ids and a missing collection are not errors. */
  void delete(UUID tenantId, Collection<UUID> chunkIds);

  void deleteByDocument(UUID tenantId, UUID documentId);

  void deleteByKnowledgeBase(UUID tenantId, UUID knowledgeBaseId);

  /**
   * Deletes the records of a knowledge base whose chunk id is not in {@code liveChunkIds}.
   *
   * @return number of records removed
   */
  long retainOnly(UUID tenantId, UUID knowledgeBaseId, Set<UUID> liveChunkIds);

  /**
   * Finds the records most similar to the query vector.
   *
   * @param scoreThreshold minimum cosine similarity
   * @return hits by descending score, ties by order index then chunk id
   */
  List<VectorHit> search(
      UUID tenantId, float[] queryVector, int limit, double scoreThreshold, VectorFilter filter);

  CollectionStats stats(UUID tenantId);

  BackendHealth healthCheck();

  /** Whether the store is currently considered reachable. */
  boolean isAvailable();

  /**
   * Tests connectivity now and updates the availability state.
   *
   * @return true if the backend answered
   */
  boolean probe();
}
