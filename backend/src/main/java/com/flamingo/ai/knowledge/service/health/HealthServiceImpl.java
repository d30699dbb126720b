package com.flamingo.ai.knowledge.service.health;

import com.flamingo.ai.knowledge.elasticsearch.BackendHealth;
import com.flamingo.ai.knowledge.elasticsearch.CollectionStats;
import com.flamingo.ai.knowledge.elasticsearch.TenantCollections;
import com.flamingo.ai.knowledge.elasticsearch.VectorStore;
import com.flamingo.ai.knowledge.exception.BackendUnavailableException;
import com.flamingo.ai.knowledge.service.support.BoundedCalls;
import com.flamingo.ai.knowledge.service.usage.UsageService;
import com.flamingo.ai.knowledge.store.ChunkStore;
import io.micrometer.core.annotation.Timed;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of HealthService for health checks and statistics. */
@Service
@RequiredArgsConstructor
@Slf4j
public class HealthServiceImpl implements HealthService {

  private final VectorStore vectorStore;
  private final TenantCollections tenantCollections;
  private final ChunkStore chunkStore;
  private final UsageService usageService;
  private final BoundedCalls boundedCalls;

  @Override
  public BackendHealth healthCheck() {
    return vectorStore.healthCheck();
  }

  @Override
  @Timed(value = "health.stats", description = "Time to get collection stats")
  public CollectionStats getStats(UUID tenantId) {
    try {
      return boundedCalls.call(BoundedCalls.VECTOR_STORE, () -> vectorStore.stats(tenantId));
    } catch (BackendUnavailableException e) {
      log.debug("Vector store unavailable for stats of tenant {}: {}", tenantId, e.getMessage());
      return CollectionStats.unavailable(tenantCollections.nameFor(tenantId));
    }
  }

  @Override
  public TenantStats getTenantStats(UUID tenantId) {
    CollectionStats vectors = getStats(tenantId);
    long chunks =
        boundedCalls.call(BoundedCalls.CHUNK_STORE, () -> chunkStore.countChunks(tenantId));
    long retrievals = usageService.retrievalsOn(tenantId, LocalDate.now(ZoneOffset.UTC));
    return TenantStats.builder()
        .tenantId(tenantId)
        .vectors(vectors)
        .chunkCount(chunks)
        .retrievalsToday(retrievals)
        .timestamp(LocalDateTime.now())
        .build();
  }
}
