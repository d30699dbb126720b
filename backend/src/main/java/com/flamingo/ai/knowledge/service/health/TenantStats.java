package com.flamingo.ai.knowledge.service.health;

import com.flamingo.ai.knowledge.elasticsearch.CollectionStats;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.Builder;

/** Statistics of one tenant. */
@Builder
public record TenantStats(
    UUID tenantId,
    CollectionStats vectors,
    long chunkCount,
    long retrievalsToday,
    LocalDateTime timestamp) {

  /** Whether the vector index holds fewer records than there are chunks. */
  public boolean needsRebuild() {
    return vectors.status() != CollectionStats.Status.UNAVAILABLE && vectors.count() < chunkCount;
  }
}
