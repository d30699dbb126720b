package com.flamingo.ai.knowledge.service.health;

import com.flamingo.ai.knowledge.elasticsearch.BackendHealth;
import com.flamingo.ai.knowledge.elasticsearch.CollectionStats;
import java.util.UUID;

/** Service interface for health checks and tenant statistics. */
public interface HealthService {

  /** Probes the vector store. */
  BackendHealth healthCheck();

  /**
   * Gets the vector collection statistics of a tenant.
   *
   * @return stats with status UNAVAILABLE while the vector store is degraded
   */
  CollectionStats getStats(UUID tenantId);

  /**
   * Gets vector, chunk and usage counts of a tenant.
   *
   * @param tenantId the tenant
   * @return tenant statistics
   */
  TenantStats getTenantStats(UUID tenantId);
}
