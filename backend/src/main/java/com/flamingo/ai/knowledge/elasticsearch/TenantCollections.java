package com.flamingo.ai.knowledge.elasticsearch;

import com.flamingo.ai.knowledge.config.RetrievalConfig;
import java.util.Locale;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Derives the index name of a tenant: the configured prefix plus the tenant id. */
@Component
@RequiredArgsConstructor
public class TenantCollections {

  private final RetrievalConfig retrievalConfig;

  public String nameFor(UUID tenantId) {
    if (tenantId == null) {
      throw new IllegalArgumentException("tenantId is required");
    }
    String prefix = retrievalConfig.getVectorStore().getCollectionPrefix();
    return (prefix + tenantId.toString().replace('-', '_')).toLowerCase(Locale.ROOT);
  }
}
