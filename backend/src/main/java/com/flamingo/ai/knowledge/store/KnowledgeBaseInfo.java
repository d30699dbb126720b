package com.flamingo.ai.knowledge.store;

import com.flamingo.ai.knowledge.domain.entity.KnowledgeBase;
import com.flamingo.ai.knowledge.domain.model.KnowledgeBaseSettings;
import java.util.UUID;

/** Read-only view of a knowledge base. */
public record KnowledgeBaseInfo(
    UUID id, UUID tenantId, String name, KnowledgeBaseSettings settings, long settingsVersion) {

  public static KnowledgeBaseInfo from(KnowledgeBase knowledgeBase) {
    return new KnowledgeBaseInfo(
        knowledgeBase.getId(),
        knowledgeBase.getTenantId(),
        knowledgeBase.getName(),
        knowledgeBase.getSettings(),
        knowledgeBase.getSettingsVersion());
  }
}
