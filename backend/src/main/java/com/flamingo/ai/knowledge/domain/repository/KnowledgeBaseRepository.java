package com.flamingo.ai.knowledge.domain.repository;

import com.flamingo.ai.knowledge.domain.entity.KnowledgeBase;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for KnowledgeBase entities. */
@Repository
public interface KnowledgeBaseRepository extends JpaRepository<KnowledgeBase, UUID> {

  /** Finds all knowledge bases of a tenant, oldest first. */
  List<KnowledgeBase> findByTenantIdOrderByCreatedAtAscIdAsc(UUID tenantId);
}
