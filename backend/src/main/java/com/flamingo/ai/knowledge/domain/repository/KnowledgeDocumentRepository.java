package com.flamingo.ai.knowledge.domain.repository;

import com.flamingo.ai.knowledge.domain.entity.KnowledgeDocument;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for KnowledgeDocument entities. */
@Repository
public interface KnowledgeDocumentRepository extends JpaRepository<KnowledgeDocument, UUID> {

  /** Finds a document together with its knowledge base. */
  @Query("SELECT d FROM KnowledgeDocument d JOIN FETCH d.knowledgeBase WHERE d.id = :id")
  Optional<KnowledgeDocument> findWithKnowledgeBaseById(@Param("id") UUID id);

  /** Finds all documents of a knowledge base in creation order. */
  List<KnowledgeDocument> findByKnowledgeBaseIdOrderByCreatedAtAscIdAsc(UUID knowledgeBaseId);

  /** Counts documents of a knowledge base. */
  long countByKnowledgeBaseId(UUID knowledgeBaseId);

  /** Deletes all documents of a knowledge base. Chunks must be removed first. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("DELETE FROM KnowledgeDocument d WHERE d.knowledgeBase.id = :knowledgeBaseId")
  int deleteByKnowledgeBaseId(@Param("knowledgeBaseId") UUID knowledgeBaseId);
}
