package com.flamingo.ai.knowledge.domain.repository;

import com.flamingo.ai.knowledge.domain.entity.DocumentChunk;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * Repository for DocumentChunk entities.
 *
 * <p>Lookups that feed search results fetch the owning document and knowledge base eagerly and are
 * always scoped by tenant.
 */
@Repository
public interface DocumentChunkRepository extends JpaRepository<DocumentChunk, UUID> {

  /** Finds a chunk with its document and knowledge base. */
  @Query(
      "SELECT c FROM DocumentChunk c JOIN FETCH c.document d JOIN FETCH d.knowledgeBase "
          + "WHERE c.id = :id")
  Optional<DocumentChunk> findWithContextById(@Param("id") UUID id);

  /** Finds the chunks of a document by order index. */
  @Query(
      "SELECT c FROM DocumentChunk c JOIN FETCH c.document d JOIN FETCH d.knowledgeBase "
          + "WHERE d.id = :documentId ORDER BY c.orderIndex ASC")
  List<DocumentChunk> findWithContextByDocumentId(@Param("documentId") UUID documentId);

  /** Finds chunks by id, restricted to one tenant. */
  @Query(
      "SELECT c FROM DocumentChunk c JOIN FETCH c.document d JOIN FETCH d.knowledgeBase kb "
          + "WHERE kb.tenantId = :tenantId AND c.id IN :ids")
  List<DocumentChunk> findWithContextByTenantAndIds(
      @Param("tenantId") UUID tenantId, @Param("ids") Collection<UUID> ids);

  /** Finds chunk ids of a document. */
  @Query("SELECT c.id FROM DocumentChunk c WHERE c.document.id = :documentId")
  List<UUID> findIdsByDocumentId(@Param("documentId") UUID documentId);

  /** Finds chunks of a tenant whose content contains a lower-cased pattern. */
  @Query(
      "SELECT c FROM DocumentChunk c JOIN FETCH c.document d JOIN FETCH d.knowledgeBase kb "
          + "WHERE kb.tenantId = :tenantId AND LOWER(c.content) LIKE :pattern "
          + "ORDER BY d.createdAt ASC, c.orderIndex ASC")
  List<DocumentChunk> searchContent(
      @Param("tenantId") UUID tenantId, @Param("pattern") String pattern, Pageable pageable);

  /** Same as {@link #searchContent} restricted to the given knowledge bases. */
  @Query(
      "SELECT c FROM DocumentChunk c JOIN FETCH c.document d JOIN FETCH d.knowledgeBase kb "
          + "WHERE kb.tenantId = :tenantId AND kb.id IN :knowledgeBaseIds "
          + "AND LOWER(c.content) LIKE :pattern "
          + "ORDER BY d.createdAt ASC, c.orderIndex ASC")
  List<DocumentChunk> searchContentInKnowledgeBases(
      @Param("tenantId") UUID tenantId,
      @Param("knowledgeBaseIds") Collection<UUID> knowledgeBaseIds,
      @Param("pattern") String pattern,
      Pageable pageable);

  /** Counts chunks across a tenant's knowledge bases. */
  @Query(
      "SELECT COUNT(c) FROM DocumentChunk c JOIN c.document d JOIN d.knowledgeBase kb "
          + "WHERE kb.tenantId = :tenantId")
  long countByTenantId(@Param("tenantId") UUID tenantId);

  /** Shifts the order index of the chunks following a removed one. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE DocumentChunk c SET c.orderIndex = c.orderIndex - 1 "
          + "WHERE c.document.id = :documentId AND c.orderIndex > :orderIndex")
  int closeOrderGap(@Param("documentId") UUID documentId, @Param("orderIndex") int orderIndex);

  /** Deletes all chunks of a document. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("DELETE FROM DocumentChunk c WHERE c.document.id = :documentId")
  int deleteByDocumentId(@Param("documentId") UUID documentId);

  /** Deletes all chunks of a knowledge base. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "DELETE FROM DocumentChunk c WHERE c.document.id IN "
          + "(SELECT d.id FROM KnowledgeDocument d WHERE d.knowledgeBase.id = :knowledgeBaseId)")
  int deleteByKnowledgeBaseId(@Param("knowledgeBaseId") UUID knowledgeBaseId);
}
