package com.flamingo.ai.knowledge.store;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read access to the relational source of truth for knowledge bases, documents and chunks.
 *
 * <p>Lookups that can return chunks of several knowledge bases take the tenant id and never return
 * rows of another tenant.
 */
public interface ChunkStore {

  Optional<KnowledgeBaseInfo> findKnowledgeBase(UUID knowledgeBaseId);

  /** Knowledge bases of a tenant, oldest first. */
  List<KnowledgeBaseInfo> listKnowledgeBases(UUID tenantId);

  /** Documents of a knowledge base by creation time, then id. */
  List<DocumentInfo> listDocuments(UUID knowledgeBaseId);

  Optional<ChunkContext> getChunk(UUID chunkId);

  /** Chunks of a document by order index. */
  List<ChunkContext> listChunksByDocument(UUID documentId);

  /** Chunks with the given ids that belong to the tenant; unknown ids are skipped. */
  List<ChunkContext> findChunks(UUID tenantId, Collection<UUID> chunkIds);

  /**
   * Chunks of the tenant whose content contains at least one of the terms, case-insensitively.
   * Chunks with more term occurrences come first; ties keep the order they were first matched in.
   *
   * @param knowledgeBaseIds restricts the search; empty means every knowledge base of the tenant
   * @param limit maximum number of chunks returned
   */
  List<ChunkContext> searchText(
      UUID tenantId, Collection<UUID> knowledgeBaseIds, List<String> terms, int limit);

  long countChunks(UUID tenantId);
}
