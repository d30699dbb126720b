package com.flamingo.ai.knowledge.service.knowledgebase;

import com.flamingo.ai.knowledge.domain.entity.KnowledgeBase;
import com.flamingo.ai.knowledge.domain.entity.KnowledgeDocument;
import com.flamingo.ai.knowledge.domain.model.KnowledgeBaseSettings;
import java.util.List;
import java.util.UUID;

/** Service interface for knowledge base, document and chunk lifecycle. */
public interface KnowledgeBaseService {

  /**
   * Creates a knowledge base for a tenant.
   *
   * @param settings initial settings, or null for the configured defaults
   * @return the created knowledge base
   * @throws com.flamingo.ai.knowledge.exception.ConfigException if the settings are invalid or
   *     name an embedding model other than the one the tenant's knowledge bases already use
   */
  KnowledgeBase createKnowledgeBase(
      UUID tenantId, String name, String description, KnowledgeBaseSettings settings);

  /**
   * Gets a knowledge base by ID.
   *
   * @throws com.flamingo.ai.knowledge.exception.KnowledgeBaseNotFoundException if not found
   */
  KnowledgeBase getKnowledgeBase(UUID knowledgeBaseId);

  List<KnowledgeBase> listKnowledgeBases(UUID tenantId);

  /** Settings used for knowledge bases created without explicit settings. */
  KnowledgeBaseSettings defaultSettings();

  /**
   * Checks settings against value ranges and the embedding model catalogue.
   *
   * @throws com.flamingo.ai.knowledge.exception.ConfigException describing the first violation
   */
  void validateSettings(KnowledgeBaseSettings settings);

  /**
   * Replaces the settings of a knowledge base. The settings version is incremented when anything
   * changed; the existing vectors then need a rebuild.
   *
   * @return the updated knowledge base
   * @throws com.flamingo.ai.knowledge.exception.ConfigException if the settings are invalid or
   *     change the embedding model while the tenant has other knowledge bases
   */
  KnowledgeBase updateSettings(UUID knowledgeBaseId, KnowledgeBaseSettings settings);

  /**
   * Adds a document in PENDING state. Indexing is a separate step.
   *
   * @return the stored document
   */
  KnowledgeDocument addDocument(UUID knowledgeBaseId, NewDocument document);

  List<KnowledgeDocument> listDocuments(UUID knowledgeBaseId);

  /**
   * Deletes one chunk and renumbers the following chunks of its document.
   *
   * @return false if the chunk did not exist
   */
  boolean deleteChunk(UUID chunkId);

  /**
   * Deletes a document with its chunks and vectors.
   *
   * @throws com.flamingo.ai.knowledge.exception.DocumentNotFoundException if not found
   */
  void deleteDocument(UUID documentId);

  /** Deletes a knowledge base with its documents, chunks and vectors. */
  void deleteKnowledgeBase(UUID knowledgeBaseId);
}
