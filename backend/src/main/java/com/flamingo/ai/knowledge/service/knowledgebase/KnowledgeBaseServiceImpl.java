package com.flamingo.ai.knowledge.service.knowledgebase;

import com.flamingo.ai.knowledge.config.RetrievalConfig;
import com.flamingo.ai.knowledge.domain.entity.DocumentChunk;
import com.flamingo.ai.knowledge.domain.entity.KnowledgeBase;
import com.flamingo.ai.knowledge.domain.entity.KnowledgeDocument;
import com.flamingo.ai.knowledge.domain.enums.DocumentType;
import com.flamingo.ai.knowledge.domain.model.KnowledgeBaseSettings;
import com.flamingo.ai.knowledge.domain.repository.DocumentChunkRepository;
import com.flamingo.ai.knowledge.domain.repository.KnowledgeBaseRepository;
import com.flamingo.ai.knowledge.domain.repository.KnowledgeDocumentRepository;
import com.flamingo.ai.knowledge.elasticsearch.VectorStore;
import com.flamingo.ai.knowledge.exception.ConfigException;
import com.flamingo.ai.knowledge.exception.DocumentNotFoundException;
import com.flamingo.ai.knowledge.exception.KnowledgeBaseNotFoundException;
import com.flamingo.ai.knowledge.service.embedding.EmbeddingClient;
import com.flamingo.ai.knowledge.service.support.BoundedCalls;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Implementation of the KnowledgeBaseService.
 *
 * <p>Deletes remove vectors before rows. A vector cleanup failure is logged and counted but never
 * blocks the relational delete: retrieval drops vectors without a chunk row and the next rebuild
 * sweeps them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KnowledgeBaseServiceImpl implements KnowledgeBaseService {

  private final KnowledgeBaseRepository knowledgeBaseRepository;
  private final KnowledgeDocumentRepository documentRepository;
  private final DocumentChunkRepository chunkRepository;
  private final VectorStore vectorStore;
  private final EmbeddingClient embeddingClient;
  private final BoundedCalls boundedCalls;
  private final RetrievalConfig retrievalConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional
  @Timed(value = "knowledge_base.create", description = "Time to create a knowledge base")
  public KnowledgeBase createKnowledgeBase(
      UUID tenantId, String name, String description, KnowledgeBaseSettings settings) {
    if (tenantId == null) {
      throw new IllegalArgumentException("tenantId is required");
    }
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("name is required");
    }
    KnowledgeBaseSettings effective = settings != null ? settings : defaultSettings();
    validateSettings(effective);
    requireTenantEmbeddingModel(tenantId, null, effective);

    KnowledgeBase knowledgeBase =
        KnowledgeBase.builder().tenantId(tenantId).name(name).description(description).build();
    knowledgeBase.applySettings(effective);
    knowledgeBase.setSettingsVersion(1L);

    KnowledgeBase saved = knowledgeBaseRepository.save(knowledgeBase);
    meterRegistry.counter("knowledge_base.created").increment();
    log.info("Created knowledge base {} for tenant {}", saved.getId(), tenantId);
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  public KnowledgeBase getKnowledgeBase(UUID knowledgeBaseId) {
    return knowledgeBaseRepository
        .findById(knowledgeBaseId)
        .orElseThrow(() -> new KnowledgeBaseNotFoundException(knowledgeBaseId));
  }

  @Override
  @Transactional(readOnly = true)
  public List<KnowledgeBase> listKnowledgeBases(UUID tenantId) {
    return knowledgeBaseRepository.findByTenantIdOrderByCreatedAtAscIdAsc(tenantId);
  }

  @Override
  public KnowledgeBaseSettings defaultSettings() {
    RetrievalConfig.Embedding embedding = retrievalConfig.getEmbedding();
    String model = embedding.getDefaultModel();
    Integer dimensions = embedding.getModels().get(model);
    if (dimensions == null) {
      throw new ConfigException("Default embedding model " + model + " is not in the catalogue");
    }
    return KnowledgeBaseSettings.builder()
        .chunkingStrategy(retrievalConfig.getChunking().getStrategy())
        .chunkSize(retrievalConfig.getChunking().getSize())
        .chunkOverlap(retrievalConfig.getChunking().getOverlap())
        .embeddingModel(model)
        .embeddingDimensions(dimensions)
        .similarityThreshold(retrievalConfig.getSearch().getDefaultThreshold())
        .maxResults(retrievalConfig.getSearch().getDefaultLimit())
        .build();
  }

  @Override
  public void validateSettings(KnowledgeBaseSettings settings) {
    if (settings == null) {
      throw new ConfigException("settings are required");
    }
    settings.validate(retrievalConfig.getSearch().getMaxLimit());
    OptionalInt known = embeddingClient.dimensions(settings.embeddingModel());
    if (known.isPresent() && known.getAsInt() != settings.embeddingDimensions()) {
      throw new ConfigException(
          "Model "
              + settings.embeddingModel()
              + " produces "
              + known.getAsInt()
              + " dimensions, not "
              + settings.embeddingDimensions());
    }
  }

  /**
   * All knowledge bases of a tenant share one vector index, so they must embed with the same model
   * and dimensions. The knowledge base being updated is left out of the comparison.
   */
  private void requireTenantEmbeddingModel(
      UUID tenantId, UUID excludedId, KnowledgeBaseSettings settings) {
    for (KnowledgeBase other :
        knowledgeBaseRepository.findByTenantIdOrderByCreatedAtAscIdAsc(tenantId)) {
      if (other.getId() != null && other.getId().equals(excludedId)) {
        continue;
      }
      if (!other.getEmbeddingModel().equals(settings.embeddingModel())
          || other.getEmbeddingDimensions() != settings.embeddingDimensions()) {
        throw new ConfigException(
            "Tenant "
                + tenantId
                + " already embeds with "
                + other.getEmbeddingModel()
                + "/"
                + other.getEmbeddingDimensions()
                + " (knowledge base "
                + other.getId()
                + "), cannot use "
                + settings.embeddingModel()
                + "/"
                + settings.embeddingDimensions());
      }
    }
  }

  @Override
  @Transactional
  @Timed(value = "knowledge_base.update_settings", description = "Time to update settings")
  public KnowledgeBase updateSettings(UUID knowledgeBaseId, KnowledgeBaseSettings settings) {
    validateSettings(settings);
    KnowledgeBase knowledgeBase = getKnowledgeBase(knowledgeBaseId);
    requireTenantEmbeddingModel(knowledgeBase.getTenantId(), knowledgeBaseId, settings);
    if (knowledgeBase.applySettings(settings)) {
      log.info(
          "Settings of knowledge base {} changed, now version {}; vectors need a rebuild",
          knowledgeBaseId,
          knowledgeBase.getSettingsVersion());
      meterRegistry.counter("knowledge_base.settings_changed").increment();
    }
    return knowledgeBaseRepository.save(knowledgeBase);
  }

  @Override
  @Transactional
  public KnowledgeDocument addDocument(UUID knowledgeBaseId, NewDocument document) {
    if (document == null || document.title() == null || document.title().isBlank()) {
      throw new IllegalArgumentException("document title is required");
    }
    KnowledgeBase knowledgeBase = getKnowledgeBase(knowledgeBaseId);
    KnowledgeDocument saved =
        documentRepository.save(
            KnowledgeDocument.builder()
                .knowledgeBase(knowledgeBase)
                .type(document.type() != null ? document.type() : DocumentType.RICH_TEXT)
                .title(document.title())
                .filename(document.filename())
                .mimeType(document.mimeType())
                .contentRef(document.contentRef())
                .content(document.content())
                .build());
    log.info("Added document {} to knowledge base {}", saved.getId(), knowledgeBaseId);
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  public List<KnowledgeDocument> listDocuments(UUID knowledgeBaseId) {
    return documentRepository.findByKnowledgeBaseIdOrderByCreatedAtAscIdAsc(knowledgeBaseId);
  }

  @Override
  @Transactional
  @Timed(value = "chunk.delete", description = "Time to delete a chunk")
  public boolean deleteChunk(UUID chunkId) {
    Optional<DocumentChunk> found = chunkRepository.findWithContextById(chunkId);
    if (found.isEmpty()) {
      return false;
    }
    DocumentChunk chunk = found.get();
    KnowledgeDocument document = chunk.getDocument();
    UUID tenantId = document.getKnowledgeBase().getTenantId();
    cleanUpVectors("chunk", chunkId, () -> vectorStore.delete(tenantId, List.of(chunkId)));

    int orderIndex = chunk.getOrderIndex();
    chunkRepository.delete(chunk);
    chunkRepository.flush();
    int shifted = chunkRepository.closeOrderGap(document.getId(), orderIndex);

    KnowledgeDocument owner = documentRepository.findById(document.getId()).orElseThrow();
    if (owner.getChunkCount() != null && owner.getChunkCount() > 0) {
      owner.setChunkCount(owner.getChunkCount() - 1);
      documentRepository.save(owner);
    }
    log.info("Deleted chunk {} of document {}, renumbered {}", chunkId, owner.getId(), shifted);
    return true;
  }

  @Override
  @Transactional
  @Timed(value = "document.delete", description = "Time to delete a document")
  public void deleteDocument(UUID documentId) {
    KnowledgeDocument document =
        documentRepository
            .findWithKnowledgeBaseById(documentId)
            .orElseThrow(() -> new DocumentNotFoundException(documentId));
    UUID tenantId = document.getKnowledgeBase().getTenantId();
    cleanUpVectors(
        "document", documentId, () -> vectorStore.deleteByDocument(tenantId, documentId));

    int chunks = chunkRepository.deleteByDocumentId(documentId);
    documentRepository.deleteById(documentId);
    meterRegistry.counter("document.deleted").increment();
    log.info("Deleted document {} with {} chunks", documentId, chunks);
  }

  @Override
  @Transactional
  @Timed(value = "knowledge_base.delete", description = "Time to delete a knowledge base")
  public void deleteKnowledgeBase(UUID knowledgeBaseId) {
    KnowledgeBase knowledgeBase = getKnowledgeBase(knowledgeBaseId);
    UUID tenantId = knowledgeBase.getTenantId();
    cleanUpVectors(
        "knowledge_base",
        knowledgeBaseId,
        () -> vectorStore.deleteByKnowledgeBase(tenantId, knowledgeBaseId));

    int chunks = chunkRepository.deleteByKnowledgeBaseId(knowledgeBaseId);
    int documents = documentRepository.deleteByKnowledgeBaseId(knowledgeBaseId);
    knowledgeBaseRepository.deleteById(knowledgeBaseId);
    meterRegistry.counter("knowledge_base.deleted").increment();
    log.info(
        "Deleted knowledge base {} with {} documents and {} chunks",
        knowledgeBaseId,
        documents,
        chunks);
  }

  private void cleanUpVectors(String scope, UUID id, Runnable delete) {
    try {
      boundedCalls.run(BoundedCalls.VECTOR_STORE, delete);
    } catch (CancellationException e) {
      throw e;
    } catch (RuntimeException e) {
      log.warn(
          "Vector cleanup for {} {} failed, stale vectors remain: {}", scope, id, e.getMessage());
      meterRegistry.counter("vector_store.cleanup.failures", "scope", scope).increment();
    }
  }
}
