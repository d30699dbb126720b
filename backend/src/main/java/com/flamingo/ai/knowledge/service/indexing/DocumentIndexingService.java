package com.flamingo.ai.knowledge.service.indexing;

import com.flamingo.ai.knowledge.config.RetrievalConfig;
import com.flamingo.ai.knowledge.domain.entity.DocumentChunk;
import com.flamingo.ai.knowledge.domain.entity.KnowledgeBase;
import com.flamingo.ai.knowledge.domain.entity.KnowledgeDocument;
import com.flamingo.ai.knowledge.domain.model.KnowledgeBaseSettings;
import com.flamingo.ai.knowledge.domain.repository.DocumentChunkRepository;
import com.flamingo.ai.knowledge.domain.repository.KnowledgeDocumentRepository;
import com.flamingo.ai.knowledge.elasticsearch.DistanceMetric;
import com.flamingo.ai.knowledge.elasticsearch.VectorRecord;
import com.flamingo.ai.knowledge.elasticsearch.VectorStore;
import com.flamingo.ai.knowledge.exception.ConfigException;
import com.flamingo.ai.knowledge.exception.DocumentNotFoundException;
import com.flamingo.ai.knowledge.service.chunking.ChunkPiece;
import com.flamingo.ai.knowledge.service.chunking.DocumentChunker;
import com.flamingo.ai.knowledge.service.embedding.EmbeddingClient;
import com.flamingo.ai.knowledge.service.support.BoundedCalls;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Turns the extracted text of a document into persisted chunks and vectors.
 *
 * <p>Chunks are the source of truth: they are replaced before any embedding happens and stay
 * persisted when embedding or the vector store fails, in which case the document is marked FAILED
 * and a later rebuild of the knowledge base repairs the vectors.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentIndexingService {

  private final KnowledgeDocumentRepository documentRepository;
  private final DocumentChunkRepository chunkRepository;
  private final DocumentChunker chunker;
  private final EmbeddingClient embeddingClient;
  private final VectorStore vectorStore;
  private final BoundedCalls boundedCalls;
  private final RetrievalConfig retrievalConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Chunks, embeds and indexes a document with the settings of its knowledge base.
   *
   * @throws DocumentNotFoundException if the document does not exist
   * @throws ConfigException if the knowledge base settings are invalid or disagree with the
   *     tenant collection; the chunks and the FAILED status are still committed
   */
  @Transactional(noRollbackFor = ConfigException.class)
  @Timed(value = "document.index", description = "Time to index a document")
  public IndexingResult indexDocument(UUID documentId) {
    KnowledgeDocument document =
        documentRepository
            .findWithKnowledgeBaseById(documentId)
            .orElseThrow(() -> new DocumentNotFoundException(documentId));
    KnowledgeBase knowledgeBase = document.getKnowledgeBase();
    KnowledgeBaseSettings settings = knowledgeBase.getSettings();
    settings.chunkingOptions().validate();

    document.startProcessing();
    documentRepository.save(document);
    log.info("Indexing document {} of knowledge base {}", documentId, knowledgeBase.getId());

    removePreviousVectors(knowledgeBase.getTenantId(), documentId);
    chunkRepository.deleteByDocumentId(documentId);
    // the bulk delete clears the persistence context; continue with managed instances
    document =
        documentRepository
            .findWithKnowledgeBaseById(documentId)
            .orElseThrow(() -> new DocumentNotFoundException(documentId));
    knowledgeBase = document.getKnowledgeBase();

    List<ChunkPiece> pieces = chunker.chunk(document.getContent(), settings.chunkingOptions());
    List<DocumentChunk> chunks = new ArrayList<>(pieces.size());
    for (ChunkPiece piece : pieces) {
      chunks.add(
          DocumentChunk.builder()
              .document(document)
              .orderIndex(piece.orderIndex())
              .content(piece.content())
              .characterCount(piece.characterCount())
              .tokenCount(piece.tokenEstimate())
              .startPosition(piece.startPosition())
              .endPosition(piece.endPosition())
              .metadata(chunkMetadata(document, knowledgeBase))
              .build());
    }
    List<DocumentChunk> saved = chunkRepository.saveAll(chunks);
    log.debug("Persisted {} chunks for document {}", saved.size(), documentId);

    try {
      indexVectors(knowledgeBase, document, saved);
    } catch (CancellationException e) {
      throw e;
    } catch (ConfigException e) {
      document.markFailed(saved.size(), e.getMessage());
      documentRepository.save(document);
      throw e;
    } catch (RuntimeException e) {
      log.warn(
          "Vector indexing of document {} failed, {} chunks kept for rebuild: {}",
          documentId,
          saved.size(),
          e.getMessage());
      meterRegistry.counter("document.index.failures").increment();
      document.markFailed(saved.size(), e.getMessage());
      documentRepository.save(document);
      return new IndexingResult(documentId, document.getStatus(), saved.size(), e.getMessage());
    }

    document.markReady(saved.size());
    documentRepository.save(document);
    meterRegistry.counter("document.indexed").increment();
    log.info("Document {} indexed with {} chunks", documentId, saved.size());
    return new IndexingResult(documentId, document.getStatus(), saved.size(), null);
  }

  private void indexVectors(
      KnowledgeBase knowledgeBase, KnowledgeDocument document, List<DocumentChunk> chunks) {
    if (chunks.isEmpty()) {
      return;
    }
    String model = knowledgeBase.getEmbeddingModel();
    int dimensions = knowledgeBase.getEmbeddingDimensions();
    UUID tenantId = knowledgeBase.getTenantId();
    boundedCalls.run(
        BoundedCalls.VECTOR_STORE,
        () -> vectorStore.ensureCollection(tenantId, dimensions, DistanceMetric.COSINE));

    int batchSize = Math.max(1, retrievalConfig.getEmbedding().getBatchSize());
    for (int from = 0; from < chunks.size(); from += batchSize) {
      List<DocumentChunk> batch = chunks.subList(from, Math.min(chunks.size(), from + batchSize));
      List<String> texts = batch.stream().map(DocumentChunk::getContent).toList();
      List<float[]> vectors =
          boundedCalls.call(BoundedCalls.EMBEDDING, () -> embeddingClient.embedBatch(texts, model));

      List<VectorRecord> records = new ArrayList<>(batch.size());
      for (int i = 0; i < batch.size(); i++) {
        DocumentChunk chunk = batch.get(i);
        records.add(
            VectorRecord.builder()
                .chunkId(chunk.getId())
                .documentId(document.getId())
                .knowledgeBaseId(knowledgeBase.getId())
                .content(chunk.getContent())
                .orderIndex(chunk.getOrderIndex())
                .charCount(chunk.getCharacterCount())
                .tokenCount(chunk.getTokenCount())
                .metadata(new HashMap<>(chunk.getMetadata()))
                .vector(EmbeddingClient.requireDimensions(vectors.get(i), dimensions, model))
                .build());
      }
      boundedCalls.run(BoundedCalls.VECTOR_STORE, () -> vectorStore.upsert(tenantId, records));
    }
  }

  private void removePreviousVectors(UUID tenantId, UUID documentId) {
    try {
      boundedCalls.run(
          BoundedCalls.VECTOR_STORE, () -> vectorStore.deleteByDocument(tenantId, documentId));
    } catch (CancellationException e) {
      throw e;
    } catch (RuntimeException e) {
      log.warn("Could not remove previous vectors of document {}: {}", documentId, e.getMessage());
      meterRegistry.counter("vector_store.cleanup.failures", "scope", "document").increment();
    }
  }

  private static Map<String, Object> chunkMetadata(
      KnowledgeDocument document, KnowledgeBase knowledgeBase) {
    Map<String, Object> metadata = new HashMap<>();
    metadata.put("chunkingStrategy", knowledgeBase.getChunkingStrategy().name());
    metadata.put("settingsVersion", knowledgeBase.getSettingsVersion());
    if (document.getMimeType() != null) {
      metadata.put("mimeType", document.getMimeType());
    }
    return metadata;
  }
}
