package com.flamingo.ai.knowledge.testsupport;

import com.flamingo.ai.knowledge.domain.enums.DocumentStatus;
import com.flamingo.ai.knowledge.domain.enums.DocumentType;
import com.flamingo.ai.knowledge.domain.model.KnowledgeBaseSettings;
import com.flamingo.ai.knowledge.service.chunking.DocumentChunker;
import com.flamingo.ai.knowledge.store.ChunkContext;
import com.flamingo.ai.knowledge.store.ChunkStore;
import com.flamingo.ai.knowledge.store.DocumentInfo;
import com.flamingo.ai.knowledge.store.KnowledgeBaseInfo;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/** Chunk store backed by insertion-ordered maps. */
public class InMemoryChunkStore implements ChunkStore {

  private final Map<UUID, KnowledgeBaseInfo> knowledgeBases = new LinkedHashMap<>();
  private final Map<UUID, DocumentInfo> documents = new LinkedHashMap<>();
  private final Map<UUID, ChunkContext> chunks = new LinkedHashMap<>();
  private volatile boolean failing;
  private LocalDateTime clock = LocalDateTime.of(2024, 1, 1, 0, 0);

  public void setFailing(boolean failing) {
    this.failing = failing;
  }

  public synchronized KnowledgeBaseInfo addKnowledgeBase(
      UUID tenantId, String name, KnowledgeBaseSettings settings) {
    KnowledgeBaseInfo info = new KnowledgeBaseInfo(UUID.randomUUID(), tenantId, name, settings, 1L);
    knowledgeBases.put(info.id(), info);
    return info;
  }

  public synchronized DocumentInfo addDocument(KnowledgeBaseInfo knowledgeBase, String title) {
    clock = clock.plusSeconds(1);
    DocumentInfo info =
        new DocumentInfo(
            UUID.randomUUID(),
            knowledgeBase.id(),
            title,
            title + ".txt",
            DocumentType.FILE,
            DocumentStatus.READY,
            clock);
    documents.put(info.id(), info);
    return info;
  }

  /** Appends a chunk at the next order index of the document. */
  public synchronized ChunkContext addChunk(DocumentInfo document, String content) {
    KnowledgeBaseInfo knowledgeBase = knowledgeBases.get(document.knowledgeBaseId());
    int orderIndex =
        (int)
            chunks.values().stream()
                .filter(chunk -> chunk.documentId().equals(document.id()))
                .count();
    ChunkContext chunk =
        new ChunkContext(
            UUID.randomUUID(),
            orderIndex,
            content,
            content.length(),
            DocumentChunker.estimateTokens(content.length()),
            Map.of(),
            document.id(),
            document.title(),
            document.filename(),
            document.type(),
            knowledgeBase.id(),
            knowledgeBase.name(),
            knowledgeBase.tenantId());
    chunks.put(chunk.chunkId(), chunk);
    return chunk;
  }

  public synchronized void removeChunk(UUID chunkId) {
    chunks.remove(chunkId);
  }

  @Override
  public synchronized Optional<KnowledgeBaseInfo> findKnowledgeBase(UUID knowledgeBaseId) {
    check();
    return Optional.ofNullable(knowledgeBases.get(knowledgeBaseId));
  }

  @Override
  public synchronized List<KnowledgeBaseInfo> listKnowledgeBases(UUID tenantId) {
    check();
    return knowledgeBases.values().stream().filter(kb -> kb.tenantId().equals(tenantId)).toList();
  }

  @Override
  public synchronized List<DocumentInfo> listDocuments(UUID knowledgeBaseId) {
    check();
    return documents.values().stream()
        .filter(document -> document.knowledgeBaseId().equals(knowledgeBaseId))
        .sorted(Comparator.comparing(DocumentInfo::createdAt))
        .toList();
  }

  @Override
  public synchronized Optional<ChunkContext> getChunk(UUID chunkId) {
    check();
    return Optional.ofNullable(chunks.get(chunkId));
  }

  @Override
  public synchronized List<ChunkContext> listChunksByDocument(UUID documentId) {
    check();
    return chunks.values().stream()
        .filter(chunk -> chunk.documentId().equals(documentId))
        .sorted(Comparator.comparingInt(ChunkContext::orderIndex))
        .toList();
  }

  @Override
  public synchronized List<ChunkContext> findChunks(UUID tenantId, Collection<UUID> chunkIds) {
    check();
    List<ChunkContext> found = new ArrayList<>();
    for (UUID chunkId : chunkIds) {
      ChunkContext chunk = chunks.get(chunkId);
      if (chunk != null && chunk.tenantId().equals(tenantId)) {
        found.add(chunk);
      }
    }
    return found;
  }

  @Override
  public synchronized List<ChunkContext> searchText(
      UUID tenantId, Collection<UUID> knowledgeBaseIds, List<String> terms, int limit) {
    check();
    return chunks.values().stream()
        .filter(chunk -> chunk.tenantId().equals(tenantId))
        .filter(
            chunk ->
                knowledgeBaseIds.isEmpty() || knowledgeBaseIds.contains(chunk.knowledgeBaseId()))
        .filter(
            chunk ->
                terms.stream()
                    .anyMatch(term -> chunk.content().toLowerCase(Locale.ROOT).contains(term)))
        .sorted(
            Comparator.comparingLong((ChunkContext chunk) -> occurrences(chunk.content(), terms))
                .reversed())
        .limit(limit)
        .toList();
  }

  @Override
  public synchronized long countChunks(UUID tenantId) {
    check();
    return chunks.values().stream().filter(chunk -> chunk.tenantId().equals(tenantId)).count();
  }

  private static long occurrences(String content, List<String> terms) {
    String text = content.toLowerCase(Locale.ROOT);
    return terms.stream()
        .filter(term -> !term.isEmpty())
        .mapToLong(term -> text.split(Pattern.quote(term), -1).length - 1)
        .sum();
  }

  private void check() {
    if (failing) {
      throw new IllegalStateException("chunk store unavailable");
    }
  }
}
