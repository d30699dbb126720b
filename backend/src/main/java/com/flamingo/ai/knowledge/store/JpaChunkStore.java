package com.flamingo.ai.knowledge.store;

import com.flamingo.ai.knowledge.config.RetrievalConfig;
import com.flamingo.ai.knowledge.domain.entity.DocumentChunk;
import com.flamingo.ai.knowledge.domain.repository.DocumentChunkRepository;
import com.flamingo.ai.knowledge.domain.repository.KnowledgeBaseRepository;
import com.flamingo.ai.knowledge.domain.repository.KnowledgeDocumentRepository;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/** {@link ChunkStore} over the Spring Data repositories. */
@Repository
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class JpaChunkStore implements ChunkStore {

  private final KnowledgeBaseRepository knowledgeBaseRepository;
  private final KnowledgeDocumentRepository documentRepository;
  private final DocumentChunkRepository chunkRepository;
  private final RetrievalConfig retrievalConfig;

  @Override
  public Optional<KnowledgeBaseInfo> findKnowledgeBase(UUID knowledgeBaseId) {
    return knowledgeBaseRepository.findById(knowledgeBaseId).map(KnowledgeBaseInfo::from);
  }

  @Override
  public List<KnowledgeBaseInfo> listKnowledgeBases(UUID tenantId) {
    return knowledgeBaseRepository.findByTenantIdOrderByCreatedAtAscIdAsc(tenantId).stream()
        .map(KnowledgeBaseInfo::from)
        .toList();
  }

  @Override
  public List<DocumentInfo> listDocuments(UUID knowledgeBaseId) {
    return documentRepository
        .findByKnowledgeBaseIdOrderByCreatedAtAscIdAsc(knowledgeBaseId)
        .stream()
        .map(DocumentInfo::from)
        .toList();
  }

  @Override
  public Optional<ChunkContext> getChunk(UUID chunkId) {
    return chunkRepository.findWithContextById(chunkId).map(ChunkContext::from);
  }

  @Override
  public List<ChunkContext> listChunksByDocument(UUID documentId) {
    return chunkRepository.findWithContextByDocumentId(documentId).stream()
        .map(ChunkContext::from)
        .toList();
  }

  @Override
  public List<ChunkContext> findChunks(UUID tenantId, Collection<UUID> chunkIds) {
    if (chunkIds.isEmpty()) {
      return List.of();
    }
    return chunkRepository.findWithContextByTenantAndIds(tenantId, chunkIds).stream()
        .map(ChunkContext::from)
        .toList();
  }

  @Override
  public List<ChunkContext> searchText(
      UUID tenantId, Collection<UUID> knowledgeBaseIds, List<String> terms, int limit) {
    if (terms.isEmpty() || limit <= 0) {
      return List.of();
    }
    List<String> needles =
        terms.stream().map(term -> stripWildcards(term.toLowerCase(Locale.ROOT))).toList();
    // every match of a term up to the scan bound, so the ranking below sees late chunks too
    PageRequest page =
        PageRequest.of(0, Math.max(limit, retrievalConfig.getSearch().getFallbackScanLimit()));
    Map<UUID, ChunkContext> matches = new LinkedHashMap<>();
    for (String needle : needles) {
      String pattern = "%" + needle + "%";
      List<DocumentChunk> chunks =
          knowledgeBaseIds.isEmpty()
              ? chunkRepository.searchContent(tenantId, pattern, page)
              : chunkRepository.searchContentInKnowledgeBases(
                  tenantId, knowledgeBaseIds, pattern, page);
      for (DocumentChunk chunk : chunks) {
        matches.putIfAbsent(chunk.getId(), ChunkContext.from(chunk));
      }
    }
    log.debug(
        "Text search for {} terms in tenant {} matched {} chunks",
        terms.size(),
        tenantId,
        matches.size());
    return matches.values().stream()
        .sorted(
            Comparator.comparingInt((ChunkContext chunk) -> occurrences(chunk.content(), needles))
                .reversed())
        .limit(limit)
        .toList();
  }

  @Override
  public long countChunks(UUID tenantId) {
    return chunkRepository.countByTenantId(tenantId);
  }

  private static int occurrences(String content, List<String> needles) {
    String text = content.toLowerCase(Locale.ROOT);
    int count = 0;
    for (String needle : needles) {
      if (needle.isEmpty()) {
        continue;
      }
      int at = text.indexOf(needle);
      while (at >= 0) {
        count++;
        at = text.indexOf(needle, at + needle.length());
      }
    }
    return count;
  }

  private static String stripWildcards(String term) {
    return term.replace("%", "").replace("_", "");
  }
}
