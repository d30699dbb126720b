package com.flamingo.ai.knowledge.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.knowledge.config.RetrievalConfig;
import com.flamingo.ai.knowledge.domain.entity.DocumentChunk;
import com.flamingo.ai.knowledge.domain.entity.KnowledgeBase;
import com.flamingo.ai.knowledge.domain.entity.KnowledgeDocument;
import com.flamingo.ai.knowledge.domain.enums.DocumentType;
import com.flamingo.ai.knowledge.domain.repository.DocumentChunkRepository;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

@DataJpaTest
@Import({JpaChunkStore.class, RetrievalConfig.class})
@DisplayName("JpaChunkStore Tests")
class JpaChunkStoreTest {

  private static final LocalDateTime START = LocalDateTime.of(2024, 1, 1, 9, 0);

  @Autowired private JpaChunkStore chunkStore;
  @Autowired private DocumentChunkRepository chunkRepository;
  @Autowired private TestEntityManager entityManager;

  private final UUID tenantA = UUID.randomUUID();
  private final UUID tenantB = UUID.randomUUID();
  private KnowledgeBase handbook;
  private KnowledgeBase faq;
  private KnowledgeBase foreign;
  private KnowledgeDocument guide;
  private KnowledgeDocument notes;
  private List<DocumentChunk> guideChunks;
  private DocumentChunk foreignChunk;

  @BeforeEach
  void setUp() {
    handbook = knowledgeBase(tenantA, "Handbook", 0);
    faq = knowledgeBase(tenantA, "FAQ", 1);
    foreign = knowledgeBase(tenantB, "Other", 2);
    guide = document(handbook, "Guide", 0);
    notes = document(faq, "Notes", 1);
    guideChunks =
        List.of(
            chunk(guide, 0, "Refunds are processed within five days."),
            chunk(guide, 1, "Shipping is free above fifty euros."),
            chunk(guide, 2, "Returns need the original receipt."));
    chunk(notes, 0, "Refunds for digital goods are not possible.");
    foreignChunk = chunk(document(foreign, "Secret", 2), 0, "Refunds of tenant B.");
    entityManager.flush();
    entityManager.clear();
  }

  private KnowledgeBase knowledgeBase(UUID tenant, String name, int minutes) {
    return entityManager.persist(
        KnowledgeBase.builder()
            .tenantId(tenant)
            .name(name)
            .createdAt(START.plusMinutes(minutes))
            .build());
  }

  private KnowledgeDocument document(KnowledgeBase knowledgeBase, String title, int minutes) {
    return entityManager.persist(
        KnowledgeDocument.builder()
            .knowledgeBase(knowledgeBase)
            .type(DocumentType.FILE)
            .title(title)
            .filename(title.toLowerCase() + ".pdf")
            .createdAt(START.plusMinutes(minutes))
            .build());
  }

  private DocumentChunk chunk(KnowledgeDocument document, int orderIndex, String content) {
    return entityManager.persist(
        DocumentChunk.builder()
            .document(document)
            .orderIndex(orderIndex)
            .content(content)
            .characterCount(content.length())
            .tokenCount((content.length() + 3) / 4)
            .metadata(Map.of("mimeType", "application/pdf"))
            .build());
  }

  @Test
  void shouldResolveChunkWithDocumentAndKnowledgeBase() {
    ChunkContext context = chunkStore.getChunk(guideChunks.get(1).getId()).orElseThrow();

    assertThat(context.orderIndex()).isEqualTo(1);
    assertThat(context.documentTitle()).isEqualTo("Guide");
    assertThat(context.documentFilename()).isEqualTo("guide.pdf");
    assertThat(context.knowledgeBaseName()).isEqualTo("Handbook");
    assertThat(context.tenantId()).isEqualTo(tenantA);
    assertThat(context.metadata()).containsEntry("mimeType", "application/pdf");
  }

  @Test
  void shouldListKnowledgeBasesAndDocumentsInCreationOrder() {
    assertThat(chunkStore.listKnowledgeBases(tenantA))
        .extracting(KnowledgeBaseInfo::name)
        .containsExactly("Handbook", "FAQ");
    assertThat(chunkStore.listDocuments(handbook.getId()))
        .extracting(DocumentInfo::title)
        .containsExactly("Guide");
    assertThat(chunkStore.findKnowledgeBase(UUID.randomUUID())).isEmpty();
  }

  @Test
  void shouldListChunksByOrderIndex() {
    assertThat(chunkStore.listChunksByDocument(guide.getId()))
        .extracting(ChunkContext::orderIndex)
        .containsExactly(0, 1, 2);
  }

  @Test
  void shouldOnlyFindChunksOfTheTenant() {
    List<UUID> ids = List.of(guideChunks.get(0).getId(), foreignChunk.getId());

    assertThat(chunkStore.findChunks(tenantA, ids))
        .extracting(ChunkContext::chunkId)
        .containsExactly(guideChunks.get(0).getId());
    assertThat(chunkStore.findChunks(tenantA, List.of())).isEmpty();
  }

  @Test
  void shouldSearchTextCaseInsensitivelyWithinTenant() {
    List<ChunkContext> matches = chunkStore.searchText(tenantA, List.of(), List.of("REFUNDS"), 10);

    assertThat(matches)
        .extracting(ChunkContext::documentTitle)
        .containsExactly("Guide", "Notes");
    assertThat(matches).extracting(ChunkContext::tenantId).containsOnly(tenantA);
  }

  @Test
  void shouldRestrictTextSearchToKnowledgeBases() {
    List<ChunkContext> matches =
        chunkStore.searchText(tenantA, List.of(faq.getId()), List.of("refunds", "shipping"), 10);

    assertThat(matches).extracting(ChunkContext::knowledgeBaseId).containsOnly(faq.getId());
    assertThat(matches).hasSize(1);
  }

  @Test
  void shouldMergeTermsWithoutDuplicates() {
    List<ChunkContext> matches =
        chunkStore.searchText(tenantA, List.of(), List.of("refunds", "five"), 10);

    assertThat(matches).extracting(ChunkContext::chunkId).doesNotHaveDuplicates().hasSize(2);
  }

  @Test
  void shouldRankByTermOccurrences_whenMoreChunksMatchThanLimit() {
    KnowledgeDocument policies = document(faq, "Policies", 5);
    for (int i = 0; i < 5; i++) {
      chunk(policies, i, "Section " + i + " mentions a refund once.");
    }
    DocumentChunk best = chunk(policies, 5, "Refund policy: refund refund refund.");
    entityManager.flush();
    entityManager.clear();

    List<ChunkContext> matches = chunkStore.searchText(tenantA, List.of(), List.of("refund"), 5);

    assertThat(matches).hasSize(5);
    assertThat(matches.get(0).chunkId()).isEqualTo(best.getId());
  }

  @Test
  void shouldIgnoreLikeWildcardsInTerms() {
    assertThat(chunkStore.searchText(tenantA, List.of(), List.of("%"), 10)).hasSize(4);
    assertThat(chunkStore.searchText(tenantA, List.of(), List.of("zzz%"), 10)).isEmpty();
  }

  @Test
  void shouldCountChunksPerTenant() {
    assertThat(chunkStore.countChunks(tenantA)).isEqualTo(4);
    assertThat(chunkStore.countChunks(tenantB)).isEqualTo(1);
  }

  @Test
  void shouldCloseOrderGapAfterRemovingChunk() {
    chunkRepository.deleteById(guideChunks.get(0).getId());
    chunkRepository.flush();

    int shifted = chunkRepository.closeOrderGap(guide.getId(), 0);

    assertThat(shifted).isEqualTo(2);
    assertThat(chunkStore.listChunksByDocument(guide.getId()))
        .extracting(ChunkContext::orderIndex)
        .containsExactly(0, 1);
  }
}
