package com.flamingo.ai.knowledge.service.retrieval;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.knowledge.domain.enums.DocumentType;
import com.flamingo.ai.knowledge.store.ChunkContext;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("LexicalScorer Tests")
class LexicalScorerTest {

  private final LexicalScorer scorer = new LexicalScorer();

  @Test
  @DisplayName("should extract distinct lowercase terms without stop words")
  void shouldExtractTerms() {
    assertThat(scorer.terms("What is the Refund policy for refund requests?", 8))
        .containsExactly("refund", "policy", "requests");
  }

  @Test
  @DisplayName("should keep stop words when the query has nothing else")
  void shouldKeepStopWords_whenOnlyStopWords() {
    assertThat(scorer.terms("What is it", 8)).containsExactly("what", "is", "it");
  }

  @Test
  @DisplayName("should cap the number of terms")
  void shouldCapTerms() {
    assertThat(scorer.terms("alpha beta gamma delta epsilon", 3))
        .containsExactly("alpha", "beta", "gamma");
  }

  @Test
  @DisplayName("should rank chunks matching more terms higher and drop non-matching chunks")
  void shouldRankByCoverage() {
    ChunkContext both = chunk("Our refund policy covers every order.");
    ChunkContext one = chunk("A refund is issued in five days.");
    ChunkContext none = chunk("Shipping is free over fifty dollars.");

    List<LexicalScorer.Scored> ranked =
        scorer.rank(List.of("refund", "policy"), List.of(one, none, both));

    assertThat(ranked).extracting(LexicalScorer.Scored::chunk).containsExactly(both, one);
    assertThat(ranked.get(0).relevance()).isGreaterThan(ranked.get(1).relevance());
  }

  @Test
  @DisplayName("should match terms as word prefixes")
  void shouldMatchPrefixes() {
    ChunkContext plural = chunk("Refunds are processed weekly.");

    assertThat(scorer.rank(List.of("refund"), List.of(plural))).hasSize(1);
  }

  @Test
  @DisplayName("should keep candidate order for equal relevance")
  void shouldKeepOrder_whenTied() {
    ChunkContext first = chunk("refund window");
    ChunkContext second = chunk("refund window");

    assertThat(scorer.rank(List.of("refund"), List.of(first, second)))
        .extracting(LexicalScorer.Scored::chunk)
        .containsExactly(first, second);
  }

  private static ChunkContext chunk(String content) {
    return new ChunkContext(
        UUID.randomUUID(),
        0,
        content,
        content.length(),
        1,
        Map.of(),
        UUID.randomUUID(),
        "doc",
        "doc.txt",
        DocumentType.FILE,
        UUID.randomUUID(),
        "kb",
        UUID.randomUUID());
  }
}
