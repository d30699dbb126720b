package com.flamingo.ai.knowledge.domain.entity;

import com.flamingo.ai.knowledge.domain.converter.JsonMapConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A contiguous slice of a document's text. Order indices are 0-based and contiguous within a
 * document.
 */
@Entity
@Table(
    name = "document_chunks",
    indexes = {
      @Index(name = "idx_chunks_document_order", columnList = "document_id, order_index")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DocumentChunk {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "document_id", nullable = false)
  private KnowledgeDocument document;

  @Column(name = "order_index", nullable = false)
  private int orderIndex;

  @Column(nullable = false, length = 100_000)
  private String content;

  private int characterCount;

  private int tokenCount;

  /** Offset of the first character in the document text. */
  private int startPosition;

  /** Offset just past the last character in the document text. */
  private int endPosition;

  @Convert(converter = JsonMapConverter.class)
  @Column(length = 8000)
  @Builder.Default
  private Map<String, Object> metadata = new HashMap<>();

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = LocalDateTime.now();
    }
  }
}
