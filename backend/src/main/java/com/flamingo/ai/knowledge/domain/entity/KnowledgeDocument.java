package com.flamingo.ai.knowledge.domain.entity;

import com.flamingo.ai.knowledge.domain.enums.DocumentStatus;
import com.flamingo.ai.knowledge.domain.enums.DocumentType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Represents a document of a knowledge base together with its extracted text. */
@Entity
@Table(
    name = "knowledge_documents",
    indexes = {@Index(name = "idx_documents_knowledge_base", columnList = "knowledge_base_id")})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class KnowledgeDocument {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "knowledge_base_id", nullable = false)
  private KnowledgeBase knowledgeBase;

  @Enumerated(EnumType.STRING)
  @Column(name = "document_type", nullable = false)
  private DocumentType type;

  @Column(nullable = false)
  private String title;

  private String filename;

  private String mimeType;

  /** File path or URL the content was extracted from. */
  @Column(columnDefinition = "TEXT")
  private String contentRef;

  /** Extracted plain text. */
  @Column(columnDefinition = "TEXT")
  private String content;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private DocumentStatus status = DocumentStatus.PENDING;

  /** Number of chunks created from this document. */
  private Integer chunkCount;

  /** Error message if indexing failed. */
  @Column(columnDefinition = "TEXT")
  private String processingError;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  private LocalDateTime processedAt;

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = LocalDateTime.now();
    }
  }

  /** Marks the document as processing. */
  public void startProcessing() {
    this.status = DocumentStatus.PROCESSING;
    this.processingError = null;
  }

  /** Marks the document as successfully indexed. */
  public void markReady(int chunkCount) {
    this.status = DocumentStatus.READY;
    this.chunkCount = chunkCount;
    this.processedAt = LocalDateTime.now();
  }

  /** Marks the document as failed with an error message. */
  public void markFailed(int chunkCount, String errorMessage) {
    this.status = DocumentStatus.FAILED;
    this.chunkCount = chunkCount;
    this.processingError = errorMessage;
    this.processedAt = LocalDateTime.now();
  }
}
