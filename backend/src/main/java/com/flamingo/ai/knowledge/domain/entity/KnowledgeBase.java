package com.flamingo.ai.knowledge.domain.entity;

import com.flamingo.ai.knowledge.domain.enums.ChunkingStrategy;
import com.flamingo.ai.knowledge.domain.enums.KnowledgeBaseStatus;
import com.flamingo.ai.knowledge.domain.model.KnowledgeBaseSettings;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A tenant-owned collection of documents that is chunked, embedded and searched as a unit. */
@Entity
@Table(
    name = "knowledge_bases",
    indexes = {@Index(name = "idx_knowledge_bases_tenant", columnList = "tenant_id")})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class KnowledgeBase {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false)
  private UUID tenantId;

  @Column(nullable = false)
  private String name;

  @Column(columnDefinition = "TEXT")
  private String description;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private KnowledgeBaseStatus status = KnowledgeBaseStatus.ACTIVE;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private ChunkingStrategy chunkingStrategy = ChunkingStrategy.RECURSIVE;

  @Builder.Default private int chunkSize = 1000;

  @Builder.Default private int chunkOverlap = 100;

  @Column(nullable = false)
  @Builder.Default
  private String embeddingModel = "text-embedding-3-small";

  @Builder.Default private int embeddingDimensions = 1536;

  @Builder.Default private double similarityThreshold = 0.7;

  @Builder.Default private int maxResults = 10;

  /** Reindex epoch. Incremented on every settings change; existing vectors become stale. */
  @Column(nullable = false)
  @Builder.Default
  private long settingsVersion = 1L;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  private LocalDateTime updatedAt;

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = LocalDateTime.now();
    }
    updatedAt = createdAt;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }

  public KnowledgeBaseSettings getSettings() {
    return new KnowledgeBaseSettings(
        chunkingStrategy,
        chunkSize,
        chunkOverlap,
        embeddingModel,
        embeddingDimensions,
        similarityThreshold,
        maxResults);
  }

  /**
   * Replaces the settings and bumps the reindex epoch when anything changed.
   *
   * @return true if the settings differ from the current ones
   */
  public boolean applySettings(KnowledgeBaseSettings settings) {
    if (getSettings().equals(settings)) {
      return false;
    }
    this.chunkingStrategy = settings.chunkingStrategy();
    this.chunkSize = settings.chunkSize();
    this.chunkOverlap = settings.chunkOverlap();
    this.embeddingModel = settings.embeddingModel();
    this.embeddingDimensions = settings.embeddingDimensions();
    this.similarityThreshold = settings.similarityThreshold();
    this.maxResults = settings.maxResults();
    this.settingsVersion++;
    return true;
  }
}
