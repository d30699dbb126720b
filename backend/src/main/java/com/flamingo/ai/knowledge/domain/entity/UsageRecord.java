package com.flamingo.ai.knowledge.domain.entity;

import com.flamingo.ai.knowledge.domain.enums.UsageMetric;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Append-only usage entry. Daily totals are sums over tenant, date and metric. */
@Entity
@Table(
    name = "usage_records",
    indexes = {
      @Index(name = "idx_usage_tenant_date", columnList = "tenant_id, usage_date, metric")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UsageRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false)
  private UUID tenantId;

  @Column(name = "usage_date", nullable = false)
  private LocalDate usageDate;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private UsageMetric metric;

  @Builder.Default private long amount = 1L;

  @Column(nullable = false, updatable = false)
  private LocalDateTime recordedAt;

  @PrePersist
  protected void onCreate() {
    if (recordedAt == null) {
      recordedAt = LocalDateTime.now();
    }
  }
}
