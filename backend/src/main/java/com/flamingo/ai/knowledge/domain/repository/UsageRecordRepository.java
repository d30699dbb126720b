package com.flamingo.ai.knowledge.domain.repository;

import com.flamingo.ai.knowledge.domain.entity.UsageRecord;
import com.flamingo.ai.knowledge.domain.enums.UsageMetric;
import java.time.LocalDate;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for UsageRecord entities. */
@Repository
public interface UsageRecordRepository extends JpaRepository<UsageRecord, UUID> {

  /** Sums the recorded amounts of a metric for one tenant and day. */
  @Query(
      "SELECT COALESCE(SUM(u.amount), 0) FROM UsageRecord u "
          + "WHERE u.tenantId = :tenantId AND u.usageDate = :usageDate AND u.metric = :metric")
  long sumAmount(
      @Param("tenantId") UUID tenantId,
      @Param("usageDate") LocalDate usageDate,
      @Param("metric") UsageMetric metric);
}
