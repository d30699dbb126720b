package com.flamingo.ai.knowledge.service.usage;

import com.flamingo.ai.knowledge.domain.entity.UsageRecord;
import com.flamingo.ai.knowledge.domain.enums.UsageMetric;
import com.flamingo.ai.knowledge.domain.repository.UsageRecordRepository;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Appends usage records consumed by quota and analytics jobs. */
@Service
@Slf4j
public class UsageService {

  private final UsageRecordRepository usageRecordRepository;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  @Autowired
  public UsageService(UsageRecordRepository usageRecordRepository, MeterRegistry meterRegistry) {
    this(usageRecordRepository, meterRegistry, Clock.systemUTC());
  }

  UsageService(
      UsageRecordRepository usageRecordRepository, MeterRegistry meterRegistry, Clock clock) {
    this.usageRecordRepository = usageRecordRepository;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  /** Records one successful retrieval for the tenant on the current UTC day. */
  @Transactional
  public void recordRetrieval(UUID tenantId) {
    UsageRecord record =
        UsageRecord.builder()
            .tenantId(tenantId)
            .usageDate(LocalDate.now(clock))
            .metric(UsageMetric.RETRIEVALS)
            .amount(1L)
            .build();
    usageRecordRepository.save(record);
    meterRegistry.counter("usage.recorded", "metric", UsageMetric.RETRIEVALS.name()).increment();
    log.debug("Recorded retrieval usage for tenant {}", tenantId);
  }

  /** Total retrievals of a tenant on a day. */
  @Transactional(readOnly = true)
  public long retrievalsOn(UUID tenantId, LocalDate day) {
    return usageRecordRepository.sumAmount(tenantId, day, UsageMetric.RETRIEVALS);
  }
}
