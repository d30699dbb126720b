package com.flamingo.ai.knowledge.service.usage;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.knowledge.domain.enums.UsageMetric;
import com.flamingo.ai.knowledge.domain.repository.UsageRecordRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

@DataJpaTest
@DisplayName("UsageService Tests")
class UsageServiceTest {

  private static final Clock LATE_EVENING_UTC =
      Clock.fixed(Instant.parse("2024-03-10T23:59:30Z"), ZoneOffset.UTC);

  @Autowired private UsageRecordRepository usageRecordRepository;

  private SimpleMeterRegistry meterRegistry;
  private UsageService usageService;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    usageService = new UsageService(usageRecordRepository, meterRegistry, LATE_EVENING_UTC);
  }

  @Test
  void shouldAppendOneRecordPerRetrieval() {
    UUID tenant = UUID.randomUUID();

    usageService.recordRetrieval(tenant);
    usageService.recordRetrieval(tenant);

    assertThat(usageRecordRepository.findAll())
        .hasSize(2)
        .allSatisfy(
            record -> {
              assertThat(record.getTenantId()).isEqualTo(tenant);
              assertThat(record.getMetric()).isEqualTo(UsageMetric.RETRIEVALS);
              assertThat(record.getUsageDate()).isEqualTo(LocalDate.of(2024, 3, 10));
              assertThat(record.getRecordedAt()).isNotNull();
            });
    assertThat(meterRegistry.get("usage.recorded").counter().count()).isEqualTo(2.0);
  }

  @Test
  void shouldSumRetrievalsPerTenantAndDay() {
    UUID tenant = UUID.randomUUID();
    UUID otherTenant = UUID.randomUUID();
    usageService.recordRetrieval(tenant);
    usageService.recordRetrieval(tenant);
    usageService.recordRetrieval(otherTenant);

    assertThat(usageService.retrievalsOn(tenant, LocalDate.of(2024, 3, 10))).isEqualTo(2);
    assertThat(usageService.retrievalsOn(otherTenant, LocalDate.of(2024, 3, 10))).isEqualTo(1);
    assertThat(usageService.retrievalsOn(tenant, LocalDate.of(2024, 3, 11))).isZero();
  }
}
