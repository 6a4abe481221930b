package com.usedmarket.procurement.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class ProcurementMetricsTest {

  @Test
  void recordsCountersGaugesAndTickTimer() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final ProcurementMetrics metrics = new ProcurementMetrics(registry);

    metrics.recordSearchSubmitted("national");
    metrics.recordSearchResult("success");
    metrics.recordListingResult("expired");
    metrics.recordInspection("requested");
    metrics.recordDiscovery("triggered");
    metrics.recordDependencyError("redis");
    metrics.recordCorruptRecordSkipped("search");
    metrics.updateActiveSearches(4);
    metrics.updateAvailableListings(2);
    metrics.recordTickDuration(Duration.ofMillis(5));

    assertThat(
            registry
                .get("procurement.search.submitted.total")
                .tag("tier", "national")
                .counter()
                .count())
        .isEqualTo(1.0);
    assertThat(
            registry.get("procurement.search.result.total").tag("result", "success").counter().count())
        .isEqualTo(1.0);
    assertThat(registry.get("procurement.listing.total").tag("result", "expired").counter().count())
        .isEqualTo(1.0);
    assertThat(
            registry.get("procurement.inspection.total").tag("phase", "requested").counter().count())
        .isEqualTo(1.0);
    assertThat(
            registry.get("procurement.discovery.total").tag("result", "triggered").counter().count())
        .isEqualTo(1.0);
    assertThat(
            registry.get("procurement.dependency.error.total").tag("type", "redis").counter().count())
        .isEqualTo(1.0);
    assertThat(
            registry
                .get("procurement.persistence.corrupt.total")
                .tag("record", "search")
                .counter()
                .count())
        .isEqualTo(1.0);
    assertThat(registry.get("procurement.search.active").gauge().value()).isEqualTo(4.0);
    assertThat(registry.get("procurement.listing.available").gauge().value()).isEqualTo(2.0);
    assertThat(registry.get("procurement.tick.duration").timer().count()).isEqualTo(1L);
  }

  @Test
  void ignoresNegativeTickDurationAndClampsGauges() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final ProcurementMetrics metrics = new ProcurementMetrics(registry);

    metrics.recordTickDuration(Duration.ofMillis(-1));
    metrics.updateActiveSearches(-3);

    assertThat(registry.get("procurement.tick.duration").timer().count()).isZero();
    assertThat(registry.get("procurement.search.active").gauge().value()).isZero();
  }
}
