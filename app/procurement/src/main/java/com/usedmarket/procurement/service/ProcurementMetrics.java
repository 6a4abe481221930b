package com.usedmarket.procurement.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
public class ProcurementMetrics {

  private final MeterRegistry meterRegistry;
  private final Timer tickTimer;
  private final AtomicLong activeSearches = new AtomicLong(0);
  private final AtomicLong availableListings = new AtomicLong(0);
  private final ConcurrentMap<String, Counter> submittedCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> searchResultCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> listingResultCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> inspectionCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> discoveryCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> dependencyErrorCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> corruptRecordCounters = new ConcurrentHashMap<>();

  public ProcurementMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.tickTimer =
        Timer.builder("procurement.tick.duration")
            .description("Time spent processing one scheduler tick")
            .register(meterRegistry);
    Gauge.builder("procurement.search.active", activeSearches, AtomicLong::get)
        .register(meterRegistry);
    Gauge.builder("procurement.listing.available", availableListings, AtomicLong::get)
        .register(meterRegistry);
  }

  public void recordSearchSubmitted(String tierId) {
    submittedCounters
        .computeIfAbsent(
            tierId, tier -> counter("procurement.search.submitted.total", "tier", tier))
        .increment();
  }

  public void recordSearchResult(String result) {
    searchResultCounters
        .computeIfAbsent(
            result, value -> counter("procurement.search.result.total", "result", value))
        .increment();
  }

  public void recordListingResult(String result) {
    listingResultCounters
        .computeIfAbsent(result, value -> counter("procurement.listing.total", "result", value))
        .increment();
  }

  public void recordInspection(String phase) {
    inspectionCounters
        .computeIfAbsent(
            phase, value -> counter("procurement.inspection.total", "phase", value))
        .increment();
  }

  public void recordDiscovery(String result) {
    discoveryCounters
        .computeIfAbsent(result, value -> counter("procurement.discovery.total", "result", value))
        .increment();
  }

  public void recordDependencyError(String errorType) {
    dependencyErrorCounters
        .computeIfAbsent(
            errorType, value -> counter("procurement.dependency.error.total", "type", value))
        .increment();
  }

  public void recordCorruptRecordSkipped(String recordType) {
    corruptRecordCounters
        .computeIfAbsent(
            recordType, value -> counter("procurement.persistence.corrupt.total", "record", value))
        .increment();
  }

  public void updateActiveSearches(long count) {
    activeSearches.set(Math.max(0, count));
  }

  public void updateAvailableListings(long count) {
    availableListings.set(Math.max(0, count));
  }

  public void recordTickDuration(Duration duration) {
    if (duration.isNegative()) {
      return;
    }
    tickTimer.record(duration);
  }

  private Counter counter(String name, String tagKey, String tagValue) {
    return Counter.builder(name).tags(Tags.of(tagKey, tagValue)).register(meterRegistry);
  }
}
