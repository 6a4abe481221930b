package com.usedmarket.procurement.worker;

import com.usedmarket.common.TraceIds;
import com.usedmarket.procurement.config.ProcurementProperties;
import com.usedmarket.procurement.model.SimulationTime;
import com.usedmarket.procurement.service.ProcurementMetrics;
import com.usedmarket.procurement.service.SimulationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** 実時間の一定間隔ごとにシミュレーション時間を procurement.hours-per-poll だけ進める。 */
@Component
@ConditionalOnProperty(
    name = "procurement.worker-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class SimulationTickWorker {

  private static final Logger logger = LoggerFactory.getLogger(SimulationTickWorker.class);

  private final SimulationService simulationService;
  private final ProcurementProperties properties;
  private final ProcurementMetrics metrics;

  public SimulationTickWorker(
      SimulationService simulationService,
      ProcurementProperties properties,
      ProcurementMetrics metrics) {
    this.simulationService = simulationService;
    this.properties = properties;
    this.metrics = metrics;
  }

  @Scheduled(fixedDelayString = "${procurement.worker-poll-interval:10s}")
  public void run() {
    MDC.put(TraceIds.MDC_KEY, TraceIds.newTraceId());
    try {
      final SimulationTime time = simulationService.advance(properties.hoursPerPoll());
      logger.debug("tick worker advanced day={} hour={}", time.day(), time.hour());
    } catch (RuntimeException ex) {
      logger.warn("tick worker loop failed", ex);
      metrics.recordDependencyError("worker_loop");
    } finally {
      MDC.remove(TraceIds.MDC_KEY);
    }
  }
}
