/*
 * どこで: Procurement サービス層
 * 何を: 利用者ごとの隠し解放 (確率判定 + 天井) と購入機会の期限を管理する
 * なぜ: 上位ティアの購入実績に応じて限定商品を一度だけ提示するため
 */
package com.usedmarket.procurement.service;

import com.usedmarket.procurement.client.AcquisitionClient;
import com.usedmarket.procurement.client.ChargeResult;
import com.usedmarket.procurement.client.FleetStatus;
import com.usedmarket.procurement.client.FleetStatusClient;
import com.usedmarket.procurement.client.HostIntegrationException;
import com.usedmarket.procurement.client.LedgerClient;
import com.usedmarket.procurement.client.dto.AcquisitionRequest;
import com.usedmarket.procurement.config.DiscoveryProperties;
import com.usedmarket.procurement.config.ProcurementProperties;
import com.usedmarket.procurement.model.AcceptOutcome;
import com.usedmarket.procurement.model.DiscoveryGateState;
import com.usedmarket.procurement.model.DiscoveryStateSnapshot;
import com.usedmarket.procurement.model.DiscoveryStatus;
import com.usedmarket.procurement.model.PrerequisiteCheck;
import com.usedmarket.procurement.model.PrerequisiteReason;
import com.usedmarket.procurement.model.PrerequisiteSnapshot;
import com.usedmarket.procurement.model.ProcurementEvent;
import com.usedmarket.procurement.model.ProcurementEventType;
import com.usedmarket.procurement.model.SimulationTime;
import com.usedmarket.procurement.repository.DiscoveryStateRepository;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.random.RandomGenerator;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DiscoveryGate implements AgentTransactionListener {

  private static final Logger logger = LoggerFactory.getLogger(DiscoveryGate.class);

  private static final String AGENT_PURCHASE = "agent_purchase";

  private final FleetStatusClient fleetStatusClient;
  private final CreditScoreResolver creditScoreResolver;
  private final LedgerClient ledgerClient;
  private final AcquisitionClient acquisitionClient;
  private final DiscoveryStateRepository repository;
  private final ProcurementEventPublisher eventPublisher;
  private final ProcurementMetrics metrics;
  private final DiscoveryProperties properties;
  private final ProcurementProperties procurementProperties;
  private final RandomGenerator rng;

  private final Map<String, DiscoveryGateState> states = new HashMap<>();

  /**
   * 役割: 解放判定の前提条件を評価する。
   * 動作: 発見済み → 機会有効 → 診断利用回数 → 信用スコア → 劣化リソース有無の順に判定し、
   *       最初に満たさない条件の理由を返す。評価した外部値は状態表示用に保持する。
   * 前提: 発見済みの利用者には外部呼び出しを行わない。
   */
  public synchronized PrerequisiteCheck checkPrerequisites(String consumerId, SimulationTime now) {
    final DiscoveryGateState state = stateOf(consumerId);
    if (state.discovered()) {
      return PrerequisiteCheck.failed(PrerequisiteReason.ALREADY_DISCOVERED, "");
    }
    if (state.opportunityActive()) {
      return PrerequisiteCheck.failed(PrerequisiteReason.OPPORTUNITY_ACTIVE, "");
    }
    final FleetStatus fleet = fleetStatusClient.getStatus(consumerId);
    final int creditScore = creditScoreResolver.resolve(consumerId);
    final boolean degraded = fleet.hasResourceBelow(properties.ceilingThreshold());
    state.cachePrerequisites(
        new PrerequisiteSnapshot(fleet.diagnosticUsageCount(), creditScore, degraded, now.hour()));

    if (fleet.diagnosticUsageCount() < properties.requiredUsageCount()) {
      return PrerequisiteCheck.failed(
          PrerequisiteReason.USAGE_COUNT,
          "usage=" + fleet.diagnosticUsageCount() + " required=" + properties.requiredUsageCount());
    }
    if (creditScore < properties.requiredCreditScore()) {
      return PrerequisiteCheck.failed(
          PrerequisiteReason.CREDIT_SCORE,
          "score=" + creditScore + " required=" + properties.requiredCreditScore());
    }
    if (!degraded) {
      return PrerequisiteCheck.failed(
          PrerequisiteReason.NO_DEGRADED_CEILING,
          "no resource below " + properties.ceilingThreshold());
    }
    return PrerequisiteCheck.eligibleCheck();
  }

  @Override
  public void onAgentPurchase(String consumerId, String tierId, SimulationTime now) {
    if (!procurementProperties.qualifyingTier().equalsIgnoreCase(tierId)) {
      return;
    }
    onQualifyingEvent(consumerId, AGENT_PURCHASE, now);
  }

  /**
   * 役割: 対象ティアの取引 1 件につき解放判定を 1 回行う。
   * 動作: 前提未達なら false。達していればカウンタを加算し、天井到達時は確率 1.0 で判定する。
   *       当選時は発見済み + 機会有効 (now.hour + 機会期間) として保存し通知する。
   * 前提: 乱数は 1 判定につき 1 回だけ引く。
   */
  public synchronized boolean onQualifyingEvent(
      String consumerId, String eventKind, SimulationTime now) {
    final PrerequisiteCheck check = checkPrerequisites(consumerId, now);
    if (!check.eligible()) {
      logger.debug(
          "discovery not eligible consumerId={} reason={}", consumerId, check.reason().value());
      return false;
    }
    final DiscoveryGateState state = stateOf(consumerId);
    final int counter = state.recordEligibleTransaction();
    final double threshold =
        counter >= properties.pityThreshold() ? 1.0d : properties.baseChance();
    final double roll = rng.nextDouble();
    if (roll > threshold) {
      repository.save(state.snapshot());
      metrics.recordDiscovery("missed");
      logger.debug(
          "discovery roll missed consumerId={} counter={} roll={} threshold={}",
          consumerId,
          counter,
          roll,
          threshold);
      return false;
    }

    state.openOpportunity(now.hour() + properties.opportunityWindowHours());
    repository.save(state.snapshot());
    metrics.recordDiscovery(counter >= properties.pityThreshold() ? "pity" : "triggered");
    logger.info(
        "discovery triggered consumerId={} eventKind={} counter={} expiryHour={}",
        consumerId,
        eventKind,
        counter,
        state.opportunityExpiryHour());
    publishSafely(ProcurementEventType.DISCOVERY_TRIGGERED, consumerId, now);
    return true;
  }

  /**
   * 役割: 購入機会を受諾する。
   * 動作: 割引価格を課金し実体化する。実体化に失敗した場合は返金し、機会は残したまま
   *       ACQUISITION_FAILED を返す。
   */
  public synchronized AcceptOutcome accept(String consumerId, SimulationTime now) {
    final DiscoveryGateState state = stateOf(consumerId);
    if (!state.opportunityActive()) {
      return AcceptOutcome.NO_OPPORTUNITY;
    }
    final long price = properties.discountedPrice();
    if (ledgerClient.charge(consumerId, price, "discovery_purchase")
        == ChargeResult.INSUFFICIENT_FUNDS) {
      metrics.recordDiscovery("insufficient_funds");
      return AcceptOutcome.INSUFFICIENT_FUNDS;
    }

    if (!materialize(consumerId)) {
      ledgerClient.credit(consumerId, price, "discovery_refund");
      metrics.recordDiscovery("acquisition_failed");
      logger.warn("discovery acquisition failed, refunded consumerId={} price={}", consumerId, price);
      return AcceptOutcome.ACQUISITION_FAILED;
    }

    state.markPurchased();
    repository.save(state.snapshot());
    metrics.recordDiscovery("purchased");
    logger.info("discovery purchased consumerId={} price={}", consumerId, price);
    publishSafely(ProcurementEventType.DISCOVERY_PURCHASED, consumerId, now);
    return AcceptOutcome.ACCEPTED;
  }

  /** 機会は期限まで保持したまま、辞退を記録するだけ。 */
  public synchronized void decline(String consumerId) {
    final DiscoveryGateState state = stateOf(consumerId);
    logger.info(
        "discovery declined consumerId={} opportunityActive={} expiryHour={}",
        consumerId,
        state.opportunityActive(),
        state.opportunityExpiryHour());
  }

  /** 期限を過ぎた機会を無効化する。発見済みフラグは戻さない。 */
  public synchronized List<String> expireCheck(SimulationTime now) {
    final List<String> expired = new ArrayList<>();
    for (DiscoveryGateState state : states.values()) {
      if (state.isOpportunityElapsed(now.hour())) {
        state.closeOpportunity();
        repository.save(state.snapshot());
        metrics.recordDiscovery("expired");
        expired.add(state.consumerId());
        logger.info("discovery opportunity expired consumerId={}", state.consumerId());
      }
    }
    return expired;
  }

  public synchronized DiscoveryStatus status(String consumerId, SimulationTime now) {
    final DiscoveryGateState state = stateOf(consumerId);
    return new DiscoveryStatus(
        consumerId,
        state.discovered(),
        state.purchased(),
        state.opportunityActive(),
        remainingDays(state, now),
        state.eligibleTransactions(),
        properties.discountedPrice(),
        state.lastPrerequisites());
  }

  /** 管理用。利用者の解放状態を初期値へ戻す。 */
  public synchronized void reset(String consumerId) {
    final DiscoveryGateState state = new DiscoveryGateState(consumerId);
    states.put(consumerId, state);
    repository.save(state.snapshot());
    logger.info("discovery state reset consumerId={}", consumerId);
  }

  public synchronized void restore(List<DiscoveryStateSnapshot> snapshots) {
    states.clear();
    for (DiscoveryStateSnapshot snapshot : snapshots) {
      states.put(snapshot.consumerId(), DiscoveryGateState.fromSnapshot(snapshot));
    }
    logger.info("discovery gate restored consumers={}", states.size());
  }

  private boolean materialize(String consumerId) {
    try {
      return acquisitionClient.materialize(
          new AcquisitionRequest(properties.catalogKey(), consumerId, null, Map.of(), List.of()));
    } catch (HostIntegrationException ex) {
      logger.warn(
          "discovery acquisition call failed consumerId={} reason={}", consumerId, ex.reason(), ex);
      metrics.recordDependencyError("acquisition_" + ex.reason().name().toLowerCase(Locale.ROOT));
      return false;
    }
  }

  private void publishSafely(ProcurementEventType type, String consumerId, SimulationTime now) {
    try {
      eventPublisher.publish(
          new ProcurementEvent(type, consumerId, null, null, properties.catalogKey(), now.day()));
    } catch (RuntimeException ex) {
      logger.warn(
          "procurement event publish failed type={} consumerId={}", type.value(), consumerId, ex);
      metrics.recordDependencyError("event_publish");
    }
  }

  private DiscoveryGateState stateOf(String consumerId) {
    return states.computeIfAbsent(consumerId, DiscoveryGateState::new);
  }

  static int remainingDays(DiscoveryGateState state, SimulationTime now) {
    if (!state.opportunityActive()) {
      return 0;
    }
    final long remainingHours = state.opportunityExpiryHour() - now.hour();
    if (remainingHours <= 0) {
      return 0;
    }
    return (int) ((remainingHours + SimulationTime.HOURS_PER_DAY - 1) / SimulationTime.HOURS_PER_DAY);
  }
}
