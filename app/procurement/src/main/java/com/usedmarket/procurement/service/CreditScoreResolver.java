/*
 * どこで: Procurement サービス層
 * 何を: 信用スコアを取得し、取得できない場合は既定値へフォールバックする
 * なぜ: 信用サービス不在でも検索と前提条件評価を止めないため
 */
package com.usedmarket.procurement.service;

import com.usedmarket.procurement.client.CreditRatingClient;
import com.usedmarket.procurement.client.HostIntegrationException;
import com.usedmarket.procurement.config.DiscoveryProperties;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class CreditScoreResolver {

  private static final Logger logger = LoggerFactory.getLogger(CreditScoreResolver.class);

  private final CreditRatingClient creditRatingClient;
  private final DiscoveryProperties properties;
  private final ProcurementMetrics metrics;

  public CreditScoreResolver(
      CreditRatingClient creditRatingClient,
      DiscoveryProperties properties,
      ProcurementMetrics metrics) {
    this.creditRatingClient = creditRatingClient;
    this.properties = properties;
    this.metrics = metrics;
  }

  public int resolve(String consumerId) {
    try {
      return creditRatingClient.getScore(consumerId).orElse(properties.defaultCreditScore());
    } catch (HostIntegrationException ex) {
      logger.warn(
          "credit score unavailable, using default consumerId={} reason={} default={}",
          consumerId,
          ex.reason(),
          properties.defaultCreditScore(),
          ex);
      metrics.recordDependencyError("credit_score_" + ex.reason().name().toLowerCase(Locale.ROOT));
      return properties.defaultCreditScore();
    }
  }

  public double feeModifier(String consumerId) {
    return CreditFeeSchedule.modifierFor(resolve(consumerId));
  }
}
