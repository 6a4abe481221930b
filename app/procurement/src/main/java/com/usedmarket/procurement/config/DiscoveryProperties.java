/*
 * どこで: Procurement 設定
 * 何を: ディスカバリー解放の確率・天井・前提条件・価格を保持する
 * なぜ: 解放条件の調整をコード変更なしで行えるようにするため
 */
package com.usedmarket.procurement.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "discovery")
public record DiscoveryProperties(
    Double baseChance,
    Integer pityThreshold,
    Integer requiredUsageCount,
    Integer requiredCreditScore,
    Double ceilingThreshold,
    Long basePrice,
    Double discountPercent,
    Integer opportunityWindowHours,
    Integer defaultCreditScore,
    String catalogKey) {

  public DiscoveryProperties {
    baseChance = baseChance == null ? 0.20d : baseChance;
    pityThreshold = pityThreshold == null ? 10 : pityThreshold;
    requiredUsageCount = requiredUsageCount == null ? 3 : requiredUsageCount;
    requiredCreditScore = requiredCreditScore == null ? 700 : requiredCreditScore;
    ceilingThreshold = ceilingThreshold == null ? 0.90d : ceilingThreshold;
    basePrice = basePrice == null ? 75_000L : basePrice;
    discountPercent = discountPercent == null ? 0.10d : discountPercent;
    opportunityWindowHours = opportunityWindowHours == null ? 720 : opportunityWindowHours;
    defaultCreditScore = defaultCreditScore == null ? 650 : defaultCreditScore;
    catalogKey = catalogKey == null || catalogKey.isBlank() ? "service-truck" : catalogKey;
  }

  public long discountedPrice() {
    return Math.round(basePrice * (1.0d - discountPercent));
  }
}
