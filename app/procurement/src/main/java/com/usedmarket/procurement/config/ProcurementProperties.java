/*
 * どこで: Procurement 設定
 * 何を: 検索スケジューラと tick worker の設定を保持する
 * なぜ: 1 日あたりの時間単位や出品期限を環境ごとに上書きできるようにするため
 */
package com.usedmarket.procurement.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "procurement")
public record ProcurementProperties(
    Integer unitsPerDay,
    Integer listingTtlHours,
    Duration workerPollInterval,
    Integer hoursPerPoll,
    boolean workerEnabled,
    boolean loadOnStartup,
    String qualifyingTier) {

  public ProcurementProperties {
    unitsPerDay = unitsPerDay == null ? 24 : unitsPerDay;
    listingTtlHours = listingTtlHours == null ? 72 : listingTtlHours;
    workerPollInterval = workerPollInterval == null ? Duration.ofSeconds(10) : workerPollInterval;
    hoursPerPoll = hoursPerPoll == null ? 1 : hoursPerPoll;
    qualifyingTier =
        qualifyingTier == null || qualifyingTier.isBlank() ? "national" : qualifyingTier;
  }
}
