/*
 * どこで: Procurement ドメインモデル
 * 何を: ディスカバリー前提条件の判定理由を定義する
 * なぜ: 最初に満たさなかった条件を固定の理由コードで返すため
 */
package com.usedmarket.procurement.model;

public enum PrerequisiteReason {
  ALREADY_DISCOVERED("already_discovered"),
  OPPORTUNITY_ACTIVE("opportunity_active"),
  USAGE_COUNT("usage_count"),
  CREDIT_SCORE("credit_score"),
  NO_DEGRADED_CEILING("no_degraded_ceiling"),
  ELIGIBLE("eligible");

  private final String value;

  PrerequisiteReason(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
