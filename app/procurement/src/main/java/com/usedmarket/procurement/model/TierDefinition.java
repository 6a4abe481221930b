/*
 * どこで: Procurement ドメインモデル
 * 何を: 検索ティア (local/regional/national) の静的パラメータを定義する
 * なぜ: 手数料率・所要時間・成功率・構成一致率をティア単位で固定するため
 */
package com.usedmarket.procurement.model;

public record TierDefinition(
    String id,
    String name,
    double feeFraction,
    int minDuration,
    int maxDuration,
    double baseSuccess,
    double matchChance) {

  public TierDefinition {
    if (minDuration < 1 || maxDuration < minDuration) {
      throw new IllegalArgumentException("invalid duration range for tier " + id);
    }
  }
}
