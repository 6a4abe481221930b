/*
 * どこで: Procurement ドメインモデル
 * 何を: 品質ティアの状態レンジと価格倍率・成功率補正を定義する
 * なぜ: 発見されるアイテムの状態と価格をティアで決定するため
 */
package com.usedmarket.procurement.model;

public record QualityTier(
    String id,
    String name,
    double minCondition,
    double maxCondition,
    double priceMultiplier,
    double successModifier) {

  public QualityTier {
    if (minCondition < 0.0d || maxCondition <= minCondition || maxCondition > 1.0d) {
      throw new IllegalArgumentException("invalid condition range for quality " + id);
    }
  }
}
