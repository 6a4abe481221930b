/*
 * どこで: Procurement ドメインモデル
 * 何を: 出品に対する点検ティアの費用と所要時間を定義する
 * なぜ: 点検費用を出品価格に応じて上限付きで算出するため
 */
package com.usedmarket.procurement.model;

public record InspectionTier(
    String id, String name, long baseCost, double pricePercent, long maxCost, int durationHours) {

  /**
   * 役割: 出品価格に対する点検費用を返す。
   * 動作: base + price * percent を上限 maxCost で切り詰め、小数点以下を切り捨てる。
   * 前提: listingPrice は 0 以上。
   */
  public long costFor(long listingPrice) {
    return (long) Math.floor(Math.min(baseCost + listingPrice * pricePercent, maxCost));
  }
}
