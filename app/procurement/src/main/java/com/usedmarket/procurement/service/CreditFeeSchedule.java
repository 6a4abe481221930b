/*
 * どこで: Procurement サービス層
 * 何を: 信用スコアから検索手数料の補正率を求める
 * なぜ: 高スコアは割引、低スコアは割増という料金表を 1 か所で管理するため
 */
package com.usedmarket.procurement.service;

public final class CreditFeeSchedule {

  private CreditFeeSchedule() {}

  /** 負値は割引、正値は割増。 */
  public static double modifierFor(int creditScore) {
    if (creditScore >= 750) {
      return -0.15d;
    }
    if (creditScore >= 700) {
      return -0.08d;
    }
    if (creditScore >= 650) {
      return 0.0d;
    }
    if (creditScore >= 600) {
      return 0.10d;
    }
    return 0.20d;
  }
}
