/*
 * どこで: Procurement ドメインモデル
 * 何を: シミュレーション内の現在日と通算時間を表す
 * なぜ: 時刻を環境から読まず、tick/expire へ明示的に渡すため
 */
package com.usedmarket.procurement.model;

public record SimulationTime(int day, long hour) {

  public static final int HOURS_PER_DAY = 24;

  public SimulationTime {
    if (day < 0 || hour < 0) {
      throw new IllegalArgumentException("simulation time must not be negative");
    }
  }

  /** 通算時間から日を導出する。 */
  public static SimulationTime ofHour(long hour) {
    return new SimulationTime((int) (hour / HOURS_PER_DAY), hour);
  }

  public SimulationTime plusHours(long hours) {
    if (hours < 0) {
      throw new IllegalArgumentException("hours must not be negative");
    }
    return ofHour(hour + hours);
  }
}
