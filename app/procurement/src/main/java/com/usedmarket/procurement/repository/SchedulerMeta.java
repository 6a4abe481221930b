package com.usedmarket.procurement.repository;

/** nextSequence は次に払い出す検索/出品連番、lastHour は保存時点のシミュレーション通算時間。 */
public record SchedulerMeta(long nextSequence, int lastProcessedDay, long lastHour) {

  public static SchedulerMeta initial() {
    return new SchedulerMeta(1L, 0, 0L);
  }
}
