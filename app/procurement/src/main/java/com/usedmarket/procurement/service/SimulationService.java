/*
 * どこで: Procurement サービス層
 * 何を: シミュレーション時間を 1 時間ずつ進め、スケジューラと解放ゲートへ同じ時刻を渡す
 * なぜ: 点検完了や機会期限を時間単位で判定し、日次処理は日の境界でのみ走らせるため
 */
package com.usedmarket.procurement.service;

import com.usedmarket.procurement.api.InvalidProcurementRequestException;
import com.usedmarket.procurement.model.SimulationTime;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SimulationService {

  private static final Logger logger = LoggerFactory.getLogger(SimulationService.class);

  static final int MAX_HOURS_PER_ADVANCE = 24 * 365;

  private final SimulationClock clock;
  private final SearchScheduler scheduler;
  private final DiscoveryGate discoveryGate;

  public SimulationTime now() {
    return clock.now();
  }

  /**
   * 役割: 指定時間だけシミュレーションを進める。
   * 動作: 1 時間ごとに scheduler.tick → discoveryGate.expireCheck の順で呼び出す。
   * 前提: hours は 1 以上 MAX_HOURS_PER_ADVANCE 以下。
   */
  public synchronized SimulationTime advance(int hours) {
    if (hours < 1 || hours > MAX_HOURS_PER_ADVANCE) {
      throw new InvalidProcurementRequestException(
          "hours must be between 1 and " + MAX_HOURS_PER_ADVANCE);
    }
    SimulationTime time = clock.now();
    for (int i = 0; i < hours; i++) {
      time = clock.advanceOneHour();
      scheduler.tick(time);
      discoveryGate.expireCheck(time);
    }
    logger.debug("simulation advanced hours={} day={} hour={}", hours, time.day(), time.hour());
    return time;
  }
}
