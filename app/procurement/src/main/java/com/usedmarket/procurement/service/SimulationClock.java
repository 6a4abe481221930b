package com.usedmarket.procurement.service;

import com.usedmarket.procurement.model.SimulationTime;
import org.springframework.stereotype.Component;

/** 通算シミュレーション時間を保持する。進めるのは SimulationService のみ。 */
@Component
public class SimulationClock {

  private long hour;

  public synchronized SimulationTime now() {
    return SimulationTime.ofHour(hour);
  }

  synchronized SimulationTime advanceOneHour() {
    hour++;
    return SimulationTime.ofHour(hour);
  }

  public synchronized void resetTo(long restoredHour) {
    if (restoredHour < 0) {
      throw new IllegalArgumentException("restored hour must not be negative");
    }
    this.hour = restoredHour;
  }
}
