/*
 * どこで: Procurement 起動処理
 * 何を: Redis に保存された検索・出品・解放状態を読み込みメモリへ復元する
 * なぜ: 再起動後も進行中の検索と連番・処理済み日を引き継ぐため
 */
package com.usedmarket.procurement.worker;

import com.usedmarket.procurement.repository.DiscoveryStateRepository;
import com.usedmarket.procurement.repository.SchedulerState;
import com.usedmarket.procurement.repository.SearchStateRepository;
import com.usedmarket.procurement.service.DiscoveryGate;
import com.usedmarket.procurement.service.SearchScheduler;
import com.usedmarket.procurement.service.SimulationClock;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "procurement.load-on-startup",
    havingValue = "true",
    matchIfMissing = true)
@RequiredArgsConstructor
public class ProcurementStateLoader {

  private static final Logger logger = LoggerFactory.getLogger(ProcurementStateLoader.class);

  private final SearchStateRepository searchStateRepository;
  private final DiscoveryStateRepository discoveryStateRepository;
  private final SearchScheduler scheduler;
  private final DiscoveryGate discoveryGate;
  private final SimulationClock clock;

  @EventListener(ApplicationReadyEvent.class)
  public void load() {
    final SchedulerState state = searchStateRepository.load();
    scheduler.restore(state);
    clock.resetTo(state.meta().lastHour());
    discoveryGate.restore(discoveryStateRepository.loadAll());
    logger.info(
        "procurement state loaded searches={} listings={} hour={}",
        state.searches().size(),
        state.listings().size(),
        state.meta().lastHour());
  }
}
