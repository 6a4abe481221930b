package com.usedmarket.procurement.worker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.when;

import com.usedmarket.procurement.model.DiscoveryStateSnapshot;
import com.usedmarket.procurement.model.SimulationTime;
import com.usedmarket.procurement.repository.DiscoveryStateRepository;
import com.usedmarket.procurement.repository.SchedulerMeta;
import com.usedmarket.procurement.repository.SchedulerState;
import com.usedmarket.procurement.repository.SearchStateRepository;
import com.usedmarket.procurement.service.DiscoveryGate;
import com.usedmarket.procurement.service.SearchScheduler;
import com.usedmarket.procurement.service.SimulationClock;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mockito;

class ProcurementStateLoaderTest {

  @Test
  void loadRestoresSchedulerClockAndGate() {
    final SearchStateRepository searchStateRepository = Mockito.mock(SearchStateRepository.class);
    final DiscoveryStateRepository discoveryStateRepository =
        Mockito.mock(DiscoveryStateRepository.class);
    final SearchScheduler scheduler = Mockito.mock(SearchScheduler.class);
    final DiscoveryGate gate = Mockito.mock(DiscoveryGate.class);
    final SimulationClock clock = new SimulationClock();
    final SchedulerState state =
        new SchedulerState(List.of(), List.of(), new SchedulerMeta(5L, 3, 80L));
    final List<DiscoveryStateSnapshot> discovery =
        List.of(new DiscoveryStateSnapshot("consumer-1", false, false, false, 0L, 2, null));
    when(searchStateRepository.load()).thenReturn(state);
    when(discoveryStateRepository.loadAll()).thenReturn(discovery);

    new ProcurementStateLoader(
            searchStateRepository, discoveryStateRepository, scheduler, gate, clock)
        .load();

    final InOrder order = inOrder(scheduler, gate);
    order.verify(scheduler).restore(state);
    order.verify(gate).restore(discovery);
    assertThat(clock.now()).isEqualTo(SimulationTime.ofHour(80L));
  }
}
