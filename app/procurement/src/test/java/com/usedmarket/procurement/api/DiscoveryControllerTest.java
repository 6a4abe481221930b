package com.usedmarket.procurement.api;

import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.usedmarket.procurement.model.AcceptOutcome;
import com.usedmarket.procurement.model.DiscoveryStatus;
import com.usedmarket.procurement.model.PrerequisiteCheck;
import com.usedmarket.procurement.model.PrerequisiteReason;
import com.usedmarket.procurement.model.PrerequisiteSnapshot;
import com.usedmarket.procurement.model.SimulationTime;
import com.usedmarket.procurement.service.DiscoveryGate;
import com.usedmarket.procurement.service.SimulationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(DiscoveryController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class DiscoveryControllerTest {

  private static final SimulationTime NOW = SimulationTime.ofHour(100L);

  @Autowired private MockMvc mockMvc;

  @MockitoBean private DiscoveryGate discoveryGate;
  @MockitoBean private SimulationService simulationService;

  @BeforeEach
  void setUp() {
    when(simulationService.now()).thenReturn(NOW);
  }

  @Test
  void statusIncludesLastPrerequisiteValues() throws Exception {
    when(discoveryGate.status("consumer-1", NOW))
        .thenReturn(
            new DiscoveryStatus(
                "consumer-1",
                true,
                false,
                true,
                27,
                4,
                250_000L,
                new PrerequisiteSnapshot(15, 720, true, 90L)));

    mockMvc
        .perform(get("/v1/discovery/status").header("X-Consumer-Id", "consumer-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.opportunity_active").value(true))
        .andExpect(jsonPath("$.remaining_days").value(27))
        .andExpect(jsonPath("$.eligible_transactions").value(4))
        .andExpect(jsonPath("$.usage_count").value(15))
        .andExpect(jsonPath("$.has_degraded_resource").value(true));
  }

  @Test
  void statusWithoutEvaluationLeavesPrerequisiteValuesNull() throws Exception {
    when(discoveryGate.status("consumer-1", NOW))
        .thenReturn(new DiscoveryStatus("consumer-1", false, false, false, 0, 0, 250_000L, null));

    mockMvc
        .perform(get("/v1/discovery/status").header("X-Consumer-Id", "consumer-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.usage_count").doesNotExist())
        .andExpect(jsonPath("$.credit_score").doesNotExist());
  }

  @Test
  void prerequisitesReturnFirstFailedReason() throws Exception {
    when(discoveryGate.checkPrerequisites("consumer-1", NOW))
        .thenReturn(PrerequisiteCheck.failed(PrerequisiteReason.USAGE_COUNT, "usage=3 required=10"));

    mockMvc
        .perform(get("/v1/discovery/prerequisites").header("X-Consumer-Id", "consumer-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.eligible").value(false))
        .andExpect(jsonPath("$.reason").value("usage_count"))
        .andExpect(jsonPath("$.detail").value("usage=3 required=10"));
  }

  @Test
  void qualifyingEventReportsTrigger() throws Exception {
    when(discoveryGate.onQualifyingEvent("consumer-1", "agent_purchase", NOW)).thenReturn(true);

    mockMvc
        .perform(
            post("/v1/discovery/events")
                .header("X-Consumer-Id", "consumer-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"event_kind":"agent_purchase"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.consumer_id").value("consumer-1"))
        .andExpect(jsonPath("$.triggered").value(true));
  }

  @Test
  void qualifyingEventRequiresKind() throws Exception {
    mockMvc
        .perform(
            post("/v1/discovery/events")
                .header("X-Consumer-Id", "consumer-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"event_kind\":\" \"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("PROCUREMENT_VALIDATION_ERROR"));
  }

  @Test
  void acceptReturnsOutcomeValue() throws Exception {
    when(discoveryGate.accept("consumer-1", NOW)).thenReturn(AcceptOutcome.INSUFFICIENT_FUNDS);

    mockMvc
        .perform(post("/v1/discovery/accept").header("X-Consumer-Id", "consumer-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.outcome").value("insufficient_funds"));
  }

  @Test
  void declineAndResetReturnStatus() throws Exception {
    when(discoveryGate.status("consumer-1", NOW))
        .thenReturn(new DiscoveryStatus("consumer-1", false, false, false, 0, 0, 250_000L, null));

    mockMvc
        .perform(post("/v1/discovery/decline").header("X-Consumer-Id", "consumer-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.discovered").value(false));
    mockMvc
        .perform(post("/v1/discovery/reset").header("X-Consumer-Id", "consumer-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.eligible_transactions").value(0));

    final InOrder order = inOrder(discoveryGate);
    order.verify(discoveryGate).decline("consumer-1");
    order.verify(discoveryGate).status("consumer-1", NOW);
    order.verify(discoveryGate).reset("consumer-1");
    order.verify(discoveryGate).status("consumer-1", NOW);
  }
}
