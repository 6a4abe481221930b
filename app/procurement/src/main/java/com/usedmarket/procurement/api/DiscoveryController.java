/*
 * どこで: Procurement API
 * 何を: 解放ゲートの状態参照・取引通知・受諾/辞退エンドポイントを公開する
 * なぜ: ホスト側で完結する取引も解放判定へ反映できるようにするため
 */
package com.usedmarket.procurement.api;

import com.usedmarket.procurement.api.request.DiscoveryEventRequest;
import com.usedmarket.procurement.api.response.DiscoveryAcceptResponse;
import com.usedmarket.procurement.api.response.DiscoveryEventResponse;
import com.usedmarket.procurement.api.response.DiscoveryStatusResponse;
import com.usedmarket.procurement.api.response.PrerequisiteResponse;
import com.usedmarket.procurement.config.RequestMdcInterceptor;
import com.usedmarket.procurement.model.AcceptOutcome;
import com.usedmarket.procurement.service.DiscoveryGate;
import com.usedmarket.procurement.service.SimulationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/discovery")
@RequiredArgsConstructor
public class DiscoveryController {

  private final DiscoveryGate discoveryGate;
  private final SimulationService simulationService;

  @GetMapping("/status")
  public ResponseEntity<DiscoveryStatusResponse> status(
      @RequestHeader(RequestMdcInterceptor.HEADER_CONSUMER_ID) String consumerId) {
    return ResponseEntity.ok(
        DiscoveryStatusResponse.from(discoveryGate.status(consumerId, simulationService.now())));
  }

  @GetMapping("/prerequisites")
  public ResponseEntity<PrerequisiteResponse> prerequisites(
      @RequestHeader(RequestMdcInterceptor.HEADER_CONSUMER_ID) String consumerId) {
    return ResponseEntity.ok(
        PrerequisiteResponse.from(
            discoveryGate.checkPrerequisites(consumerId, simulationService.now())));
  }

  @PostMapping("/events")
  public ResponseEntity<DiscoveryEventResponse> qualifyingEvent(
      @RequestHeader(RequestMdcInterceptor.HEADER_CONSUMER_ID) String consumerId,
      @Valid @RequestBody DiscoveryEventRequest request) {
    final boolean triggered =
        discoveryGate.onQualifyingEvent(consumerId, request.eventKind(), simulationService.now());
    return ResponseEntity.ok(new DiscoveryEventResponse(consumerId, triggered));
  }

  @PostMapping("/accept")
  public ResponseEntity<DiscoveryAcceptResponse> accept(
      @RequestHeader(RequestMdcInterceptor.HEADER_CONSUMER_ID) String consumerId) {
    final AcceptOutcome outcome = discoveryGate.accept(consumerId, simulationService.now());
    return ResponseEntity.ok(new DiscoveryAcceptResponse(consumerId, outcome.value()));
  }

  @PostMapping("/decline")
  public ResponseEntity<DiscoveryStatusResponse> decline(
      @RequestHeader(RequestMdcInterceptor.HEADER_CONSUMER_ID) String consumerId) {
    discoveryGate.decline(consumerId);
    return ResponseEntity.ok(
        DiscoveryStatusResponse.from(discoveryGate.status(consumerId, simulationService.now())));
  }

  @PostMapping("/reset")
  public ResponseEntity<DiscoveryStatusResponse> reset(
      @RequestHeader(RequestMdcInterceptor.HEADER_CONSUMER_ID) String consumerId) {
    discoveryGate.reset(consumerId);
    return ResponseEntity.ok(
        DiscoveryStatusResponse.from(discoveryGate.status(consumerId, simulationService.now())));
  }
}
