package com.usedmarket.procurement.api;

import com.usedmarket.procurement.api.request.AdvanceSimulationRequest;
import com.usedmarket.procurement.api.response.SimulationTimeResponse;
import com.usedmarket.procurement.service.SimulationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** ホスト駆動でシミュレーション時間を進める。tick worker を無効化した環境で使う。 */
@RestController
@RequestMapping("/v1/simulation")
@RequiredArgsConstructor
public class SimulationController {

  private final SimulationService simulationService;

  @GetMapping("/time")
  public ResponseEntity<SimulationTimeResponse> time() {
    return ResponseEntity.ok(SimulationTimeResponse.from(simulationService.now()));
  }

  @PostMapping("/advance")
  public ResponseEntity<SimulationTimeResponse> advance(
      @Valid @RequestBody AdvanceSimulationRequest request) {
    return ResponseEntity.ok(
        SimulationTimeResponse.from(simulationService.advance(request.hours())));
  }
}
