package com.usedmarket.procurement.api;

import com.usedmarket.procurement.api.request.RequestInspectionRequest;
import com.usedmarket.procurement.api.response.InspectionStatusResponse;
import com.usedmarket.procurement.api.response.ListingResponse;
import com.usedmarket.procurement.config.RequestMdcInterceptor;
import com.usedmarket.procurement.service.SearchScheduler;
import com.usedmarket.procurement.service.SimulationService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/listings")
@RequiredArgsConstructor
public class ListingController {

  private final SearchScheduler scheduler;
  private final SimulationService simulationService;

  @GetMapping
  public ResponseEntity<List<ListingResponse>> list(
      @RequestHeader(RequestMdcInterceptor.HEADER_CONSUMER_ID) String consumerId) {
    return ResponseEntity.ok(
        scheduler.listingsFor(consumerId).stream().map(ListingResponse::from).toList());
  }

  @PostMapping("/{listingId}/purchase")
  public ResponseEntity<ListingResponse> purchase(
      @PathVariable("listingId") String listingId,
      @RequestHeader(RequestMdcInterceptor.HEADER_CONSUMER_ID) String consumerId) {
    return ResponseEntity.ok(
        ListingResponse.from(
            scheduler.purchaseListing(consumerId, listingId, simulationService.now())));
  }

  @PostMapping("/{listingId}/inspections")
  public ResponseEntity<ListingResponse> requestInspection(
      @PathVariable("listingId") String listingId,
      @RequestHeader(RequestMdcInterceptor.HEADER_CONSUMER_ID) String consumerId,
      @Valid @RequestBody RequestInspectionRequest request) {
    return ResponseEntity.ok(
        ListingResponse.from(
            scheduler.requestInspection(
                consumerId, listingId, request.inspectionTierId(), simulationService.now())));
  }

  @GetMapping("/{listingId}/inspections")
  public ResponseEntity<InspectionStatusResponse> inspectionStatus(
      @PathVariable("listingId") String listingId,
      @RequestHeader(RequestMdcInterceptor.HEADER_CONSUMER_ID) String consumerId) {
    return ResponseEntity.ok(
        new InspectionStatusResponse(
            listingId,
            scheduler.inspectionHoursRemaining(consumerId, listingId, simulationService.now())));
  }

  @DeleteMapping("/{listingId}/inspections")
  public ResponseEntity<ListingResponse> cancelInspection(
      @PathVariable("listingId") String listingId,
      @RequestHeader(RequestMdcInterceptor.HEADER_CONSUMER_ID) String consumerId) {
    return ResponseEntity.ok(
        ListingResponse.from(
            scheduler.cancelInspection(consumerId, listingId, simulationService.now())));
  }
}
