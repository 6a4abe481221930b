package com.usedmarket.procurement.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.usedmarket.procurement.model.ListingSnapshot;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ListingResponse(
    String listingId,
    String searchId,
    String consumerId,
    String tierId,
    String catalogKey,
    String displayName,
    FoundItemPayload item,
    int hoursRemaining,
    String status,
    String inspectionState,
    String inspectionTierId) {

  public static ListingResponse from(ListingSnapshot snapshot) {
    return new ListingResponse(
        snapshot.id(),
        snapshot.searchId(),
        snapshot.consumerId(),
        snapshot.tierId(),
        snapshot.catalogKey(),
        snapshot.displayName(),
        FoundItemPayload.from(snapshot.item()),
        snapshot.hoursRemaining(),
        snapshot.status().value(),
        snapshot.inspectionState().value(),
        snapshot.inspectionTierId());
  }
}
