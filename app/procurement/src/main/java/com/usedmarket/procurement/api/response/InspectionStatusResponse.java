package com.usedmarket.procurement.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** 点検待ちでない出品の hoursRemaining は 0。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InspectionStatusResponse(String listingId, long hoursRemaining) {}
