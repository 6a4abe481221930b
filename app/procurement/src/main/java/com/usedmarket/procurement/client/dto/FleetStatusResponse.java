package com.usedmarket.procurement.client.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FleetStatusResponse(
    String consumerId, Integer diagnosticUsageCount, Double lowestReliability) {}
