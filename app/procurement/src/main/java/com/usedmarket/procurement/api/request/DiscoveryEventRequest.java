package com.usedmarket.procurement.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

/** ホスト側で発生した対象ティア取引の通知。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DiscoveryEventRequest(@NotBlank String eventKind) {}
