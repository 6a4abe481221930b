package com.usedmarket.procurement.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.usedmarket.procurement.model.FoundItem;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FoundItemPayload(
    double condition,
    long price,
    Map<String, Integer> matchedConfigurations,
    List<String> randomizedConfigurations) {

  public static FoundItemPayload from(FoundItem item) {
    if (item == null) {
      return null;
    }
    return new FoundItemPayload(
        item.condition(),
        item.price(),
        item.matchedConfigurations(),
        List.copyOf(item.randomizedConfigurations()));
  }
}
