package com.usedmarket.procurement.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.usedmarket.procurement.model.SimulationTime;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SimulationTimeResponse(int day, long hour) {

  public static SimulationTimeResponse from(SimulationTime time) {
    return new SimulationTimeResponse(time.day(), time.hour());
  }
}
