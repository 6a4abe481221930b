package com.usedmarket.procurement.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.usedmarket.procurement.model.PrerequisiteCheck;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PrerequisiteResponse(boolean eligible, String reason, String detail) {

  public static PrerequisiteResponse from(PrerequisiteCheck check) {
    return new PrerequisiteResponse(check.eligible(), check.reason().value(), check.detail());
  }
}
