package com.usedmarket.procurement.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.usedmarket.procurement.model.DiscoveryStatus;
import com.usedmarket.procurement.model.PrerequisiteSnapshot;

/** usage_count / credit_score / has_degraded_resource は未評価なら null。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DiscoveryStatusResponse(
    String consumerId,
    boolean discovered,
    boolean purchased,
    boolean opportunityActive,
    int remainingDays,
    int eligibleTransactions,
    long price,
    Integer usageCount,
    Integer creditScore,
    Boolean hasDegradedResource) {

  public static DiscoveryStatusResponse from(DiscoveryStatus status) {
    final PrerequisiteSnapshot prerequisites = status.prerequisites();
    return new DiscoveryStatusResponse(
        status.consumerId(),
        status.discovered(),
        status.purchased(),
        status.opportunityActive(),
        status.remainingDays(),
        status.eligibleTransactions(),
        status.price(),
        prerequisites == null ? null : prerequisites.usageCount(),
        prerequisites == null ? null : prerequisites.creditScore(),
        prerequisites == null ? null : prerequisites.hasDegradedResource());
  }
}
