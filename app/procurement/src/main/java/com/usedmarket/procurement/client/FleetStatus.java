package com.usedmarket.procurement.client;

/** lowestReliability は保有資産が無い場合 null。 */
public record FleetStatus(String consumerId, int diagnosticUsageCount, Double lowestReliability) {

  public boolean hasResourceBelow(double threshold) {
    return lowestReliability != null && lowestReliability < threshold;
  }
}
