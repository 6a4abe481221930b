package com.usedmarket.procurement.model;

public enum ProcurementEventType {
  SEARCH_SUBMITTED("search_submitted"),
  SEARCH_FAILED("search_failed"),
  SEARCH_CANCELLED("search_cancelled"),
  LISTING_FOUND("listing_found"),
  LISTING_EXPIRED("listing_expired"),
  LISTING_PURCHASED("listing_purchased"),
  INSPECTION_COMPLETED("inspection_completed"),
  DISCOVERY_TRIGGERED("discovery_triggered"),
  DISCOVERY_PURCHASED("discovery_purchased");

  private final String value;

  ProcurementEventType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
