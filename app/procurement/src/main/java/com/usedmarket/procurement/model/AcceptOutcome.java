package com.usedmarket.procurement.model;

public enum AcceptOutcome {
  ACCEPTED("accepted"),
  INSUFFICIENT_FUNDS("insufficient_funds"),
  NO_OPPORTUNITY("no_opportunity"),
  ACQUISITION_FAILED("acquisition_failed");

  private final String value;

  AcceptOutcome(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
