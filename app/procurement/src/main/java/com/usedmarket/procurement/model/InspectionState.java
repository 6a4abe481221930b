package com.usedmarket.procurement.model;

public enum InspectionState {
  NONE("none"),
  PENDING("pending"),
  COMPLETE("complete");

  private final String value;

  InspectionState(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static InspectionState fromValue(String state) {
    for (InspectionState inspectionState : values()) {
      if (inspectionState.value.equalsIgnoreCase(state)) {
        return inspectionState;
      }
    }
    throw new IllegalArgumentException("unsupported inspection state: " + state);
  }
}
