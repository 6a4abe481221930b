/*
 * どこで: Procurement ドメインモデル
 * 何を: 検索レコードのライフサイクル状態を定義する
 * なぜ: 永続化・API で同じ状態表現を使うため
 */
package com.usedmarket.procurement.model;

public enum SearchStatus {
  ACTIVE("active"),
  SUCCESS("success"),
  FAILED("failed"),
  CANCELLED("cancelled"),
  COMPLETED("completed");

  private final String value;

  SearchStatus(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static SearchStatus fromValue(String status) {
    for (SearchStatus searchStatus : values()) {
      if (searchStatus.value.equalsIgnoreCase(status)) {
        return searchStatus;
      }
    }
    throw new IllegalArgumentException("unsupported search status: " + status);
  }
}
