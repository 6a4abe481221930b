/*
 * どこで: Procurement ドメインモデル
 * 何を: 出品の状態を定義する
 * なぜ: 購入・期限切れの判定を列挙型で固定するため
 */
package com.usedmarket.procurement.model;

public enum ListingStatus {
  AVAILABLE("available"),
  PURCHASED("purchased"),
  EXPIRED("expired");

  private final String value;

  ListingStatus(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static ListingStatus fromValue(String status) {
    for (ListingStatus listingStatus : values()) {
      if (listingStatus.value.equalsIgnoreCase(status)) {
        return listingStatus;
      }
    }
    throw new IllegalArgumentException("unsupported listing status: " + status);
  }
}
