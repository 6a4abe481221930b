/*
 * どこで: Procurement ドメインモデル
 * 何を: 外部へ通知するドメインイベントを表す
 * なぜ: publisher 実装から検索・出品の内部型を隠すため
 */
package com.usedmarket.procurement.model;

/** searchId / listingId / catalogKey は該当しないイベントでは null。 */
public record ProcurementEvent(
    ProcurementEventType type,
    String consumerId,
    String searchId,
    String listingId,
    String catalogKey,
    int simulatedDay) {

  public static ProcurementEvent ofSearch(
      ProcurementEventType type, SearchRecord record, int simulatedDay) {
    return new ProcurementEvent(
        type, record.consumerId(), record.id(), null, record.item().catalogKey(), simulatedDay);
  }

  public static ProcurementEvent ofListing(
      ProcurementEventType type, SearchListing listing, int simulatedDay) {
    return new ProcurementEvent(
        type,
        listing.consumerId(),
        listing.searchId(),
        listing.id(),
        listing.catalogKey(),
        simulatedDay);
  }
}
