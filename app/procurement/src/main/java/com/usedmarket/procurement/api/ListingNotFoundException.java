/*
 * どこで: Procurement API
 * 何を: 出品未検出を表現する
 * なぜ: 購入/点検の 404 応答へ変換するため
 */
package com.usedmarket.procurement.api;

public class ListingNotFoundException extends RuntimeException {
  public ListingNotFoundException(String listingId) {
    super("listing not found: " + listingId);
  }
}
