/*
 * どこで: Procurement API
 * 何を: 検索レコード未検出を表現する
 * なぜ: 参照/キャンセルの 404 応答へ変換するため
 */
package com.usedmarket.procurement.api;

public class SearchNotFoundException extends RuntimeException {
  public SearchNotFoundException(String searchId) {
    super("search not found: " + searchId);
  }
}
