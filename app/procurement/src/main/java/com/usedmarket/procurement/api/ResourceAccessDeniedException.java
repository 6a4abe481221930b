/*
 * どこで: Procurement API
 * 何を: 他利用者の検索・出品へのアクセスを表現する
 * なぜ: 所有者不一致を 403 応答へ変換するため
 */
package com.usedmarket.procurement.api;

public class ResourceAccessDeniedException extends RuntimeException {
  public ResourceAccessDeniedException(String message) {
    super(message);
  }
}
