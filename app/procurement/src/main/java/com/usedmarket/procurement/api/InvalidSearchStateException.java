/*
 * どこで: Procurement API
 * 何を: 現在の状態では許可されない操作を表現する
 * なぜ: 状態不整合を 409 応答へ変換するため
 */
package com.usedmarket.procurement.api;

public class InvalidSearchStateException extends RuntimeException {
  public InvalidSearchStateException(String message) {
    super(message);
  }
}
