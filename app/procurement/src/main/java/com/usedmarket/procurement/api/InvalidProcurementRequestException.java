/*
 * どこで: Procurement API
 * 何を: 不正な入力を表現する
 * なぜ: バリデーション失敗を 400 応答へ変換するため
 */
package com.usedmarket.procurement.api;

public class InvalidProcurementRequestException extends RuntimeException {
  public InvalidProcurementRequestException(String message) {
    super(message);
  }
}
