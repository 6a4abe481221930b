/*
 * どこで: Procurement API
 * 何を: 残高不足による課金拒否を表現する
 * なぜ: 呼び出し元へ 402 応答で通知するため
 */
package com.usedmarket.procurement.api;

public class InsufficientFundsException extends RuntimeException {
  public InsufficientFundsException(String message) {
    super(message);
  }
}
