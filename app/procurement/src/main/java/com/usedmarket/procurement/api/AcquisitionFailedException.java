/*
 * どこで: Procurement API
 * 何を: 購入後の実体化失敗 (返金済み) を表現する
 * なぜ: 返金済みであることを 502 応答で呼び出し元へ伝えるため
 */
package com.usedmarket.procurement.api;

public class AcquisitionFailedException extends RuntimeException {
  public AcquisitionFailedException(String message) {
    super(message);
  }

  public AcquisitionFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
