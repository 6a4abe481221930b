/*
 * どこで: Procurement 外部連携層
 * 何を: ホスト API 呼び出し失敗を表現する
 * なぜ: API 層で HTTP ステータスへ一貫変換するため
 */
package com.usedmarket.procurement.client;

public class HostIntegrationException extends RuntimeException {

  public enum Reason {
    NOT_FOUND,
    TIMEOUT,
    INVALID_RESPONSE,
    BAD_GATEWAY
  }

  private final Reason reason;

  public HostIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public HostIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
