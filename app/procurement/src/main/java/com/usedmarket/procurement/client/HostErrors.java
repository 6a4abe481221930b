/*
 * どこで: Procurement 外部連携層
 * 何を: RestClient 例外を HostIntegrationException へ変換する
 * なぜ: 各ホストクライアントで同じ分類 (404/5xx/timeout/接続失敗) を使うため
 */
package com.usedmarket.procurement.client;

import java.net.SocketTimeoutException;
import org.slf4j.Logger;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

final class HostErrors {

  private HostErrors() {}

  static HostIntegrationException fromResponse(
      Logger logger, String operation, RestClientResponseException ex) {
    logger.warn(
        "host {} failed with http status={} statusText={}",
        operation,
        ex.getStatusCode().value(),
        ex.getStatusText());
    if (ex.getStatusCode().value() == 404) {
      return new HostIntegrationException(
          HostIntegrationException.Reason.NOT_FOUND, operation + " target not found", ex);
    }
    if (ex.getStatusCode().is5xxServerError()) {
      return new HostIntegrationException(
          HostIntegrationException.Reason.BAD_GATEWAY, operation + " server error", ex);
    }
    return new HostIntegrationException(
        HostIntegrationException.Reason.BAD_GATEWAY, operation + " request failed", ex);
  }

  static HostIntegrationException fromResource(
      Logger logger, String operation, ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("host {} timed out", operation);
      return new HostIntegrationException(
          HostIntegrationException.Reason.TIMEOUT, operation + " request timeout", ex);
    }
    logger.warn("host {} connection failed", operation, ex);
    return new HostIntegrationException(
        HostIntegrationException.Reason.BAD_GATEWAY, operation + " connection failed", ex);
  }

  static HostIntegrationException invalidResponse(
      Logger logger, String operation, RuntimeException ex) {
    logger.warn("host {} response parse failed", operation, ex);
    return new HostIntegrationException(
        HostIntegrationException.Reason.INVALID_RESPONSE, operation + " response parse failed", ex);
  }

  static void requireConsumerId(String consumerId) {
    if (consumerId == null || consumerId.isBlank()) {
      throw new IllegalArgumentException("consumerId is required");
    }
  }

  private static boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
