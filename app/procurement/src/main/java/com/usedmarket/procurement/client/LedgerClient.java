/*
 * どこで: Procurement 外部連携層
 * 何を: ホスト台帳への課金・返金呼び出しを担当するクライアント
 * なぜ: 検索手数料・出品購入・点検費用を 1 回だけ課金するため
 */
package com.usedmarket.procurement.client;

import com.usedmarket.procurement.client.dto.LedgerAmountRequest;
import com.usedmarket.procurement.config.HostClientProperties;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class LedgerClient {

  private static final Logger logger = LoggerFactory.getLogger(LedgerClient.class);
  private static final int PAYMENT_REQUIRED = 402;

  private final RestClient hostRestClient;
  private final HostClientProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public LedgerClient(RestClient hostRestClient, HostClientProperties properties) {
    this.hostRestClient = hostRestClient;
    this.properties = properties;
  }

  /**
   * 役割: 利用者の残高から amount を引き落とす。
   * 動作: 2xx は OK、402 は INSUFFICIENT_FUNDS を返す。それ以外の失敗は HostIntegrationException。
   * 前提: amount は 0 以上。同一の論理課金で 2 回呼ばない。
   */
  public ChargeResult charge(String consumerId, long amount, String reason) {
    HostErrors.requireConsumerId(consumerId);
    requireAmount(amount);
    try {
      hostRestClient
          .post()
          .uri(properties.chargePath(), consumerId)
          .contentType(MediaType.APPLICATION_JSON)
          .body(new LedgerAmountRequest(amount, reason))
          .retrieve()
          .toBodilessEntity();
      return ChargeResult.OK;
    } catch (RestClientResponseException ex) {
      if (ex.getStatusCode().value() == PAYMENT_REQUIRED) {
        logger.info("ledger charge refused consumerId={} amount={}", consumerId, amount);
        return ChargeResult.INSUFFICIENT_FUNDS;
      }
      throw HostErrors.fromResponse(logger, "ledger charge", ex);
    } catch (ResourceAccessException ex) {
      throw HostErrors.fromResource(logger, "ledger charge", ex);
    }
  }

  /** 返金など利用者残高への加算を行う。 */
  public void credit(String consumerId, long amount, String reason) {
    HostErrors.requireConsumerId(consumerId);
    requireAmount(amount);
    try {
      hostRestClient
          .post()
          .uri(properties.creditPath(), consumerId)
          .contentType(MediaType.APPLICATION_JSON)
          .body(new LedgerAmountRequest(amount, reason))
          .retrieve()
          .toBodilessEntity();
    } catch (RestClientResponseException ex) {
      throw HostErrors.fromResponse(logger, "ledger credit", ex);
    } catch (ResourceAccessException ex) {
      throw HostErrors.fromResource(logger, "ledger credit", ex);
    }
  }

  private void requireAmount(long amount) {
    if (amount < 0) {
      throw new IllegalArgumentException("amount must not be negative");
    }
  }
}
