/*
 * どこで: Procurement 外部連携層
 * 何を: ホストの信用スコア取得を担当するクライアント
 * なぜ: 手数料補正とディスカバリー前提条件で信用スコアを参照するため
 */
package com.usedmarket.procurement.client;

import com.usedmarket.procurement.client.dto.CreditScoreResponse;
import com.usedmarket.procurement.config.HostClientProperties;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class CreditRatingClient {

  private static final Logger logger = LoggerFactory.getLogger(CreditRatingClient.class);

  private final RestClient hostRestClient;
  private final HostClientProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public CreditRatingClient(RestClient hostRestClient, HostClientProperties properties) {
    this.hostRestClient = hostRestClient;
    this.properties = properties;
  }

  /** スコア未登録 (404 または score 欠落) は empty を返す。 */
  public OptionalInt getScore(String consumerId) {
    HostErrors.requireConsumerId(consumerId);
    final CreditScoreResponse response;
    try {
      response =
          hostRestClient
              .get()
              .uri(properties.creditScorePath(), consumerId)
              .retrieve()
              .body(CreditScoreResponse.class);
    } catch (RestClientResponseException ex) {
      if (ex.getStatusCode().value() == 404) {
        return OptionalInt.empty();
      }
      throw HostErrors.fromResponse(logger, "credit score", ex);
    } catch (ResourceAccessException ex) {
      throw HostErrors.fromResource(logger, "credit score", ex);
    } catch (RuntimeException ex) {
      throw HostErrors.invalidResponse(logger, "credit score", ex);
    }
    if (response == null || response.score() == null) {
      return OptionalInt.empty();
    }
    return OptionalInt.of(response.score());
  }
}
