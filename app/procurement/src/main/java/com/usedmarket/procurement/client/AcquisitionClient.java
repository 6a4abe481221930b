/*
 * どこで: Procurement 外部連携層
 * 何を: 購入済みアイテムの実体化をホストへ依頼するクライアント
 * なぜ: 課金後の実体化失敗を検知して返金できるようにするため
 */
package com.usedmarket.procurement.client;

import com.usedmarket.procurement.client.dto.AcquisitionRequest;
import com.usedmarket.procurement.client.dto.AcquisitionResponse;
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
public class AcquisitionClient {

  private static final Logger logger = LoggerFactory.getLogger(AcquisitionClient.class);

  private final RestClient hostRestClient;
  private final HostClientProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public AcquisitionClient(RestClient hostRestClient, HostClientProperties properties) {
    this.hostRestClient = hostRestClient;
    this.properties = properties;
  }

  /**
   * 役割: カタログキーのアイテムを利用者の所有物として実体化する。
   * 動作: ホストが accepted=true を返した場合のみ true。通信失敗は HostIntegrationException。
   * 前提: ホスト側は再試行に対して冪等であること。
   */
  public boolean materialize(AcquisitionRequest request) {
    if (request == null || request.catalogKey() == null || request.catalogKey().isBlank()) {
      throw new IllegalArgumentException("catalogKey is required");
    }
    HostErrors.requireConsumerId(request.consumerId());
    final AcquisitionResponse response;
    try {
      response =
          hostRestClient
              .post()
              .uri(properties.materializePath())
              .contentType(MediaType.APPLICATION_JSON)
              .body(request)
              .retrieve()
              .body(AcquisitionResponse.class);
    } catch (RestClientResponseException ex) {
      throw HostErrors.fromResponse(logger, "materialize", ex);
    } catch (ResourceAccessException ex) {
      throw HostErrors.fromResource(logger, "materialize", ex);
    } catch (RuntimeException ex) {
      throw HostErrors.invalidResponse(logger, "materialize", ex);
    }
    if (response == null || response.accepted() == null) {
      throw new HostIntegrationException(
          HostIntegrationException.Reason.INVALID_RESPONSE, "materialize response is invalid");
    }
    return response.accepted();
  }
}
