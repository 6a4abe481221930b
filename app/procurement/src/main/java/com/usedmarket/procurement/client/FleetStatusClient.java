/*
 * どこで: Procurement 外部連携層
 * 何を: 利用者の保有資産状況 (診断利用回数・最低信頼度) を取得するクライアント
 * なぜ: ディスカバリー前提条件の評価に使うため
 */
package com.usedmarket.procurement.client;

import com.usedmarket.procurement.client.dto.FleetStatusResponse;
import com.usedmarket.procurement.config.HostClientProperties;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class FleetStatusClient {

  private static final Logger logger = LoggerFactory.getLogger(FleetStatusClient.class);

  private final RestClient hostRestClient;
  private final HostClientProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public FleetStatusClient(RestClient hostRestClient, HostClientProperties properties) {
    this.hostRestClient = hostRestClient;
    this.properties = properties;
  }

  public FleetStatus getStatus(String consumerId) {
    HostErrors.requireConsumerId(consumerId);
    final FleetStatusResponse response;
    try {
      response =
          hostRestClient
              .get()
              .uri(properties.fleetStatusPath(), consumerId)
              .retrieve()
              .body(FleetStatusResponse.class);
    } catch (RestClientResponseException ex) {
      throw HostErrors.fromResponse(logger, "fleet status", ex);
    } catch (ResourceAccessException ex) {
      throw HostErrors.fromResource(logger, "fleet status", ex);
    } catch (RuntimeException ex) {
      throw HostErrors.invalidResponse(logger, "fleet status", ex);
    }
    if (response == null || response.diagnosticUsageCount() == null) {
      throw new HostIntegrationException(
          HostIntegrationException.Reason.INVALID_RESPONSE, "fleet status response is invalid");
    }
    return new FleetStatus(
        consumerId, response.diagnosticUsageCount(), response.lowestReliability());
  }
}
