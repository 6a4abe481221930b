/*
 * どこで: Procurement 設定
 * 何を: ホスト側 API (台帳・信用・取得・保有状況) の呼び出し設定を保持する
 * なぜ: 下流 URL とパスを外部化するため
 */
package com.usedmarket.procurement.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "host")
public record HostClientProperties(
    String baseUrl,
    String chargePath,
    String creditPath,
    String creditScorePath,
    String materializePath,
    String fleetStatusPath) {

  public HostClientProperties {
    baseUrl = baseUrl == null ? "http://host:80" : baseUrl;
    chargePath = defaultIfBlank(chargePath, "/v1/ledger/{consumerId}/charges");
    creditPath = defaultIfBlank(creditPath, "/v1/ledger/{consumerId}/credits");
    creditScorePath = defaultIfBlank(creditScorePath, "/v1/credit/{consumerId}/score");
    materializePath = defaultIfBlank(materializePath, "/v1/acquisitions");
    fleetStatusPath = defaultIfBlank(fleetStatusPath, "/v1/fleet/{consumerId}/status");
  }

  private static String defaultIfBlank(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value;
  }
}
