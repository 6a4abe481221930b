/*
 * どこで: Procurement 設定
 * 何を: ホスト API 呼び出し専用 RestClient を提供する
 * なぜ: 下流クライアント群で baseUrl 設定を共有するため
 */
package com.usedmarket.procurement.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
public class HostClientConfig {

  @Bean
  RestClient hostRestClient(RestClient.Builder builder, HostClientProperties properties) {
    return builder.baseUrl(properties.baseUrl()).build();
  }
}
