/*
 * どこで: Procurement Web 設定
 * 何を: RequestMdcInterceptor を /v1 配下の procurement API へ適用する
 * なぜ: 検索・出品・解放の API ログへ consumer_id を埋め込み、actuator は対象外にするため
 */
package com.usedmarket.procurement.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private static final String API_PATHS = "/v1/**";

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor).addPathPatterns(API_PATHS);
  }
}
