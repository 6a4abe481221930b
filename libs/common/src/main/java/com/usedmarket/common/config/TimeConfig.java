/*
 * どこで: Common 共通設定
 * 何を: Clock と乱数源を DI 可能にする
 * なぜ: 各アプリで同一の時刻注入・乱数注入を使い、テストで差し替えられるようにするため
 */
package com.usedmarket.common.config;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.random.RandomGenerator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public RandomGenerator randomGenerator() {
    return new SecureRandom();
  }
}
