/*
 * どこで: Common 共通設定
 * 何を: Clock を DI 可能にする
 * なぜ: nonce の鮮度判定や id_token の期限判定をテストで固定時刻に差し替えるため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
