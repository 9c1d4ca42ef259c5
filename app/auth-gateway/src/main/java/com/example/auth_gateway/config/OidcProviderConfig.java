/*
 * どこで: auth-gateway 設定
 * 何を: OIDC プロバイダ情報と id_token デコーダを起動時に一度だけ生成する
 * なぜ: discovery 失敗を起動失敗として早期に検出するため
 */
package com.example.auth_gateway.config;

import com.example.auth_gateway.model.OidcProvider;
import com.example.auth_gateway.service.IdTokenDecoder;
import com.example.auth_gateway.service.OidcProviderDiscoveryClient;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(OidcProperties.class)
public class OidcProviderConfig {

  @Bean
  OidcProvider oidcProvider(RestClient.Builder builder, OidcProperties properties) {
    // discovery 専用 RestClient。baseUrl は issuer ごとに異なるため設定しない。
    return new OidcProviderDiscoveryClient(builder.build()).resolve(properties);
  }

  @Bean
  IdTokenDecoder idTokenDecoder(OidcProvider oidcProvider, Clock clock) {
    return IdTokenDecoder.forProvider(oidcProvider, clock);
  }
}
