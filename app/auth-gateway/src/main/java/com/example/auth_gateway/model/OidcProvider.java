/*
 * どこで: app/auth-gateway/src/main/java/com/example/auth_gateway/model/OidcProvider.java
 * 何を: 起動時に一度だけ解決する OIDC プロバイダ情報
 * なぜ: discovery 結果を隠れた状態にせず Bean として注入するため
 */
package com.example.auth_gateway.model;

public record OidcProvider(
        String issuer,
        String clientId,
        String authorizationEndpoint,
        String jwkSetUri) {
}
