/*
 * どこで: app/auth-gateway/src/main/java/com/example/auth_gateway/model/AuthRequest.java
 * 何を: ログイン試行 1 回分のリダイレクト要求
 * なぜ: realm/nonce と組み立て済み URL を同じ値として扱うため
 */
package com.example.auth_gateway.model;

public record AuthRequest(
        String providerEndpoint,
        String returnUrl,
        String realm,
        String nonce,
        String redirectUrl) {
}
