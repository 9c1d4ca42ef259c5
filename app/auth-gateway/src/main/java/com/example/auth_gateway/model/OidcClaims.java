/*
 * どこで: app/auth-gateway/src/main/java/com/example/auth_gateway/model/OidcClaims.java
 * 何を: id_token から抽出した主要 claims を保持するモデル
 * なぜ: トークン検証と cookie 処理を分離してテストしやすくするため
 */
package com.example.auth_gateway.model;

import java.time.Instant;

public record OidcClaims(
        String email,
        String nonce,
        Instant expiresAt) {
}
