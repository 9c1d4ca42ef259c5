/*
 * どこで: app/auth-gateway/src/main/java/com/example/auth_gateway/api/ApiErrorResponse.java
 * 何を: API エラー応答の共通 DTO
 * なぜ: 認証失敗の内部詳細を返さず、種別コードだけで判定できるようにするため
 */
package com.example.auth_gateway.api;

public record ApiErrorResponse(
        String code,
        String message) {
}
