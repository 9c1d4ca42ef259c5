/*
 * どこで: app/auth-gateway/src/main/java/com/example/auth_gateway/api/AuthController.java
 * 何を: id_token フローのログイン開始/コールバック/ログアウト/自分情報 API を提供
 * なぜ: 認証フローの入口を明示的な handler として組み込めるようにするため
 */
package com.example.auth_gateway.api;

import com.example.auth_gateway.api.response.MeResponse;
import com.example.auth_gateway.config.OidcProperties;
import com.example.auth_gateway.model.AuthRequest;
import com.example.auth_gateway.model.VerifiedIdentity;
import com.example.auth_gateway.service.OidcCallbackService;
import com.example.auth_gateway.service.OidcLoginService;
import com.example.auth_gateway.service.SessionService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.net.URI;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.HtmlUtils;

@RestController
public class AuthController {

    // id_token は URL fragment で届きサーバーへ送られないため、JS で POST し直す。
    private static final String RELAY_PAGE_TEMPLATE = """
            <html><body><script>
            let params = new URLSearchParams(window.location.hash.substring(1));
            let form = document.createElement('form');
            form.method = 'POST';
            form.action = '%s';
            let input = document.createElement('input');
            input.type = 'hidden';
            input.name = 'id_token';
            input.value = params.get('id_token') || '';
            form.appendChild(input);
            document.body.appendChild(form);
            form.submit();
            </script></body></html>
            """;

    private final OidcLoginService oidcLoginService;
    private final OidcCallbackService oidcCallbackService;
    private final SessionService sessionService;
    private final OidcProperties oidcProperties;

    public AuthController(
            OidcLoginService oidcLoginService,
            OidcCallbackService oidcCallbackService,
            SessionService sessionService,
            OidcProperties oidcProperties) {
        this.oidcLoginService = oidcLoginService;
        this.oidcCallbackService = oidcCallbackService;
        this.sessionService = sessionService;
        this.oidcProperties = oidcProperties;
    }

    /**
     * 役割:
     * - OIDC ログインを開始する。
     *
     * 期待動作:
     * - nonce cookie を発行し、古いセッション cookie を削除したうえで authorize URL へ 302 する。
     */
    @GetMapping("/login")
    public ResponseEntity<Void> login(HttpServletRequest request, HttpServletResponse response) {
        AuthRequest authRequest = oidcLoginService.prepareLogin(request, response);
        return ResponseEntity.status(HttpStatus.FOUND)
                .location(URI.create(authRequest.redirectUrl()))
                .build();
    }

    /**
     * 役割:
     * - fragment の id_token を同じパスへ POST し直す中継ページを返す。
     */
    @GetMapping(value = "${oidc.callback-path:/auth/callback}", produces = MediaType.TEXT_HTML_VALUE)
    public String callbackRelay() {
        return RELAY_PAGE_TEMPLATE.formatted(
                HtmlUtils.htmlEscape(oidcProperties.callbackPath()));
    }

    /**
     * 役割:
     * - IdP から中継された id_token を検証してログインを完了する。
     *
     * 期待動作:
     * - 署名/issuer/audience/期限/email_verified/nonce を検証し、成功時はセッション cookie を発行する。
     * - 失敗時は AuthApiExceptionHandler がエラー種別を返す。
     */
    @PostMapping("${oidc.callback-path:/auth/callback}")
    public ResponseEntity<Void> callback(
            @RequestParam(name = "id_token", required = false) String idToken,
            HttpServletRequest request,
            HttpServletResponse response) {
        oidcCallbackService.complete(idToken, request, response);
        return ResponseEntity.status(HttpStatus.FOUND)
                .location(URI.create(oidcProperties.homePath()))
                .build();
    }

    /**
     * 役割:
     * - セッション cookie を即時失効させる。
     *
     * 期待動作:
     * - サーバー側状態は無いため、cookie が存在しない場合でも 204 を返す。
     */
    @PostMapping("/logout")
    public ResponseEntity<Void> logout(HttpServletResponse response) {
        sessionService.clear(response);
        return ResponseEntity.noContent().build();
    }

    /**
     * 役割:
     * - 現在ログイン中ユーザーの email を返す。
     *
     * 期待動作:
     * - セッション無効時は 401 を返す。
     */
    @GetMapping("/v1/me")
    public ResponseEntity<MeResponse> me(Authentication authentication) {
        if (authentication == null
                || !(authentication.getDetails() instanceof VerifiedIdentity identity)) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        return ResponseEntity.ok(new MeResponse(identity.subject(), identity.expiresAt()));
    }
}
