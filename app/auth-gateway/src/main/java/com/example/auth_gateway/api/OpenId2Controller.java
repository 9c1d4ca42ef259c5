package com.example.auth_gateway.api;

import com.example.auth_gateway.api.response.OpenId2IdentityResponse;
import com.example.auth_gateway.model.AuthRequest;
import com.example.auth_gateway.model.VerifiedIdentity;
import com.example.auth_gateway.service.OpenId2CallbackService;
import com.example.auth_gateway.service.OpenId2LoginService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.net.URI;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/openid2")
@RequiredArgsConstructor
public class OpenId2Controller {

  private final OpenId2LoginService openId2LoginService;
  private final OpenId2CallbackService openId2CallbackService;

  @GetMapping("/login")
  public ResponseEntity<Void> login(HttpServletResponse response) {
    final AuthRequest authRequest = openId2LoginService.prepareLogin(response);
    return ResponseEntity.status(HttpStatus.FOUND)
        .location(URI.create(authRequest.redirectUrl()))
        .build();
  }

  @GetMapping("/callback")
  public ResponseEntity<OpenId2IdentityResponse> callback(
      HttpServletRequest request, HttpServletResponse response) {
    final VerifiedIdentity identity = openId2CallbackService.complete(request, response);
    return ResponseEntity.ok(
        new OpenId2IdentityResponse(identity.subject(), identity.verifiedAt()));
  }
}
