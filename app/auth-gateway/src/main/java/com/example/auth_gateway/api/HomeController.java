package com.example.auth_gateway.api;

import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

// 未ログイン時はセキュリティ設定の entry point が /login へリダイレクトする。
@RestController
public class HomeController {

  @GetMapping("/")
  public String home(Authentication authentication) {
    return "Hello " + authentication.getName();
  }
}
