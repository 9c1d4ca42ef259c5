package com.example.auth_gateway.config;

import com.example.auth_gateway.service.SessionService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.LoginUrlAuthenticationEntryPoint;
import org.springframework.security.web.csrf.CookieCsrfTokenRepository;
import org.springframework.security.web.util.matcher.AnyRequestMatcher;
import org.springframework.security.web.util.matcher.RequestMatcher;

@Configuration
public class AuthSecurityConfig {

  private final boolean csrfEnabled;

  public AuthSecurityConfig(@Value("${app.security.csrf-enabled:true}") boolean csrfEnabled) {
    this.csrfEnabled = csrfEnabled;
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http,
      OidcProperties oidcProperties,
      SessionService sessionService)
      throws Exception {
    final String callbackPath = oidcProperties.callbackPath();
    if (csrfEnabled) {
      // callback は nonce cookie で login CSRF を防ぐため CSRF トークン対象外にする。
      http.csrf(
          csrf ->
              csrf.csrfTokenRepository(CookieCsrfTokenRepository.withHttpOnlyFalse())
                  .ignoringRequestMatchers(callbackPath, "/openid2/callback"));
    } else {
      http.csrf(AbstractHttpConfigurer::disable);
    }
    http.sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        // Bean にするとサーブレットフィルタとしても登録されるため、チェーン内でのみ生成する。
        // 匿名トークンが入る前に cookie から認証する。
        .addFilterBefore(
            new SessionCookieAuthenticationFilter(sessionService),
            AnonymousAuthenticationFilter.class)
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        "/login",
                        callbackPath,
                        "/logout",
                        "/openid2/login",
                        "/openid2/callback",
                        "/error",
                        "/actuator/health",
                        "/actuator/health/**",
                        "/actuator/info",
                        "/actuator/prometheus")
                    .permitAll()
                    .anyRequest()
                    .authenticated())
        .exceptionHandling(
            ex ->
                ex.defaultAuthenticationEntryPointFor(
                        new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED), apiRequestMatcher())
                    .defaultAuthenticationEntryPointFor(
                        new LoginUrlAuthenticationEntryPoint("/login"), AnyRequestMatcher.INSTANCE))
        .formLogin(AbstractHttpConfigurer::disable)
        .httpBasic(AbstractHttpConfigurer::disable)
        .logout(AbstractHttpConfigurer::disable);

    return http.build();
  }

  private RequestMatcher apiRequestMatcher() {
    return request -> {
      final String uri = request.getRequestURI();
      return uri != null && uri.startsWith("/v1/");
    };
  }
}
