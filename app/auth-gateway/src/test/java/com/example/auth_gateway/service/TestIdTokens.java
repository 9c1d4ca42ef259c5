package com.example.auth_gateway.service;

import com.example.auth_gateway.model.OidcProvider;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.Map;
import org.springframework.security.oauth2.core.OAuth2TokenValidatorResult;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;

/** Mints RS256 id_tokens and a matching {@link IdTokenDecoder} for tests. */
final class TestIdTokens {

  static final String ISSUER = "https://issuer.test";
  static final String CLIENT_ID = "test-client";
  static final OidcProvider PROVIDER =
      new OidcProvider(ISSUER, CLIENT_ID, ISSUER + "/authorize", ISSUER + "/jwks");

  private final KeyPair keyPair;

  TestIdTokens() {
    this.keyPair = newKeyPair();
  }

  IdTokenDecoder decoder(Clock clock) {
    final NimbusJwtDecoder decoder =
        NimbusJwtDecoder.withPublicKey((RSAPublicKey) keyPair.getPublic()).build();
    decoder.setJwtValidator(jwt -> OAuth2TokenValidatorResult.success());
    return new IdTokenDecoder(decoder, PROVIDER, clock);
  }

  String token(String email, Object emailVerified, String nonce, Instant expiresAt) {
    return token(
        ISSUER,
        CLIENT_ID,
        Map.of("email", email, "email_verified", emailVerified),
        nonce,
        expiresAt);
  }

  String token(
      String issuer, String audience, Map<String, Object> claims, String nonce, Instant expiresAt) {
    final JWTClaimsSet.Builder builder =
        new JWTClaimsSet.Builder()
            .issuer(issuer)
            .audience(audience)
            .subject("subject-1")
            .issueTime(Date.from(expiresAt.minusSeconds(3600)))
            .expirationTime(Date.from(expiresAt))
            .claim("nonce", nonce);
    claims.forEach(builder::claim);
    return sign(builder.build(), (RSAPrivateKey) keyPair.getPrivate());
  }

  static String signWithOtherKey(JWTClaimsSet claims) {
    return sign(claims, (RSAPrivateKey) newKeyPair().getPrivate());
  }

  private static String sign(JWTClaimsSet claims, RSAPrivateKey privateKey) {
    final SignedJWT jwt =
        new SignedJWT(new JWSHeader.Builder(JWSAlgorithm.RS256).keyID("test-key").build(), claims);
    try {
      jwt.sign(new RSASSASigner(privateKey));
    } catch (JOSEException ex) {
      throw new IllegalStateException(ex);
    }
    return jwt.serialize();
  }

  private static KeyPair newKeyPair() {
    try {
      final KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
      generator.initialize(2048);
      return generator.generateKeyPair();
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException(ex);
    }
  }
}
