package com.example.auth_gateway.service;

import org.springframework.security.crypto.codec.Hex;
import org.springframework.security.crypto.keygen.BytesKeyGenerator;
import org.springframework.security.crypto.keygen.KeyGenerators;
import org.springframework.stereotype.Component;

// 1 回のログイン試行に紐づく nonce を SecureRandom から生成する。
@Component
public class NonceGenerator {

  public static final int NONCE_BYTES = 20;

  private final BytesKeyGenerator keyGenerator = KeyGenerators.secureRandom(NONCE_BYTES);

  public String newNonce() {
    return new String(Hex.encode(keyGenerator.generateKey()));
  }
}
