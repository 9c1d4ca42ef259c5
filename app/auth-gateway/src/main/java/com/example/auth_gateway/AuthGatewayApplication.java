package com.example.auth_gateway;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@Import(TimeConfig.class)
public class AuthGatewayApplication {

  public static void main(String[] args) {
    SpringApplication.run(AuthGatewayApplication.class, args);
  }
}
