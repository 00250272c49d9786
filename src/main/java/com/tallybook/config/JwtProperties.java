package com.tallybook.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "tallybook.jwt")
public record JwtProperties(String secret, String issuer, Duration accessTokenTtl, Duration refreshTokenTtl) {
  public JwtProperties {
    if (secret == null || secret.length() < 32) {
      throw new IllegalArgumentException("tallybook.jwt.secret must be at least 32 characters");
    }
    if (accessTokenTtl == null) {
      accessTokenTtl = Duration.ofMinutes(60);
    }
    if (refreshTokenTtl == null) {
      refreshTokenTtl = Duration.ofDays(30);
    }
  }
}
