package com.tallybook.dto;

import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class AuthResponse {
  private String token;
  private Instant tokenExpiresAt;
  private String refreshToken;
  private Instant refreshTokenExpiresAt;
  private UserResponse user;

  public UUID getUserId() {
    return user.getId();
  }
}
