package com.tallybook.service;

import com.tallybook.config.JwtProperties;
import com.tallybook.model.RefreshToken;
import com.tallybook.repository.RefreshTokenRepository;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Base64;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class RefreshTokenService {
  private static final Logger log = LoggerFactory.getLogger(RefreshTokenService.class);
  private static final int TOKEN_BYTES = 64;
  private final RefreshTokenRepository repository;
  private final JwtProperties properties;
  private final SecureRandom random = new SecureRandom();

  public RefreshTokenService(RefreshTokenRepository repository, JwtProperties properties) {
    this.repository = repository;
    this.properties = properties;
  }

  @Transactional
  public TokenResult issue(UUID userId) {
    String token = generateToken();
    Instant now = Instant.now();
    RefreshToken entity = RefreshToken.forUser(userId, hash(token), now, now.plus(properties.refreshTokenTtl()));
    repository.save(entity);
    return new TokenResult(userId, token, entity.getExpiresAt());
  }

  @Transactional
  public TokenResult rotate(String refreshToken) {
    RefreshToken existing = repository.findByTokenHash(hash(refreshToken))
        .orElseThrow(() -> new BookkeepingException(ErrorKind.UNAUTHORIZED, "Invalid refresh token"));
    if (!existing.isUsable(Instant.now())) {
      log.warn("Refresh attempted with revoked or expired token for user {}", existing.getUserId());
      throw new BookkeepingException(ErrorKind.UNAUTHORIZED, "Refresh token expired");
    }
    existing.revoke(Instant.now());
    repository.save(existing);
    log.info("Rotated refresh token for user {}", existing.getUserId());
    return issue(existing.getUserId());
  }

  @Transactional
  public void revoke(String refreshToken) {
    RefreshToken existing = repository.findByTokenHash(hash(refreshToken))
        .orElseThrow(() -> BookkeepingException.notFound("Refresh token not found"));
    existing.revoke(Instant.now());
    repository.save(existing);
  }

  private String generateToken() {
    byte[] bytes = new byte[TOKEN_BYTES];
    random.nextBytes(bytes);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
  }

  private String hash(String token) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(token.getBytes(StandardCharsets.UTF_8));
      return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("Failed to hash refresh token", ex);
    }
  }

  public record TokenResult(UUID userId, String token, Instant expiresAt) {}
}
