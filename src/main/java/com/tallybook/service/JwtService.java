package com.tallybook.service;

import com.tallybook.config.JwtProperties;
import com.tallybook.model.User;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;
import javax.crypto.SecretKey;
import org.springframework.stereotype.Service;

@Service
public class JwtService {
  public static final String BEARER_PREFIX = "Bearer ";
  private final JwtProperties properties;
  private final Clock clock;
  private final SecretKey key;

  public JwtService(JwtProperties properties, Clock clock) {
    this.properties = properties;
    this.clock = clock;
    this.key = Keys.hmacShaKeyFor(properties.secret().getBytes(StandardCharsets.UTF_8));
  }

  public AccessToken issue(User user) {
    Instant now = clock.instant();
    Instant expiresAt = now.plus(properties.accessTokenTtl());
    String token = Jwts.builder()
        .setSubject(user.getId().toString())
        .setIssuer(properties.issuer())
        .setIssuedAt(Date.from(now))
        .setExpiration(Date.from(expiresAt))
        .signWith(key, SignatureAlgorithm.HS256)
        .compact();
    return new AccessToken(token, expiresAt);
  }

  // Empty when the header carries no bearer token; a bad token throws JwtException.
  public Optional<UUID> userIdFromAuthorization(String authorizationHeader) {
    if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
      return Optional.empty();
    }
    String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
    if (token.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(parseUserId(token));
  }

  public UUID parseUserId(String token) {
    Claims claims = Jwts.parserBuilder()
        .setSigningKey(key)
        .setClock(() -> Date.from(clock.instant()))
        .requireIssuer(properties.issuer())
        .build()
        .parseClaimsJws(token)
        .getBody();
    return UUID.fromString(claims.getSubject());
  }

  public record AccessToken(String token, Instant expiresAt) {}
}
