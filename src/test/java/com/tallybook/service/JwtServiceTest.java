package com.tallybook.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tallybook.config.JwtProperties;
import com.tallybook.model.User;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JwtServiceTest {
  private static final String SECRET = "test-secret-that-is-long-enough-for-hmac-sha-256-signing";
  private static final Instant NOW = Instant.parse("2024-03-15T10:00:00Z");

  private JwtProperties properties;
  private JwtService jwtService;
  private User user;

  @BeforeEach
  void setUp() {
    properties = new JwtProperties(SECRET, "tallybook-test", Duration.ofMinutes(15), null);
    jwtService = new JwtService(properties, Clock.fixed(NOW, ZoneOffset.UTC));
    user = new User();
    user.setId(UUID.randomUUID());
    user.setEmail("ann@example.com");
  }

  @Test
  void tokenCarriesOnlyTheUserIdAndExpiresAfterTtl() {
    JwtService.AccessToken access = jwtService.issue(user);

    assertThat(access.expiresAt()).isEqualTo(NOW.plus(Duration.ofMinutes(15)));
    Claims claims = Jwts.parserBuilder()
        .setSigningKey(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)))
        .setClock(() -> Date.from(NOW))
        .build()
        .parseClaimsJws(access.token())
        .getBody();
    assertThat(claims.getSubject()).isEqualTo(user.getId().toString());
    assertThat(claims).doesNotContainKey("email");
    assertThat(jwtService.parseUserId(access.token())).isEqualTo(user.getId());
  }

  @Test
  void authorizationHeaderWithoutBearerTokenIsIgnored() {
    assertThat(jwtService.userIdFromAuthorization(null)).isEmpty();
    assertThat(jwtService.userIdFromAuthorization("Basic YW5uOnNlY3JldA==")).isEmpty();
    assertThat(jwtService.userIdFromAuthorization("Bearer   ")).isEmpty();
  }

  @Test
  void bearerHeaderResolvesToUserId() {
    String header = JwtService.BEARER_PREFIX + jwtService.issue(user).token();

    assertThat(jwtService.userIdFromAuthorization(header)).contains(user.getId());
  }

  @Test
  void tokenFromOtherIssuerIsRejected() {
    JwtService other = new JwtService(
        new JwtProperties(SECRET, "someone-else", null, null), Clock.fixed(NOW, ZoneOffset.UTC));
    String foreign = other.issue(user).token();

    assertThatThrownBy(() -> jwtService.parseUserId(foreign)).isInstanceOf(JwtException.class);
  }

  @Test
  void expiredTokenIsRejected() {
    String token = jwtService.issue(user).token();
    JwtService later = new JwtService(properties, Clock.fixed(NOW.plus(Duration.ofHours(1)), ZoneOffset.UTC));

    assertThatThrownBy(() -> later.parseUserId(token)).isInstanceOf(ExpiredJwtException.class);
  }

  @Test
  void shortSecretIsRefused() {
    assertThatThrownBy(() -> new JwtProperties("too-short", "tallybook", null, null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void missingTtlsFallBackToDefaults() {
    JwtProperties defaults = new JwtProperties(SECRET, "tallybook", null, null);

    assertThat(defaults.accessTokenTtl()).isEqualTo(Duration.ofMinutes(60));
    assertThat(defaults.refreshTokenTtl()).isEqualTo(Duration.ofDays(30));
  }
}
