package com.jobportal.api.auth;

import com.jobportal.api.config.AuthProperties;
import com.jobportal.domain.error.UnauthorizedException;
import com.jobportal.domain.model.Identity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Issues and verifies stateless HS256 access tokens. Nothing is stored server-side.
 *
 * The bearer gate decodes through the same {@link JwtDecoder} bean, so {@link #verify(String)}
 * accepts exactly the tokens the gate accepts.
 */
@Service
public class TokenService {

  private static final Logger log = LoggerFactory.getLogger(TokenService.class);

  private final JwtEncoder jwtEncoder;
  private final JwtDecoder jwtDecoder;
  private final AuthProperties props;
  private final Clock clock;

  public TokenService(JwtEncoder jwtEncoder, JwtDecoder jwtDecoder, AuthProperties props, Clock clock) {
    this.jwtEncoder = jwtEncoder;
    this.jwtDecoder = jwtDecoder;
    this.props = props;
    this.clock = clock;
  }

  public IssuedToken issue(Identity identity) {
    Instant now = clock.instant();
    Instant exp = now.plus(props.accessTokenMinutes(), ChronoUnit.MINUTES);

    var claims = JwtClaimsSet.builder()
        .issuer(props.issuer())
        .issuedAt(now)
        .expiresAt(exp)
        .subject(identity.id().toString())
        .claim(TokenClaims.CLAIM_EMAIL, identity.email())
        .claim(TokenClaims.CLAIM_ROLE, identity.role().name())
        .build();

    // Pin HS256; NimbusJwtEncoder cannot pick an algorithm for an octet key on its own.
    String value;
    try {
      value = jwtEncoder.encode(
          JwtEncoderParameters.from(JwsHeader.with(MacAlgorithm.HS256).build(), claims)
      ).getTokenValue();
    } catch (RuntimeException e) {
      log.error("JWT encode failed (check jobportal.auth.jwt-secret / issuer config)", e);
      throw e;
    }
    return new IssuedToken(value, ChronoUnit.SECONDS.between(now, exp));
  }

  /**
   * @throws UnauthorizedException if the token is malformed, badly signed, expired or carries unknown claims
   */
  public TokenClaims verify(String token) {
    if (token == null || token.isBlank()) {
      throw UnauthorizedException.invalidToken("Missing token");
    }
    try {
      return TokenClaims.from(jwtDecoder.decode(token.trim()));
    } catch (JwtException | IllegalArgumentException e) {
      log.debug("token rejected: {}", e.getMessage());
      throw UnauthorizedException.invalidToken("Could not validate credentials");
    }
  }

  public record IssuedToken(String value, long expiresInSeconds) {}
}
