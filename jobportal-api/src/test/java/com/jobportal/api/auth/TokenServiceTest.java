package com.jobportal.api.auth;

import com.jobportal.api.config.AuthProperties;
import com.jobportal.api.security.JwtBeans;
import com.jobportal.domain.error.UnauthorizedException;
import com.jobportal.domain.model.Identity;
import com.jobportal.domain.model.Role;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenServiceTest {

  private static final AuthProperties PROPS = new AuthProperties("unit-secret", "jobportal-test", 30);

  private final JwtBeans beans = new JwtBeans(new MockEnvironment(), PROPS);
  private final TokenService tokens = service(PROPS, Clock.systemUTC());

  private final Identity employer = new Identity(
      UUID.randomUUID(), "boss@acme.test", "hash", Role.EMPLOYER, "Boss", "Acme", null, Instant.now());

  @Test
  void issuedTokenVerifiesBackToItsClaims() {
    TokenService.IssuedToken issued = tokens.issue(employer);

    TokenClaims claims = tokens.verify(issued.value());

    assertThat(issued.expiresInSeconds()).isEqualTo(30 * 60);
    assertThat(claims.subject()).isEqualTo(employer.id());
    assertThat(claims.email()).isEqualTo("boss@acme.test");
    assertThat(claims.role()).isEqualTo(Role.EMPLOYER);
    assertThat(claims.toActor().identityId()).isEqualTo(employer.id());
  }

  @Test
  void expiredTokenIsRejected() {
    Clock twoHoursAgo = Clock.offset(Clock.systemUTC(), Duration.ofHours(-2));
    String stale = service(PROPS, twoHoursAgo).issue(employer).value();

    assertThatThrownBy(() -> tokens.verify(stale))
        .isInstanceOf(UnauthorizedException.class)
        .extracting(e -> ((UnauthorizedException) e).reason())
        .isEqualTo("invalid_token");
  }

  @Test
  void tokenIsRejectedSecondsAfterExpiry() {
    AuthProperties oneMinute = new AuthProperties("unit-secret", "jobportal-test", 1);
    Clock issuedEarlier = Clock.offset(Clock.systemUTC(), Duration.ofSeconds(-65));
    String justExpired = service(oneMinute, issuedEarlier).issue(employer).value();

    assertThatThrownBy(() -> tokens.verify(justExpired))
        .isInstanceOf(UnauthorizedException.class);
  }

  @Test
  void tamperedOrForeignTokensAreRejected() {
    String value = tokens.issue(employer).value();
    String[] parts = value.split("\\.");
    String tampered = parts[0] + "." + parts[1] + "." + new StringBuilder(parts[2]).reverse();

    AuthProperties otherKey = new AuthProperties("another-secret", "jobportal-test", 30);
    String foreign = service(otherKey, Clock.systemUTC()).issue(employer).value();

    assertThatThrownBy(() -> tokens.verify(tampered)).isInstanceOf(UnauthorizedException.class);
    assertThatThrownBy(() -> tokens.verify(foreign)).isInstanceOf(UnauthorizedException.class);
    assertThatThrownBy(() -> tokens.verify("not-a-jwt")).isInstanceOf(UnauthorizedException.class);
    assertThatThrownBy(() -> tokens.verify(" ")).isInstanceOf(UnauthorizedException.class);
  }

  @Test
  void tokenFromAnotherIssuerIsRejected() {
    AuthProperties otherIssuer = new AuthProperties("unit-secret", "elsewhere", 30);
    String value = service(otherIssuer, Clock.systemUTC()).issue(employer).value();

    assertThatThrownBy(() -> tokens.verify(value)).isInstanceOf(UnauthorizedException.class);
  }

  @Test
  void unknownRoleOrNonUuidSubjectIsRejected() {
    JwtEncoder encoder = beans.jwtEncoder();

    String admin = sign(encoder, employer.id().toString(), "ADMIN");
    String badSubject = sign(encoder, "boss", "EMPLOYER");

    assertThatThrownBy(() -> tokens.verify(admin)).isInstanceOf(UnauthorizedException.class);
    assertThatThrownBy(() -> tokens.verify(badSubject)).isInstanceOf(UnauthorizedException.class);
  }

  @Test
  void emptySecretOnlyAllowedForDevProfile() {
    AuthProperties blank = new AuthProperties(" ", "jobportal", 60);

    assertThatThrownBy(() -> new JwtBeans(new MockEnvironment(), blank).jwtEncoder())
        .isInstanceOf(IllegalStateException.class);

    MockEnvironment dev = new MockEnvironment();
    dev.setActiveProfiles("dev");
    assertThat(new JwtBeans(dev, blank).jwtEncoder()).isNotNull();
  }

  private static TokenService service(AuthProperties props, Clock clock) {
    JwtBeans beans = new JwtBeans(new MockEnvironment(), props);
    return new TokenService(beans.jwtEncoder(), beans.jwtDecoder(), props, clock);
  }

  private static String sign(JwtEncoder encoder, String subject, String role) {
    Instant now = Instant.now();
    var claims = JwtClaimsSet.builder()
        .issuer(PROPS.issuer())
        .issuedAt(now)
        .expiresAt(now.plusSeconds(600))
        .subject(subject)
        .claim(TokenClaims.CLAIM_EMAIL, "boss@acme.test")
        .claim(TokenClaims.CLAIM_ROLE, role)
        .build();
    return encoder.encode(JwtEncoderParameters.from(JwsHeader.with(MacAlgorithm.HS256).build(), claims)).getTokenValue();
  }
}
