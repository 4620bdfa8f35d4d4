package com.jobportal.api.auth;

import com.jobportal.application.auth.Actor;
import com.jobportal.domain.model.Role;
import org.springframework.security.oauth2.jwt.Jwt;

import java.util.UUID;

/**
 * Portal claims carried by an access token:
 *  - sub   = identity UUID
 *  - email = identity email
 *  - role  = JOBSEEKER / EMPLOYER
 */
public record TokenClaims(UUID subject, String email, Role role) {

  public static final String CLAIM_EMAIL = "email";
  public static final String CLAIM_ROLE = "role";

  /**
   * @throws IllegalArgumentException if the subject or role claim is missing or malformed
   */
  public static TokenClaims from(Jwt jwt) {
    String sub = jwt.getSubject();
    if (sub == null || sub.isBlank()) {
      throw new IllegalArgumentException("Token has no subject");
    }
    UUID subject = UUID.fromString(sub.trim());
    Role role = Role.fromString(jwt.getClaimAsString(CLAIM_ROLE));
    return new TokenClaims(subject, jwt.getClaimAsString(CLAIM_EMAIL), role);
  }

  public Actor toActor() {
    return new Actor(subject, email, role);
  }
}
