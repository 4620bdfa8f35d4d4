package com.jobportal.api.security;

import com.jobportal.api.auth.TokenClaims;
import com.jobportal.application.auth.Actor;
import com.jobportal.domain.error.UnauthorizedException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

/**
 * Gives controllers the identity resolved by the bearer-token gate.
 */
public final class SecurityActor {

  private SecurityActor() {}

  /**
   * @throws UnauthorizedException if the current request carries no verified token
   */
  public static Actor current() {
    Authentication auth = SecurityContextHolder.getContext().getAuthentication();
    if (!(auth instanceof JwtAuthenticationToken jat)) {
      throw new UnauthorizedException("Not authenticated");
    }
    return TokenClaims.from(jat.getToken()).toActor();
  }
}
