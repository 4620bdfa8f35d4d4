package com.jobportal.api.security;

import com.jobportal.api.auth.TokenClaims;
import org.springframework.security.oauth2.core.OAuth2Error;
import org.springframework.security.oauth2.core.OAuth2ErrorCodes;
import org.springframework.security.oauth2.core.OAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2TokenValidatorResult;
import org.springframework.security.oauth2.jwt.Jwt;

/**
 * Rejects tokens whose subject is not an identity UUID or whose role claim names no portal role.
 */
final class PortalClaimsValidator implements OAuth2TokenValidator<Jwt> {

  @Override
  public OAuth2TokenValidatorResult validate(Jwt jwt) {
    try {
      TokenClaims.from(jwt);
      return OAuth2TokenValidatorResult.success();
    } catch (IllegalArgumentException e) {
      return OAuth2TokenValidatorResult.failure(
          new OAuth2Error(OAuth2ErrorCodes.INVALID_TOKEN, e.getMessage(), null));
    }
  }
}
