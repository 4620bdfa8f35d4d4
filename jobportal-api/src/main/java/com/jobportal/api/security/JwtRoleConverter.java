package com.jobportal.api.security;

import com.jobportal.api.auth.TokenClaims;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

import java.util.List;

/**
 * Maps JWT claim "role" (JOBSEEKER / EMPLOYER) to Spring Security authorities
 * (ROLE_JOBSEEKER / ROLE_EMPLOYER). Claims were already checked by the decoder.
 */
public final class JwtRoleConverter implements Converter<Jwt, AbstractAuthenticationToken> {

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    TokenClaims claims = TokenClaims.from(jwt);
    String authority = switch (claims.role()) {
      case JOBSEEKER -> "ROLE_JOBSEEKER";
      case EMPLOYER -> "ROLE_EMPLOYER";
    };
    return new JwtAuthenticationToken(jwt, List.of(new SimpleGrantedAuthority(authority)), jwt.getSubject());
  }
}
