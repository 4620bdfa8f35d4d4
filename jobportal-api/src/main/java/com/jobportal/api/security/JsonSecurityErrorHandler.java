package com.jobportal.api.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobportal.api.common.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.oauth2.server.resource.InvalidBearerTokenException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Renders gate rejections in the same JSON shape as controller errors:
 * 401 for a missing/invalid/expired token, 403 for a role mismatch.
 */
@Component
public class JsonSecurityErrorHandler implements AuthenticationEntryPoint, AccessDeniedHandler {

  private static final Logger log = LoggerFactory.getLogger(JsonSecurityErrorHandler.class);

  private final ObjectMapper mapper;

  public JsonSecurityErrorHandler(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  @Override
  public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException ex)
      throws IOException {
    boolean invalidToken = ex instanceof InvalidBearerTokenException;
    response.setHeader(HttpHeaders.WWW_AUTHENTICATE,
        invalidToken ? "Bearer error=\"invalid_token\"" : "Bearer");
    write(response, HttpStatus.UNAUTHORIZED, ApiError.of(
        invalidToken ? "invalid_token" : "unauthorized",
        "Could not validate credentials"));
  }

  @Override
  public void handle(HttpServletRequest request, HttpServletResponse response, AccessDeniedException ex)
      throws IOException {
    log.warn("[GATE] role rejected method={} path={}", request.getMethod(), request.getRequestURI());
    write(response, HttpStatus.FORBIDDEN, ApiError.of("forbidden", "Insufficient role for this operation"));
  }

  private void write(HttpServletResponse response, HttpStatus status, ApiError body) throws IOException {
    response.setStatus(status.value());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    mapper.writeValue(response.getOutputStream(), body);
  }
}
