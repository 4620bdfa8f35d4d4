package com.jobportal.api.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.jobportal.api.tracing.RequestContext;

import java.time.Instant;
import java.util.Map;

/**
 * Error body shared by controller advice and the security gate.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
    String error,
    String message,
    Map<String, String> fields,
    String requestId,
    String ts
) {

  public static ApiError of(String error, String message) {
    return of(error, message, null);
  }

  public static ApiError of(String error, String message, Map<String, String> fields) {
    return new ApiError(error, message, fields, RequestContext.requestId(), Instant.now().toString());
  }
}
