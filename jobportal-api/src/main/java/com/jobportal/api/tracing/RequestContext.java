package com.jobportal.api.tracing;

/**
 * Per-request context stored in a ThreadLocal; currently only the request id.
 */
public final class RequestContext {

  private static final ThreadLocal<String> REQUEST_ID = new ThreadLocal<>();

  private RequestContext() {}

  public static void set(String requestId) {
    REQUEST_ID.set(requestId);
  }

  public static void clear() {
    REQUEST_ID.remove();
  }

  public static String requestId() {
    return REQUEST_ID.get();
  }
}
