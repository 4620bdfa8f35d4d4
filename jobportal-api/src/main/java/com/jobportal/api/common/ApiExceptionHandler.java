package com.jobportal.api.common;

import com.jobportal.domain.error.ConflictException;
import com.jobportal.domain.error.DomainException;
import com.jobportal.domain.error.ForbiddenException;
import com.jobportal.domain.error.NotFoundException;
import com.jobportal.domain.error.UnauthorizedException;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(DomainException.class)
  public ResponseEntity<ApiError> domain(DomainException ex) {
    HttpStatus status = statusOf(ex);
    ResponseEntity.BodyBuilder builder = ResponseEntity.status(status);
    if (status == HttpStatus.UNAUTHORIZED) {
      builder.header(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
    }
    return builder.body(ApiError.of(ex.reason(), ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> validation(MethodArgumentNotValidException ex) {
    Map<String, String> fields = new LinkedHashMap<>();
    for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
      fields.putIfAbsent(fe.getField(), fe.getDefaultMessage() == null ? "invalid" : fe.getDefaultMessage());
    }
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(ApiError.of("validation_error", "invalid_request", fields));
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ApiError> validation(ConstraintViolationException ex) {
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(ApiError.of("validation_error", ex.getMessage() == null ? "invalid_request" : ex.getMessage()));
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ApiError> missingParameter(MissingServletRequestParameterException ex) {
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(ApiError.of("validation_error", "invalid_request",
            Map.of(ex.getParameterName(), "must not be null")));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> unreadable(HttpMessageNotReadableException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(ApiError.of("bad_request", "Malformed request body"));
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiError> typeMismatch(MethodArgumentTypeMismatchException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(ApiError.of("bad_request", "Invalid value for '" + ex.getName() + "'"));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiError> badRequest(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(ApiError.of("bad_request", ex.getMessage() == null ? "invalid_request" : ex.getMessage()));
  }

  /**
   * Framework exceptions (404 no route, 405, 415 ...) keep their own status; anything else is a 500.
   */
  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> unexpected(Exception ex) {
    if (ex instanceof ErrorResponse er) {
      HttpStatusCode code = er.getStatusCode();
      HttpStatus resolved = HttpStatus.resolve(code.value());
      String reason = resolved == null ? "error" : resolved.name().toLowerCase(Locale.ROOT);
      return ResponseEntity.status(code).body(ApiError.of(reason, er.getBody().getDetail()));
    }
    log.error("Unhandled error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ApiError.of("internal_error", "Internal server error"));
  }

  private static HttpStatus statusOf(DomainException ex) {
    if (ex instanceof NotFoundException) return HttpStatus.NOT_FOUND;
    if (ex instanceof ForbiddenException) return HttpStatus.FORBIDDEN;
    if (ex instanceof ConflictException) return HttpStatus.CONFLICT;
    if (ex instanceof UnauthorizedException) return HttpStatus.UNAUTHORIZED;
    return HttpStatus.BAD_REQUEST;
  }
}
