package com.example.sessionguard.web.rest.errors;

import com.example.sessionguard.domain.ratelimit.RateLimitDecision;
import com.example.sessionguard.exception.RateLimitExceededException;
import com.example.sessionguard.exception.SessionException;
import com.example.sessionguard.exception.SessionStoreException;
import com.example.sessionguard.security.filter.RateLimitFilter;
import jakarta.validation.ConstraintViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global Error Handler
 *
 * Provides consistent error responses without exposing sensitive information
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
@RequestMapping(produces = MediaType.APPLICATION_JSON_VALUE)
public class GlobalErrorHandler {

  private final ErrorResponseWriter errorResponseWriter;

  @ExceptionHandler(RateLimitExceededException.class)
  public ResponseEntity<Map<String, Object>> handleRateLimitExceeded(
      RateLimitExceededException ex, WebRequest request) {
    RateLimitDecision decision = ex.getDecision();

    Map<String, Object> body = createErrorBody(
        HttpStatus.TOO_MANY_REQUESTS,
        "rate_limit_exceeded",
        "Rate limit exceeded. Try again in %d seconds".formatted(decision.retryAfterSeconds()),
        request);

    return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
        .header(RateLimitFilter.HEADER_LIMIT, String.valueOf(decision.limit()))
        .header(RateLimitFilter.HEADER_REMAINING, String.valueOf(decision.remaining()))
        .header(RateLimitFilter.HEADER_RESET, String.valueOf(decision.resetEpochSecond()))
        .header(HttpHeaders.RETRY_AFTER, String.valueOf(decision.retryAfterSeconds()))
        .body(body);
  }

  @ExceptionHandler(SessionException.class)
  public ResponseEntity<Map<String, Object>> handleSessionException(
      SessionException ex, WebRequest request) {
    log.debug("Session error: {}", ex.getMessage());

    Map<String, Object> body = createErrorBody(
        HttpStatus.UNAUTHORIZED,
        "invalid_session",
        "Session is invalid or expired",
        request);

    return new ResponseEntity<>(body, HttpStatus.UNAUTHORIZED);
  }

  @ExceptionHandler(SessionStoreException.class)
  public ResponseEntity<Map<String, Object>> handleSessionStoreException(
      SessionStoreException ex, WebRequest request) {
    log.error("Session store error", ex);

    Map<String, Object> body = createErrorBody(
        HttpStatus.SERVICE_UNAVAILABLE,
        "service_unavailable",
        "Service temporarily unavailable",
        request);

    return new ResponseEntity<>(body, HttpStatus.SERVICE_UNAVAILABLE);
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<Map<String, Object>> handleAccessDeniedException(
      AccessDeniedException ex, WebRequest request) {
    log.warn("Access denied: {}", ex.getMessage());

    Map<String, Object> body = createErrorBody(
        HttpStatus.FORBIDDEN,
        "access_denied",
        "Access denied",
        request);

    return new ResponseEntity<>(body, HttpStatus.FORBIDDEN);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> handleValidationException(
      MethodArgumentNotValidException ex, WebRequest request) {

    String errors = ex.getBindingResult().getFieldErrors().stream()
        .map(FieldError::getDefaultMessage)
        .collect(Collectors.joining(", "));

    return badRequest("validation_error", errors, request);
  }

  @ExceptionHandler(HandlerMethodValidationException.class)
  public ResponseEntity<Map<String, Object>> handleMethodValidationException(
      HandlerMethodValidationException ex, WebRequest request) {

    String errors = ex.getAllValidationResults().stream()
        .flatMap(result -> result.getResolvableErrors().stream())
        .map(error -> error.getDefaultMessage())
        .collect(Collectors.joining(", "));

    return badRequest("validation_error", errors, request);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<Map<String, Object>> handleConstraintViolation(
      ConstraintViolationException ex, WebRequest request) {
    return badRequest("validation_error", ex.getMessage(), request);
  }

  @ExceptionHandler({MethodArgumentTypeMismatchException.class, IllegalArgumentException.class})
  public ResponseEntity<Map<String, Object>> handleBadArgument(
      Exception ex, WebRequest request) {
    return badRequest("invalid_argument", ex.getMessage(), request);
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<Map<String, Object>> handleMissingParams(
      MissingServletRequestParameterException ex, WebRequest request) {
    return badRequest("missing_parameter",
                      String.format("Missing required parameter: %s", ex.getParameterName()),
                      request);
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<Map<String, Object>> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException ex, WebRequest request) {

    Map<String, Object> body = createErrorBody(
        HttpStatus.METHOD_NOT_ALLOWED,
        "method_not_allowed",
        String.format("Method %s not supported", ex.getMethod()),
        request);

    return new ResponseEntity<>(body, HttpStatus.METHOD_NOT_ALLOWED);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGenericException(
      Exception ex, WebRequest request) {
    log.error("Unexpected error", ex);

    Map<String, Object> body = createErrorBody(
        HttpStatus.INTERNAL_SERVER_ERROR,
        "internal_error",
        "An error occurred processing your request",
        request);

    return new ResponseEntity<>(body, HttpStatus.INTERNAL_SERVER_ERROR);
  }

  private ResponseEntity<Map<String, Object>> badRequest(String error, String message, WebRequest request) {
    return new ResponseEntity<>(createErrorBody(HttpStatus.BAD_REQUEST, error, message, request),
                                HttpStatus.BAD_REQUEST);
  }

  private Map<String, Object> createErrorBody(
      HttpStatus status, String error, String message, WebRequest request) {
    return errorResponseWriter.body(status, error, message, extractPath(request));
  }

  private String extractPath(WebRequest request) {
    String description = request.getDescription(false);
    return description.replace("uri=", "");
  }
}
