package com.wgbot.api.common;

import com.wgbot.application.ports.RecordNotFoundException;
import com.wgbot.application.provisioning.ProvisioningError;
import com.wgbot.application.provisioning.ProvisioningException;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(RecordNotFoundException.class)
  public ResponseEntity<Map<String, Object>> notFound(RecordNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
    return error(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage() == null ? "invalid_request" : ex.getMessage());
  }

  @ExceptionHandler({MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class})
  public ResponseEntity<Map<String, Object>> unreadable(Exception ex) {
    return error(HttpStatus.BAD_REQUEST, "bad_request", "invalid_request");
  }

  @ExceptionHandler(IllegalStateException.class)
  public ResponseEntity<Map<String, Object>> conflict(IllegalStateException ex) {
    return error(HttpStatus.CONFLICT, "conflict", ex.getMessage());
  }

  /**
   * Host-side failures: timeout 504, no free server 503, everything else 502. The cause text is kept.
   */
  @ExceptionHandler(ProvisioningException.class)
  public ResponseEntity<Map<String, Object>> provisioning(ProvisioningException ex) {
    HttpStatus status = statusFor(ex.error());
    log.warn("Provisioning failed: {} ({})", ex.getMessage(), ex.reason());

    Map<String, Object> body = body(status, ex.reason(), ex.getMessage());
    if (ex.stage() != null) {
      body.put("stage", ex.stage().name().toLowerCase(Locale.ROOT));
    }
    return ResponseEntity.status(status).body(body);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> validation(MethodArgumentNotValidException ex) {
    Map<String, String> fields = new HashMap<>();
    for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
      fields.put(fe.getField(), fe.getDefaultMessage() == null ? "invalid" : fe.getDefaultMessage());
    }
    Map<String, Object> body = body(HttpStatus.BAD_REQUEST, "validation_error", "invalid_request");
    body.put("fields", fields);
    return ResponseEntity.badRequest().body(body);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<Map<String, Object>> validation(ConstraintViolationException ex) {
    return error(HttpStatus.BAD_REQUEST, "validation_error", ex.getMessage() == null ? "invalid_request" : ex.getMessage());
  }

  static HttpStatus statusFor(ProvisioningError error) {
    return switch (error) {
      case SETUP_TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
      case NO_CAPACITY -> HttpStatus.SERVICE_UNAVAILABLE;
      case INVALID_CONFIG_PATH -> HttpStatus.UNPROCESSABLE_ENTITY;
      default -> HttpStatus.BAD_GATEWAY;
    };
  }

  private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String reason, String message) {
    return ResponseEntity.status(status).body(body(status, reason, message));
  }

  private static Map<String, Object> body(HttpStatus status, String reason, String message) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "error");
    body.put("code", status.value());
    body.put("reason", reason);
    body.put("message", message == null ? "" : message);
    body.put("ts", Instant.now().toString());
    return body;
  }
}
