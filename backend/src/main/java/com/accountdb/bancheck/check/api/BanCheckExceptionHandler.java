package com.accountdb.bancheck.check.api;

import com.accountdb.bancheck.check.service.BanCheckValidationException;
import com.accountdb.bancheck.check.service.PollingRateLimitException;
import com.accountdb.bancheck.check.service.TaskNotFoundException;
import com.fasterxml.jackson.databind.JsonMappingException;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class BanCheckExceptionHandler {

  @ExceptionHandler(BanCheckValidationException.class)
  public ResponseEntity<Map<String, String>> handleValidation(BanCheckValidationException ex) {
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(Map.of("error", "validation_failed", "message", ex.getMessage()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, String>> handleUnreadableBody(HttpMessageNotReadableException ex) {
    String message = "Malformed request body";
    if (ex.getCause() instanceof JsonMappingException) {
      JsonMappingException mapping = (JsonMappingException) ex.getCause();
      String field = mapping.getPath().stream()
          .map(reference -> reference.getFieldName() == null
              ? "[" + reference.getIndex() + "]"
              : reference.getFieldName())
          .collect(Collectors.joining("."));
      if (!field.isEmpty()) {
        message = "Invalid value for " + field;
      }
    }
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(Map.of("error", "validation_failed", "message", message));
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<Map<String, String>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(Map.of(
            "error", "validation_failed",
            "message", "Invalid value for " + ex.getName() + ": " + ex.getValue()));
  }

  @ExceptionHandler(TaskNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(TaskNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "task_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(PollingRateLimitException.class)
  public ResponseEntity<Map<String, String>> handlePollingRateLimit(PollingRateLimitException ex) {
    return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
        .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
        .body(Map.of("error", "too_many_requests", "message", ex.getMessage()));
  }
}
