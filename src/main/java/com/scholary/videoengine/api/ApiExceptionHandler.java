package com.scholary.videoengine.api;

import com.scholary.videoengine.pipeline.InvariantViolationException;
import com.scholary.videoengine.service.EntityNotFoundException;
import com.scholary.videoengine.webhook.MalformedWebhookException;
import java.time.Instant;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps domain exceptions to HTTP responses. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  public record ErrorResponse(int status, String error, String message, Instant timestamp) {}

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
    String message =
        e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    LOGGER.warn("Validation error: {}", message);
    return build(HttpStatus.BAD_REQUEST, message);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
    LOGGER.warn("Bad request: {}", e.getMessage());
    return build(HttpStatus.BAD_REQUEST, e.getMessage());
  }

  @ExceptionHandler(MalformedWebhookException.class)
  public ResponseEntity<ErrorResponse> handleMalformedWebhook(MalformedWebhookException e) {
    LOGGER.warn("Malformed {} callback: {}", e.getProvider(), e.getMessage());
    return build(HttpStatus.BAD_REQUEST, e.getMessage());
  }

  @ExceptionHandler(EntityNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleNotFound(EntityNotFoundException e) {
    return build(HttpStatus.NOT_FOUND, e.getMessage());
  }

  @ExceptionHandler(InvariantViolationException.class)
  public ResponseEntity<ErrorResponse> handleInvariantViolation(InvariantViolationException e) {
    LOGGER.error("Invariant violation: {}", e.getMessage());
    return build(HttpStatus.CONFLICT, e.getMessage());
  }

  private static ResponseEntity<ErrorResponse> build(HttpStatus status, String message) {
    return ResponseEntity.status(status)
        .body(new ErrorResponse(status.value(), status.getReasonPhrase(), message, Instant.now()));
  }
}
