package com.flamingo.ai.persona.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(CharacterNotFoundException.class)
  public ResponseEntity<ApiError> handleCharacterNotFound(
      CharacterNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("character_not_found");
    String errorId = generateErrorId();
    log.warn("Character not found [{}]: {}", errorId, ex.getCharacterId());

    return error(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.CHARACTER_NOT_FOUND,
        "Character not found",
        false,
        request);
  }

  @ExceptionHandler(MemoryNotFoundException.class)
  public ResponseEntity<ApiError> handleMemoryNotFound(
      MemoryNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("memory_not_found");
    String errorId = generateErrorId();
    log.warn("Memory not found [{}]: {}", errorId, ex.getMemoryId());

    return error(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.MEMORY_NOT_FOUND,
        "Memory not found",
        false,
        request);
  }

  @ExceptionHandler(MemoryAccessDeniedException.class)
  public ResponseEntity<ApiError> handleMemoryAccessDenied(
      MemoryAccessDeniedException ex, HttpServletRequest request) {

    incrementErrorCounter("memory_access_denied");
    String errorId = generateErrorId();
    log.warn(
        "Memory access denied [{}]: memory={}, pair={}", errorId, ex.getMemoryId(), ex.getPair());

    return error(
        HttpStatus.FORBIDDEN,
        errorId,
        ApiError.MEMORY_ACCESS_DENIED,
        "Access to this memory is denied",
        false,
        request);
  }

  @ExceptionHandler(GenerationException.class)
  public ResponseEntity<ApiError> handleGeneration(
      GenerationException ex, HttpServletRequest request) {

    incrementErrorCounter(ex.isRetryable() ? "generation_unavailable" : "generation_failed");
    String errorId = generateErrorId();
    log.error("Generation error [{}]: {}", errorId, ex.getMessage(), ex);

    HttpStatus status = ex.isRetryable() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.BAD_GATEWAY;
    String code = ex.isRetryable() ? ApiError.GENERATION_UNAVAILABLE : ApiError.GENERATION_FAILED;
    return error(
        status,
        errorId,
        code,
        ex.getUserMessage(),
        ex.isRetryable(),
        request);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiError> handleIllegalArgument(
      IllegalArgumentException ex, HttpServletRequest request) {

    incrementErrorCounter("character_invalid");
    String errorId = generateErrorId();
    log.warn("Invalid request [{}]: {}", errorId, ex.getMessage());

    return error(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.CHARACTER_INVALID,
        ex.getMessage(),
        false,
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return error(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.VALIDATION_ERROR,
        message,
        false,
        request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return error(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        false,
        request);
  }

  private ResponseEntity<ApiError> error(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      boolean retryable,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .retryable(retryable)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
