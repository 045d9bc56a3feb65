package com.flamingo.ai.persona.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String CHARACTER_NOT_FOUND = "CHARACTER_001";
  public static final String CHARACTER_INVALID = "CHARACTER_002";
  public static final String MEMORY_NOT_FOUND = "MEMORY_001";
  public static final String MEMORY_ACCESS_DENIED = "MEMORY_002";
  public static final String GENERATION_UNAVAILABLE = "GENERATION_001";
  public static final String GENERATION_FAILED = "GENERATION_002";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Whether repeating the same request may succeed. */
  private final boolean retryable;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
