package com.flamingo.ai.persona.exception;

/**
 * Exception thrown when the text-generation collaborator fails.
 *
 * <p>{@link #isRetryable()} separates transient failures (rate limits, timeouts, server errors, an
 * open circuit) from permanent ones (bad credentials, rejected requests). The engine never retries
 * on its own; the context for a turn can be rebuilt from the same inputs, so callers may.
 */
public class GenerationException extends RuntimeException {

  private final boolean retryable;
  private final String userMessage;

  public GenerationException(String message, Throwable cause, boolean retryable) {
    super(message, cause);
    this.retryable = retryable;
    this.userMessage =
        retryable
            ? "The character is temporarily unavailable. Please try again in a moment."
            : "The character could not reply to this message.";
  }

  public GenerationException(String message, boolean retryable) {
    this(message, null, retryable);
  }

  public boolean isRetryable() {
    return retryable;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
