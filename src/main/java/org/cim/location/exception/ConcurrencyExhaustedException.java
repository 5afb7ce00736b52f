package org.cim.location.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when a command still loses the version race after its last retry.
 * Error code: concurrency_exhausted
 * HTTP status: 409 Conflict
 */
public class ConcurrencyExhaustedException extends LocationException {

  private static final long serialVersionUID = 1L;

  private final int attempts;

  /**
   * Constructs a ConcurrencyExhaustedException.
   *
   * @param message the detail message
   * @param attempts how many times the command was attempted
   * @param cause the last version conflict
   */
  public ConcurrencyExhaustedException(String message, int attempts, Throwable cause) {
    super(message, "concurrency_exhausted", HttpStatus.CONFLICT, cause);
    this.attempts = attempts;
  }

  public int getAttempts() {
    return attempts;
  }
}
