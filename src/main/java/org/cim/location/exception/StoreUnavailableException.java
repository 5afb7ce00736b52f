package org.cim.location.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when the event log or snapshot store cannot be reached.
 * The repository retries it with backoff before letting it escape.
 * Error code: store_unavailable
 * HTTP status: 503 Service Unavailable
 */
public class StoreUnavailableException extends LocationException {

  private static final long serialVersionUID = 1L;

  /**
   * Constructs a StoreUnavailableException with the specified message.
   *
   * @param message the detail message
   */
  public StoreUnavailableException(String message) {
    super(message, "store_unavailable", HttpStatus.SERVICE_UNAVAILABLE);
  }

  /**
   * Constructs a StoreUnavailableException with the specified message and cause.
   *
   * @param message the detail message
   * @param cause the underlying store failure
   */
  public StoreUnavailableException(String message, Throwable cause) {
    super(message, "store_unavailable", HttpStatus.SERVICE_UNAVAILABLE, cause);
  }
}
