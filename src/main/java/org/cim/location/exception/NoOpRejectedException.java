package org.cim.location.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when a change would leave the location exactly as it is.
 * Error code: no_op_rejected
 * HTTP status: 422 Unprocessable Entity
 */
public class NoOpRejectedException extends LocationException {

  private static final long serialVersionUID = 1L;

  /**
   * Constructs a new NoOpRejectedException with the specified message.
   *
   * @param message the detail message
   */
  public NoOpRejectedException(String message) {
    super(message, "no_op_rejected", HttpStatus.UNPROCESSABLE_ENTITY);
  }
}
