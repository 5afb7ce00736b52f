package org.cim.location.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when an event is applied to a state it cannot follow.
 * Error code: out_of_sequence
 * HTTP status: 409 Conflict
 */
public class OutOfSequenceException extends LocationException {

  private static final long serialVersionUID = 1L;

  /**
   * Constructs a new OutOfSequenceException with the specified message.
   *
   * @param message the detail message
   */
  public OutOfSequenceException(String message) {
    super(message, "out_of_sequence", HttpStatus.CONFLICT);
  }
}
