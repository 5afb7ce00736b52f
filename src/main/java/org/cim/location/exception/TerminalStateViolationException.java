package org.cim.location.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when a change is attempted on an archived location.
 * Error code: terminal_state_violation
 * HTTP status: 409 Conflict
 */
public class TerminalStateViolationException extends LocationException {

  private static final long serialVersionUID = 1L;

  /**
   * Constructs a new TerminalStateViolationException with the specified message.
   *
   * @param message the detail message
   */
  public TerminalStateViolationException(String message) {
    super(message, "terminal_state_violation", HttpStatus.CONFLICT);
  }
}
