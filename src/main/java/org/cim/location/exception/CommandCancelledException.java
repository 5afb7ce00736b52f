package org.cim.location.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when a command is cancelled before its event is appended.
 * Error code: command_cancelled
 * HTTP status: 409 Conflict
 */
public class CommandCancelledException extends LocationException {

  private static final long serialVersionUID = 1L;

  /**
   * Constructs a new CommandCancelledException with the specified message.
   *
   * @param message the detail message
   */
  public CommandCancelledException(String message) {
    super(message, "command_cancelled", HttpStatus.CONFLICT);
  }
}
