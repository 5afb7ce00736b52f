package org.cim.location.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when archiving a location that is already archived.
 * Error code: already_archived
 * HTTP status: 409 Conflict
 */
public class AlreadyArchivedException extends LocationException {

  private static final long serialVersionUID = 1L;

  /**
   * Constructs a new AlreadyArchivedException with the specified message.
   *
   * @param message the detail message
   */
  public AlreadyArchivedException(String message) {
    super(message, "already_archived", HttpStatus.CONFLICT);
  }
}
