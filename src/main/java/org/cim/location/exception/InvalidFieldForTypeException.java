package org.cim.location.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when a field is missing or not permitted for the location type.
 * Error code: invalid_field_for_type
 * HTTP status: 400 Bad Request
 */
public class InvalidFieldForTypeException extends LocationException {

  private static final long serialVersionUID = 1L;

  /**
   * Constructs a new InvalidFieldForTypeException with the specified message.
   *
   * @param message the detail message
   */
  public InvalidFieldForTypeException(String message) {
    super(message, "invalid_field_for_type", HttpStatus.BAD_REQUEST);
  }
}
