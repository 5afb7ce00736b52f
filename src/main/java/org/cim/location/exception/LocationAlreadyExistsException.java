package org.cim.location.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when defining a location whose id is already taken.
 * Error code: location_already_exists
 * HTTP status: 409 Conflict
 */
public class LocationAlreadyExistsException extends LocationException {

  private static final long serialVersionUID = 1L;

  /**
   * Constructs a new LocationAlreadyExistsException with the specified message.
   *
   * @param message the detail message
   */
  public LocationAlreadyExistsException(String message) {
    super(message, "location_already_exists", HttpStatus.CONFLICT);
  }
}
