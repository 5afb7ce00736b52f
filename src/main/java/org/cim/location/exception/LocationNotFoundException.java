package org.cim.location.exception;

import org.cim.location.domain.LocationId;
import org.springframework.http.HttpStatus;

/**
 * Thrown when no events exist for the requested location id.
 * Error code: location_not_found
 * HTTP status: 404 Not Found
 */
public class LocationNotFoundException extends LocationException {

  private static final long serialVersionUID = 1L;

  private final LocationId locationId;

  /**
   * Constructs a LocationNotFoundException.
   *
   * @param locationId the id that could not be resolved
   */
  public LocationNotFoundException(LocationId locationId) {
    super("Location not found: " + locationId, "location_not_found", HttpStatus.NOT_FOUND);
    this.locationId = locationId;
  }

  public LocationId getLocationId() {
    return locationId;
  }
}
