package org.cim.location.exception;

import org.cim.location.domain.LocationId;
import org.springframework.http.HttpStatus;

/**
 * Thrown when a parent assignment passed validation but a concurrent edit closed a loop
 * before it was appended. The assignment has already been reverted by a compensating event
 * when this is raised.
 * Error code: cycle_detected_post_commit
 * HTTP status: 409 Conflict
 */
public class CycleDetectedPostCommitException extends LocationException {

  private static final long serialVersionUID = 1L;

  private final LocationId locationId;
  private final long compensatedVersion;

  /**
   * Constructs a CycleDetectedPostCommitException.
   *
   * @param locationId the child whose parent assignment was reverted
   * @param compensatedVersion the version after the compensating event
   */
  public CycleDetectedPostCommitException(LocationId locationId, long compensatedVersion) {
    super("Parent assignment for location " + locationId
            + " produced a cycle after commit and was reverted at version " + compensatedVersion,
        "cycle_detected_post_commit", HttpStatus.CONFLICT);
    this.locationId = locationId;
    this.compensatedVersion = compensatedVersion;
  }

  public LocationId getLocationId() {
    return locationId;
  }

  public long getCompensatedVersion() {
    return compensatedVersion;
  }
}
