package org.cim.location.exception;

import org.cim.location.domain.LocationId;
import org.springframework.http.HttpStatus;

/**
 * Thrown when a conditional append finds a head version other than the expected one.
 * Error code: version_conflict
 * HTTP status: 409 Conflict
 */
public class VersionConflictException extends LocationException {

  private static final long serialVersionUID = 1L;

  private final long expectedVersion;
  private final long actualVersion;

  /**
   * Constructs a VersionConflictException.
   *
   * @param locationId the aggregate being written
   * @param expectedVersion the version the writer loaded
   * @param actualVersion the version currently at the head of the log
   */
  public VersionConflictException(LocationId locationId, long expectedVersion,
      long actualVersion) {
    super(String.format("Version conflict on location %s: expected %d but head is %d",
            locationId, expectedVersion, actualVersion),
        "version_conflict", HttpStatus.CONFLICT);
    this.expectedVersion = expectedVersion;
    this.actualVersion = actualVersion;
  }

  public long getExpectedVersion() {
    return expectedVersion;
  }

  public long getActualVersion() {
    return actualVersion;
  }
}
