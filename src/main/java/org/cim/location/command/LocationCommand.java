package org.cim.location.command;

import org.cim.location.domain.LocationId;

/**
 * A command addressed to a single location.
 */
public interface LocationCommand extends Command {
  /**
   * Gets the id of the location this command applies to.
   *
   * @return the location id
   */
  LocationId locationId();

  /**
   * Gets the version the caller expects the location to be at.
   * When present, a mismatch fails with a version conflict instead of being retried.
   *
   * @return the expected version, or null to accept the current one
   */
  Long expectedVersion();
}
