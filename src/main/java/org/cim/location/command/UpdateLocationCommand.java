package org.cim.location.command;

import java.util.Objects;
import org.cim.location.domain.LocationId;
import org.cim.location.domain.LocationPatch;

/**
 * Command to change the descriptive fields of a location.
 *
 * @param locationId the location id
 * @param patch the fields to change
 * @param reason optional reason
 * @param expectedVersion optional expected version
 */
public record UpdateLocationCommand(
    LocationId locationId,
    LocationPatch patch,
    String reason,
    Long expectedVersion) implements LocationCommand {

  /**
   * Creates a new UpdateLocationCommand with validation.
   */
  public UpdateLocationCommand {
    Objects.requireNonNull(locationId, "Location id cannot be null");
    Objects.requireNonNull(patch, "Patch cannot be null");
  }
}
