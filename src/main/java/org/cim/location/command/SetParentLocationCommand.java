package org.cim.location.command;

import java.util.Objects;
import org.cim.location.domain.LocationId;

/**
 * Command to attach a location below a parent.
 *
 * @param locationId the child location
 * @param parentId the new parent
 * @param reason optional reason
 * @param expectedVersion optional expected version of the child
 */
public record SetParentLocationCommand(
    LocationId locationId,
    LocationId parentId,
    String reason,
    Long expectedVersion) implements LocationCommand {

  /**
   * Creates a new SetParentLocationCommand with validation.
   */
  public SetParentLocationCommand {
    Objects.requireNonNull(locationId, "Location id cannot be null");
    Objects.requireNonNull(parentId, "Parent id cannot be null");
  }
}
