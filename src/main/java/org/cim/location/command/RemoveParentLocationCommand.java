package org.cim.location.command;

import java.util.Objects;
import org.cim.location.domain.LocationId;

/**
 * Command to detach a location from its parent.
 *
 * @param locationId the child location
 * @param reason optional reason
 * @param expectedVersion optional expected version
 */
public record RemoveParentLocationCommand(
    LocationId locationId,
    String reason,
    Long expectedVersion) implements LocationCommand {

  /**
   * Creates a new RemoveParentLocationCommand with validation.
   */
  public RemoveParentLocationCommand {
    Objects.requireNonNull(locationId, "Location id cannot be null");
  }
}
