package org.cim.location.command;

import java.util.Objects;
import org.cim.location.domain.LocationId;

/**
 * Command to archive a location. Archiving is terminal.
 *
 * @param locationId the location id
 * @param reason optional reason
 * @param expectedVersion optional expected version
 */
public record ArchiveLocationCommand(
    LocationId locationId,
    String reason,
    Long expectedVersion) implements LocationCommand {

  /**
   * Creates a new ArchiveLocationCommand with validation.
   */
  public ArchiveLocationCommand {
    Objects.requireNonNull(locationId, "Location id cannot be null");
  }
}
