package org.cim.location.command;

import java.util.Objects;
import org.cim.location.domain.LocationId;
import org.cim.location.event.LocationEvent;

/**
 * Outcome of a successfully handled location command.
 *
 * @param locationId the location that changed
 * @param version the version the event was appended at
 * @param event the appended event
 */
public record CommandResult(LocationId locationId, long version, LocationEvent event) {

  /**
   * Creates a new CommandResult.
   */
  public CommandResult {
    Objects.requireNonNull(locationId, "Location id cannot be null");
    Objects.requireNonNull(event, "Event cannot be null");
  }
}
