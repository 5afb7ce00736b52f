package org.cim.location.service;

import java.util.Objects;
import org.cim.location.event.LocationEvent;

/**
 * One event of a location's history together with the version it produced.
 *
 * @param version the version the event was appended at
 * @param schemaVersion the schema version the event was stored with
 * @param event the event, upcast to the current schema
 */
public record HistoryEntry(long version, int schemaVersion, LocationEvent event) {

  /**
   * Creates a new HistoryEntry.
   */
  public HistoryEntry {
    Objects.requireNonNull(event, "Event cannot be null");
  }
}
