package org.cim.location.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;
import org.cim.location.event.LocationEvent;
import org.cim.location.service.HistoryEntry;

/**
 * Response DTO for the event history of a location.
 */
@Schema(description = "Event history of a location, oldest first")
public record HistoryResponse(
    @Schema(description = "Location id") String locationId,
    @Schema(description = "Events with the version each produced") List<Entry> events
) {
  /**
   * Compact constructor with defensive copying.
   *
   * @param locationId the location id
   * @param events the events
   */
  public HistoryResponse {
    events = events != null ? List.copyOf(events) : List.of();
  }

  /**
   * Creates a response from history entries.
   *
   * @param locationId the location id
   * @param entries the entries
   * @return the response
   */
  public static HistoryResponse from(String locationId, List<HistoryEntry> entries) {
    return new HistoryResponse(locationId, entries.stream()
        .map(entry -> new Entry(entry.version(), entry.schemaVersion(), entry.event()))
        .toList());
  }

  /**
   * One event of the history.
   *
   * @param version the version the event produced
   * @param schemaVersion the schema version it was stored with
   * @param event the event, including its eventType
   */
  public record Entry(long version, int schemaVersion, LocationEvent event) {
  }
}
