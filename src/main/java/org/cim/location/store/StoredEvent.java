package org.cim.location.store;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.Objects;
import org.cim.location.domain.LocationId;

/**
 * Persisted envelope of one event in a location's log.
 *
 * @param type event type tag, e.g. {@code LocationDefined}
 * @param aggregateId the location the event belongs to
 * @param version position of the event in the log, starting at 1
 * @param occurredAt event timestamp
 * @param schemaVersion version of the payload layout for this event type
 * @param payload the event body as JSON
 */
public record StoredEvent(
    String type,
    LocationId aggregateId,
    long version,
    Instant occurredAt,
    int schemaVersion,
    JsonNode payload) {

  /**
   * Creates a new StoredEvent with validation.
   *
   * @throws IllegalArgumentException if the type is blank or a version is not positive
   */
  public StoredEvent {
    Objects.requireNonNull(type, "Event type cannot be null");
    Objects.requireNonNull(aggregateId, "Aggregate id cannot be null");
    Objects.requireNonNull(occurredAt, "Timestamp cannot be null");
    Objects.requireNonNull(payload, "Payload cannot be null");
    if (type.isBlank()) {
      throw new IllegalArgumentException("Event type cannot be blank");
    }
    if (version < 1) {
      throw new IllegalArgumentException("Version must be >= 1");
    }
    if (schemaVersion < 1) {
      throw new IllegalArgumentException("Schema version must be >= 1");
    }
    payload = payload.deepCopy();
  }

  /**
   * Returns a copy of the payload; the stored tree is never handed out.
   *
   * @return the payload
   */
  @Override
  public JsonNode payload() {
    return payload.deepCopy();
  }
}
