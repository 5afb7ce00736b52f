package org.cim.location.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.f4b6a3.uuid.UuidCreator;
import java.time.Instant;
import java.util.Objects;
import org.cim.location.domain.LocationId;

/**
 * Event representing the insertion or overwrite of one metadata entry.
 */
public record LocationMetadataAddedEvent(
    @JsonProperty("eventId") String eventId,
    @JsonProperty("locationId") LocationId locationId,
    @JsonProperty("key") String key,
    @JsonProperty("value") String value,
    @JsonProperty("occurredAt") Instant occurredAt)
    implements LocationEvent {

  public static final String TYPE = "LocationMetadataAdded";

  /**
   * Creates a new LocationMetadataAddedEvent with validation.
   * If eventId is null, a UUIDv7 will be auto-generated.
   *
   * @throws IllegalArgumentException if the key is blank
   */
  public LocationMetadataAddedEvent {
    eventId = (eventId == null) ? UuidCreator.getTimeOrderedEpoch().toString() : eventId;

    Objects.requireNonNull(locationId, "Location id cannot be null");
    Objects.requireNonNull(key, "Metadata key cannot be null");
    Objects.requireNonNull(value, "Metadata value cannot be null");
    Objects.requireNonNull(occurredAt, "Timestamp cannot be null");

    if (key.isBlank()) {
      throw new IllegalArgumentException("Metadata key cannot be blank");
    }
  }

  /**
   * Convenience constructor that auto-generates eventId.
   *
   * @param locationId the location
   * @param key the metadata key
   * @param value the metadata value
   * @param occurredAt the event timestamp
   */
  public LocationMetadataAddedEvent(LocationId locationId, String key, String value,
      Instant occurredAt) {
    this(null, locationId, key, value, occurredAt);
  }

  @Override
  public String typeName() {
    return TYPE;
  }

  @Override
  public String subjectSuffix() {
    return "metadata.added";
  }
}
