package org.cim.location.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.f4b6a3.uuid.UuidCreator;
import java.time.Instant;
import java.util.Objects;
import org.cim.location.domain.LocationId;

/**
 * Event representing the archival of a location. Nothing may follow it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LocationArchivedEvent(
    @JsonProperty("eventId") String eventId,
    @JsonProperty("locationId") LocationId locationId,
    @JsonProperty("reason") String reason,
    @JsonProperty("occurredAt") Instant occurredAt)
    implements LocationEvent {

  public static final String TYPE = "LocationArchived";

  /**
   * Creates a new LocationArchivedEvent with validation.
   * If eventId is null, a UUIDv7 will be auto-generated.
   */
  public LocationArchivedEvent {
    eventId = (eventId == null) ? UuidCreator.getTimeOrderedEpoch().toString() : eventId;

    Objects.requireNonNull(locationId, "Location id cannot be null");
    Objects.requireNonNull(occurredAt, "Timestamp cannot be null");
  }

  /**
   * Convenience constructor that auto-generates eventId.
   *
   * @param locationId the location
   * @param reason optional reason
   * @param occurredAt the event timestamp
   */
  public LocationArchivedEvent(LocationId locationId, String reason, Instant occurredAt) {
    this(null, locationId, reason, occurredAt);
  }

  @Override
  public String typeName() {
    return TYPE;
  }

  @Override
  public String subjectSuffix() {
    return "archived";
  }
}
