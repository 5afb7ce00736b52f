package org.cim.location.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.f4b6a3.uuid.UuidCreator;
import java.time.Instant;
import java.util.Objects;
import org.cim.location.domain.Address;
import org.cim.location.domain.GeoCoordinates;
import org.cim.location.domain.LocationId;
import org.cim.location.domain.LocationPatch;
import org.cim.location.domain.VirtualLocation;

/**
 * Event representing a partial update of a location's descriptive fields.
 * Only non-null fields change.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LocationUpdatedEvent(
    @JsonProperty("eventId") String eventId,
    @JsonProperty("locationId") LocationId locationId,
    @JsonProperty("name") String name,
    @JsonProperty("address") Address address,
    @JsonProperty("coordinates") GeoCoordinates coordinates,
    @JsonProperty("virtualLocation") VirtualLocation virtualLocation,
    @JsonProperty("reason") String reason,
    @JsonProperty("occurredAt") Instant occurredAt)
    implements LocationEvent {

  public static final String TYPE = "LocationUpdated";

  /**
   * Creates a new LocationUpdatedEvent with validation.
   * If eventId is null, a UUIDv7 will be auto-generated.
   *
   * @throws IllegalArgumentException if a name is given but blank
   */
  public LocationUpdatedEvent {
    eventId = (eventId == null) ? UuidCreator.getTimeOrderedEpoch().toString() : eventId;

    Objects.requireNonNull(locationId, "Location id cannot be null");
    Objects.requireNonNull(occurredAt, "Timestamp cannot be null");

    if (name != null && name.isBlank()) {
      throw new IllegalArgumentException("Name cannot be blank");
    }
  }

  /**
   * Creates the event from a patch, auto-generating the eventId.
   *
   * @param locationId the location being updated
   * @param patch the fields to change
   * @param reason optional human-readable reason
   * @param occurredAt the event timestamp
   */
  public LocationUpdatedEvent(LocationId locationId, LocationPatch patch, String reason,
      Instant occurredAt) {
    this(null, locationId, patch.name(), patch.address(), patch.coordinates(),
        patch.virtualLocation(), reason, occurredAt);
  }

  /**
   * Returns the fields carried by this event as a patch.
   *
   * @return the patch
   */
  public LocationPatch patch() {
    return new LocationPatch(name, address, coordinates, virtualLocation);
  }

  @Override
  public String typeName() {
    return TYPE;
  }

  @Override
  public String subjectSuffix() {
    return "updated";
  }
}
