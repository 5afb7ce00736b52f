package org.cim.location.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.f4b6a3.uuid.UuidCreator;
import java.time.Instant;
import java.util.Objects;
import org.cim.location.domain.Address;
import org.cim.location.domain.GeoCoordinates;
import org.cim.location.domain.LocationId;
import org.cim.location.domain.LocationType;
import org.cim.location.domain.VirtualLocation;

/**
 * Event representing the creation of a location. Always the first event of an aggregate.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LocationDefinedEvent(
    @JsonProperty("eventId") String eventId,
    @JsonProperty("locationId") LocationId locationId,
    @JsonProperty("name") String name,
    @JsonProperty("locationType") LocationType locationType,
    @JsonProperty("address") Address address,
    @JsonProperty("coordinates") GeoCoordinates coordinates,
    @JsonProperty("virtualLocation") VirtualLocation virtualLocation,
    @JsonProperty("occurredAt") Instant occurredAt)
    implements LocationEvent {

  public static final String TYPE = "LocationDefined";

  /**
   * Creates a new LocationDefinedEvent with validation.
   * If eventId is null, a UUIDv7 will be auto-generated.
   *
   * @param eventId the globally unique event ID (null to auto-generate)
   * @param locationId the new location's id (must be non-null)
   * @param name the location name (must be non-null and non-blank)
   * @param locationType the location type (must be non-null)
   * @param address optional address
   * @param coordinates optional coordinates
   * @param virtualLocation optional virtual location
   * @param occurredAt the event timestamp (must be non-null)
   * @throws IllegalArgumentException if any validation fails
   */
  public LocationDefinedEvent {
    eventId = (eventId == null) ? UuidCreator.getTimeOrderedEpoch().toString() : eventId;

    Objects.requireNonNull(locationId, "Location id cannot be null");
    Objects.requireNonNull(name, "Name cannot be null");
    Objects.requireNonNull(locationType, "Location type cannot be null");
    Objects.requireNonNull(occurredAt, "Timestamp cannot be null");

    if (name.isBlank()) {
      throw new IllegalArgumentException("Name cannot be blank");
    }
  }

  /**
   * Convenience constructor that auto-generates eventId.
   *
   * @param locationId the new location's id
   * @param name the location name
   * @param locationType the location type
   * @param address optional address
   * @param coordinates optional coordinates
   * @param virtualLocation optional virtual location
   * @param occurredAt the event timestamp
   */
  public LocationDefinedEvent(
      LocationId locationId,
      String name,
      LocationType locationType,
      Address address,
      GeoCoordinates coordinates,
      VirtualLocation virtualLocation,
      Instant occurredAt) {
    this(null, locationId, name, locationType, address, coordinates, virtualLocation, occurredAt);
  }

  @Override
  public String typeName() {
    return TYPE;
  }

  @Override
  public String subjectSuffix() {
    return "defined";
  }
}
