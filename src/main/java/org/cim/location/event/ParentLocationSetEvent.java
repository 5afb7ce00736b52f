package org.cim.location.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.f4b6a3.uuid.UuidCreator;
import java.time.Instant;
import java.util.Objects;
import org.cim.location.domain.LocationId;

/**
 * Event representing the assignment of a parent location.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParentLocationSetEvent(
    @JsonProperty("eventId") String eventId,
    @JsonProperty("locationId") LocationId locationId,
    @JsonProperty("parentId") LocationId parentId,
    @JsonProperty("previousParentId") LocationId previousParentId,
    @JsonProperty("reason") String reason,
    @JsonProperty("occurredAt") Instant occurredAt)
    implements LocationEvent {

  public static final String TYPE = "ParentLocationSet";

  /**
   * Creates a new ParentLocationSetEvent with validation.
   * If eventId is null, a UUIDv7 will be auto-generated.
   *
   * @param eventId the globally unique event ID (null to auto-generate)
   * @param locationId the child location (must be non-null)
   * @param parentId the new parent (must be non-null)
   * @param previousParentId the parent being replaced, if any
   * @param reason optional human-readable reason
   * @param occurredAt the event timestamp (must be non-null)
   */
  public ParentLocationSetEvent {
    eventId = (eventId == null) ? UuidCreator.getTimeOrderedEpoch().toString() : eventId;

    Objects.requireNonNull(locationId, "Location id cannot be null");
    Objects.requireNonNull(parentId, "Parent id cannot be null");
    Objects.requireNonNull(occurredAt, "Timestamp cannot be null");
  }

  /**
   * Convenience constructor that auto-generates eventId.
   *
   * @param locationId the child location
   * @param parentId the new parent
   * @param previousParentId the parent being replaced, if any
   * @param reason optional reason
   * @param occurredAt the event timestamp
   */
  public ParentLocationSetEvent(LocationId locationId, LocationId parentId,
      LocationId previousParentId, String reason, Instant occurredAt) {
    this(null, locationId, parentId, previousParentId, reason, occurredAt);
  }

  @Override
  public String typeName() {
    return TYPE;
  }

  @Override
  public String subjectSuffix() {
    return "parent.set";
  }
}
