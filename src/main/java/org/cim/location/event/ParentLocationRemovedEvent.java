package org.cim.location.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.f4b6a3.uuid.UuidCreator;
import java.time.Instant;
import java.util.Objects;
import org.cim.location.domain.LocationId;

/**
 * Event representing the removal of a location's parent.
 * Also appended as the compensating event when a parent assignment is reverted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParentLocationRemovedEvent(
    @JsonProperty("eventId") String eventId,
    @JsonProperty("locationId") LocationId locationId,
    @JsonProperty("previousParentId") LocationId previousParentId,
    @JsonProperty("reason") String reason,
    @JsonProperty("occurredAt") Instant occurredAt)
    implements LocationEvent {

  public static final String TYPE = "ParentLocationRemoved";

  /**
   * Creates a new ParentLocationRemovedEvent with validation.
   * If eventId is null, a UUIDv7 will be auto-generated.
   */
  public ParentLocationRemovedEvent {
    eventId = (eventId == null) ? UuidCreator.getTimeOrderedEpoch().toString() : eventId;

    Objects.requireNonNull(locationId, "Location id cannot be null");
    Objects.requireNonNull(occurredAt, "Timestamp cannot be null");
  }

  /**
   * Convenience constructor that auto-generates eventId.
   *
   * @param locationId the child location
   * @param previousParentId the parent being removed
   * @param reason optional reason
   * @param occurredAt the event timestamp
   */
  public ParentLocationRemovedEvent(LocationId locationId, LocationId previousParentId,
      String reason, Instant occurredAt) {
    this(null, locationId, previousParentId, reason, occurredAt);
  }

  @Override
  public String typeName() {
    return TYPE;
  }

  @Override
  public String subjectSuffix() {
    return "parent.removed";
  }
}
