package org.cim.location.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.time.Instant;
import org.cim.location.domain.LocationId;

/**
 * Base interface for all Location events.
 * Events are immutable and are the only source of truth for a location's state.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.PROPERTY,
    property = "eventType")
@JsonSubTypes({
    @JsonSubTypes.Type(value = LocationDefinedEvent.class, name = LocationDefinedEvent.TYPE),
    @JsonSubTypes.Type(value = LocationUpdatedEvent.class, name = LocationUpdatedEvent.TYPE),
    @JsonSubTypes.Type(value = ParentLocationSetEvent.class, name = ParentLocationSetEvent.TYPE),
    @JsonSubTypes.Type(value = ParentLocationRemovedEvent.class,
        name = ParentLocationRemovedEvent.TYPE),
    @JsonSubTypes.Type(value = LocationMetadataAddedEvent.class,
        name = LocationMetadataAddedEvent.TYPE),
    @JsonSubTypes.Type(value = LocationArchivedEvent.class, name = LocationArchivedEvent.TYPE)
})
public sealed interface LocationEvent
    permits LocationDefinedEvent,
        LocationUpdatedEvent,
        ParentLocationSetEvent,
        ParentLocationRemovedEvent,
        LocationMetadataAddedEvent,
        LocationArchivedEvent {

  /**
   * Returns the globally unique event ID (UUIDv7, generated at event creation time).
   *
   * @return the event ID
   */
  String eventId();

  /**
   * Returns the id of the location this event belongs to.
   * Also used as the Kafka record key so that a location's events stay in order.
   *
   * @return the location id
   */
  LocationId locationId();

  /**
   * Gets the timestamp when this event occurred.
   *
   * @return the event timestamp
   */
  Instant occurredAt();

  /**
   * Returns the type tag used in the persisted envelope and the eventType header.
   *
   * @return the event type name, e.g. {@code LocationDefined}
   */
  String typeName();

  /**
   * Returns the last part of the publication subject,
   * e.g. {@code parent.set} for {@code events.location.{id}.parent.set}.
   *
   * @return the subject suffix
   */
  String subjectSuffix();
}
