package org.cim.location.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.cim.location.store.StoredEvent;
import org.springframework.stereotype.Component;

/**
 * Converts between {@link LocationEvent} records and the {@link StoredEvent} envelope
 * kept in the event log.
 */
@Component
public class LocationEventCodec {

  private static final String TYPE_PROPERTY = "eventType";

  private final ObjectMapper objectMapper;
  private final EventUpcaster upcaster;

  /**
   * Constructs a LocationEventCodec.
   *
   * @param objectMapper the JSON mapper
   * @param upcaster the payload upcaster
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper and EventUpcaster are shared, thread-safe Spring beans")
  public LocationEventCodec(ObjectMapper objectMapper, EventUpcaster upcaster) {
    this.objectMapper = objectMapper;
    this.upcaster = upcaster;
  }

  /**
   * Wraps an event in a storage envelope at the given version.
   *
   * @param event the event
   * @param version the log position it will occupy
   * @return the envelope
   */
  public StoredEvent encode(LocationEvent event, long version) {
    ObjectNode payload = objectMapper.valueToTree(event);
    payload.remove(TYPE_PROPERTY);
    return new StoredEvent(
        event.typeName(),
        event.locationId(),
        version,
        event.occurredAt(),
        upcaster.currentVersion(event.typeName()),
        payload);
  }

  /**
   * Restores an event from its envelope, upcasting older payloads first.
   *
   * @param stored the envelope
   * @return the event
   * @throws IllegalStateException if the payload cannot be read
   */
  public LocationEvent decode(StoredEvent stored) {
    ObjectNode payload = upcaster.upcast(stored.type(), stored.schemaVersion(), stored.payload());
    payload.put(TYPE_PROPERTY, stored.type());
    try {
      return objectMapper.treeToValue(payload, LocationEvent.class);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new IllegalStateException("Cannot decode " + stored.type() + " at version "
          + stored.version() + " of location " + stored.aggregateId(), e);
    }
  }
}
