package org.cim.location.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Iterator;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Upgrades stored event payloads written with an older schema version to the layout the
 * current event records expect, one version step at a time.
 *
 * <p>Known steps:
 * <ul>
 *   <li>{@code LocationUpdated} v1 to v2: field {@code newName} renamed to {@code name}</li>
 *   <li>{@code LocationMetadataAdded} v1 to v2: single-entry map {@code addedMetadata}
 *       replaced by {@code key} and {@code value}</li>
 * </ul>
 */
@Component
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public class EventUpcaster {

  private static final Logger logger = LoggerFactory.getLogger(EventUpcaster.class);

  private static final Map<String, Integer> CURRENT_VERSIONS = Map.of(
      LocationDefinedEvent.TYPE, 1,
      LocationUpdatedEvent.TYPE, 2,
      ParentLocationSetEvent.TYPE, 1,
      ParentLocationRemovedEvent.TYPE, 1,
      LocationMetadataAddedEvent.TYPE, 2,
      LocationArchivedEvent.TYPE, 1);

  /**
   * Returns the schema version new events of a type are written with.
   *
   * @param eventType the event type tag
   * @return the current schema version
   * @throws IllegalArgumentException if the type is unknown
   */
  public int currentVersion(String eventType) {
    Integer version = CURRENT_VERSIONS.get(eventType);
    if (version == null) {
      throw new IllegalArgumentException("Unknown event type: " + eventType);
    }
    return version;
  }

  /**
   * Brings a payload up to the current schema version of its type.
   *
   * @param eventType the event type tag
   * @param schemaVersion the version the payload was written with
   * @param payload the stored payload (not modified)
   * @return an upgraded copy of the payload
   * @throws IllegalStateException if the payload is newer than supported or cannot be upgraded
   */
  public ObjectNode upcast(String eventType, int schemaVersion, JsonNode payload) {
    int current = currentVersion(eventType);
    if (schemaVersion > current) {
      throw new IllegalStateException("Event " + eventType + " has schema version "
          + schemaVersion + ", newest supported is " + current);
    }
    if (!payload.isObject()) {
      throw new IllegalStateException("Event " + eventType + " payload is not a JSON object");
    }

    ObjectNode node = ((ObjectNode) payload).deepCopy();
    for (int version = schemaVersion; version < current; version++) {
      logger.debug("Upcasting {} payload from v{} to v{}", eventType, version, version + 1);
      upcastStep(eventType, version, node);
    }
    return node;
  }

  private void upcastStep(String eventType, int fromVersion, ObjectNode node) {
    if (LocationUpdatedEvent.TYPE.equals(eventType) && fromVersion == 1) {
      JsonNode newName = node.remove("newName");
      if (newName != null && !newName.isNull()) {
        node.set("name", newName);
      }
      return;
    }
    if (LocationMetadataAddedEvent.TYPE.equals(eventType) && fromVersion == 1) {
      JsonNode added = node.remove("addedMetadata");
      if (added == null || !added.isObject() || added.size() != 1) {
        throw new IllegalStateException(
            "LocationMetadataAdded v1 payload must carry exactly one addedMetadata entry");
      }
      Iterator<Map.Entry<String, JsonNode>> fields = added.fields();
      Map.Entry<String, JsonNode> entry = fields.next();
      node.put("key", entry.getKey());
      node.set("value", entry.getValue());
      return;
    }
    throw new IllegalStateException("No upcaster for " + eventType + " v" + fromVersion);
  }
}
