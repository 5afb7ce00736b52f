package org.cim.location.service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import org.cim.location.domain.LocationType;

/**
 * Counts over all known locations.
 *
 * @param total every location, archived ones included
 * @param active locations that are not archived
 * @param archived archived locations
 * @param activeByType active locations per type; every type is present
 * @param withCoordinates locations that have coordinates, archived ones included
 */
public record LocationStatistics(
    long total,
    long active,
    long archived,
    Map<LocationType, Long> activeByType,
    long withCoordinates) {

  /**
   * Creates statistics, filling in zero for types without active locations.
   */
  public LocationStatistics {
    EnumMap<LocationType, Long> counts = new EnumMap<>(LocationType.class);
    for (LocationType type : LocationType.values()) {
      counts.put(type, 0L);
    }
    if (activeByType != null) {
      counts.putAll(activeByType);
    }
    activeByType = Collections.unmodifiableMap(counts);
  }
}
