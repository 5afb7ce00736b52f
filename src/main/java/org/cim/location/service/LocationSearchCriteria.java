package org.cim.location.service;

import java.util.Locale;
import java.util.Map;
import org.cim.location.domain.Location;
import org.cim.location.domain.LocationId;
import org.cim.location.domain.LocationType;

/**
 * Filters for {@link LocationQueryService#findLocations(LocationSearchCriteria)}.
 * Every filter is optional; a location must satisfy all of the given ones.
 *
 * @param namePattern case-insensitive substring of the name, or null
 * @param locationType required type, or null
 * @param parentId required direct parent, or null
 * @param metadata entries that must be present with exactly these values
 * @param includeArchived whether archived locations are returned
 * @param offset number of matches to skip
 * @param limit maximum number of matches to return
 */
public record LocationSearchCriteria(
    String namePattern,
    LocationType locationType,
    LocationId parentId,
    Map<String, String> metadata,
    boolean includeArchived,
    int offset,
    int limit) {

  /**
   * Creates search criteria with validation.
   *
   * @throws IllegalArgumentException if offset is negative or limit is not positive
   */
  public LocationSearchCriteria {
    if (offset < 0) {
      throw new IllegalArgumentException("Offset cannot be negative");
    }
    if (limit < 1) {
      throw new IllegalArgumentException("Limit must be at least 1");
    }
    namePattern = namePattern == null || namePattern.isBlank()
        ? null
        : namePattern.toLowerCase(Locale.ROOT);
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  /**
   * Criteria matching every active location.
   *
   * @param offset number of matches to skip
   * @param limit maximum number of matches
   * @return the criteria
   */
  public static LocationSearchCriteria all(int offset, int limit) {
    return new LocationSearchCriteria(null, null, null, Map.of(), false, offset, limit);
  }

  boolean matches(Location location) {
    if (!includeArchived && location.archived()) {
      return false;
    }
    if (namePattern != null
        && !location.name().toLowerCase(Locale.ROOT).contains(namePattern)) {
      return false;
    }
    if (locationType != null && location.locationType() != locationType) {
      return false;
    }
    if (parentId != null && !parentId.equals(location.parentId())) {
      return false;
    }
    return metadata.entrySet().stream()
        .allMatch(entry -> entry.getValue().equals(location.metadata().get(entry.getKey())));
  }
}
