package org.cim.location.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import org.cim.location.domain.Address;
import org.cim.location.domain.GeoCoordinates;
import org.cim.location.domain.Location;
import org.cim.location.domain.LocationType;
import org.cim.location.domain.VirtualLocation;

/**
 * Response DTO for a location's state.
 */
@Schema(description = "State of a location at a version")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LocationResponse(
    @Schema(description = "Location id") String id,
    @Schema(description = "Version (number of events applied)", example = "3") long version,
    @Schema(description = "Display name") String name,
    @Schema(description = "Location type") LocationType locationType,
    @Schema(description = "Postal address") Address address,
    @Schema(description = "Geographic coordinates") GeoCoordinates coordinates,
    @Schema(description = "Online presence") VirtualLocation virtualLocation,
    @Schema(description = "Parent location id") String parentId,
    @Schema(description = "Metadata, sorted by key") Map<String, String> metadata,
    @Schema(description = "Whether the location is archived") boolean archived,
    @Schema(description = "Time of definition") Instant createdAt,
    @Schema(description = "Time of the latest event") Instant updatedAt
) {
  /**
   * Compact constructor with defensive copying.
   */
  public LocationResponse {
    metadata = metadata != null ? new TreeMap<>(metadata) : new TreeMap<>();
  }

  /**
   * Creates a response from a location state.
   *
   * @param location the state
   * @return the response
   */
  public static LocationResponse from(Location location) {
    return new LocationResponse(
        location.id().toString(),
        location.version(),
        location.name(),
        location.locationType(),
        location.address().orElse(null),
        location.coordinates().orElse(null),
        location.virtualLocation().orElse(null),
        location.parent().map(Object::toString).orElse(null),
        location.metadata(),
        location.archived(),
        location.createdAt(),
        location.updatedAt());
  }

  @Override
  public Map<String, String> metadata() {
    return new TreeMap<>(metadata);
  }
}
