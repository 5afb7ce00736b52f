package org.cim.location.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import java.util.Map;
import java.util.TreeMap;
import org.cim.location.service.LocationStatistics;

/**
 * Response DTO for location counts.
 */
@Schema(description = "Counts over all locations")
public record LocationStatisticsResponse(
    @Schema(description = "All locations, archived ones included", example = "12")
    long total,
    @Schema(description = "Locations that are not archived", example = "10")
    long active,
    @Schema(description = "Archived locations", example = "2")
    long archived,
    @Schema(description = "Active locations per type")
    Map<String, Long> activeByType,
    @Schema(description = "Locations with coordinates", example = "7")
    long withCoordinates
) {

  public LocationStatisticsResponse {
    activeByType = activeByType != null ? Map.copyOf(activeByType) : Map.of();
  }

  /**
   * Converts statistics to the response shape.
   *
   * @param statistics the statistics
   * @return the response
   */
  public static LocationStatisticsResponse from(LocationStatistics statistics) {
    Map<String, Long> byType = new TreeMap<>();
    statistics.activeByType().forEach((type, count) -> byType.put(type.name(), count));
    return new LocationStatisticsResponse(statistics.total(), statistics.active(),
        statistics.archived(), byType, statistics.withCoordinates());
  }
}
