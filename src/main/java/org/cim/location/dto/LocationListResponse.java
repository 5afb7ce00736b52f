package org.cim.location.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;
import org.cim.location.service.LocationPage;

/**
 * Response DTO for a location search.
 *
 * @param locations the locations on this page
 * @param pagination paging details
 */
@Schema(description = "Paginated list of locations")
public record LocationListResponse(
    @Schema(description = "Locations on the current page, ordered by name")
    List<LocationResponse> locations,
    @Schema(description = "Pagination metadata")
    PaginationInfo pagination
) {

  /**
   * Compact constructor with defensive copying.
   *
   * @param locations the locations
   * @param pagination paging details
   */
  public LocationListResponse {
    locations = locations != null ? List.copyOf(locations) : List.of();
  }

  /**
   * Converts a search result page.
   *
   * @param page the page
   * @return the response
   */
  public static LocationListResponse from(LocationPage page) {
    return new LocationListResponse(
        page.locations().stream().map(LocationResponse::from).toList(),
        new PaginationInfo(page.limit(), page.offset(), page.hasMore()));
  }
}
