package org.cim.location.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import org.cim.location.domain.Address;
import org.cim.location.domain.GeoCoordinates;
import org.cim.location.domain.LocationPatch;
import org.cim.location.domain.VirtualLocation;

/**
 * Request DTO for changing the descriptive fields of a location.
 * Absent fields are left unchanged.
 */
@Schema(description = "Partial update of a location")
public record UpdateLocationRequest(
    @Schema(description = "New name", example = "Main Office")
    String name,
    @Schema(description = "New address")
    Address address,
    @Schema(description = "New coordinates")
    GeoCoordinates coordinates,
    @Schema(description = "New virtual location")
    VirtualLocation virtualLocation,
    @Schema(description = "Optional reason", example = "Office moved")
    String reason
) {
  public LocationPatch toPatch() {
    return new LocationPatch(name, address, coordinates, virtualLocation);
  }
}
