package org.cim.location.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.cim.location.domain.Address;
import org.cim.location.domain.GeoCoordinates;
import org.cim.location.domain.LocationType;
import org.cim.location.domain.VirtualLocation;

/**
 * Request DTO for defining a location.
 */
@Schema(description = "Request to define a new location")
public record DefineLocationRequest(
    @Schema(description = "Optional id (UUID); generated when absent",
        example = "01933e4a-9d4e-7000-8000-000000000001")
    @JsonProperty(required = false)
    String id,

    @Schema(description = "Display name", example = "Headquarters")
    @NotBlank(message = "Name is required")
    String name,

    @Schema(description = "Location type", example = "PHYSICAL")
    @NotNull(message = "Location type is required")
    LocationType locationType,

    @Schema(description = "Postal address (physical and hybrid only)")
    @JsonProperty(required = false)
    Address address,

    @Schema(description = "Geographic coordinates (not for virtual)")
    @JsonProperty(required = false)
    GeoCoordinates coordinates,

    @Schema(description = "Online presence (virtual and hybrid only)")
    @JsonProperty(required = false)
    VirtualLocation virtualLocation
) {
}
