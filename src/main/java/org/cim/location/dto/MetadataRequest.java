package org.cim.location.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for setting one metadata entry; the key is part of the path.
 */
@Schema(description = "Metadata value")
public record MetadataRequest(
    @Schema(description = "Value to store", example = "EU-West")
    @NotNull(message = "Metadata value is required")
    String value
) {
}
