package org.cim.location.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO for attaching a location below a parent.
 */
@Schema(description = "Request to set the parent of a location")
public record SetParentRequest(
    @Schema(description = "Parent location id", example = "01933e4a-9d4e-7000-8000-000000000002")
    @NotBlank(message = "Parent id is required")
    String parentId,
    @Schema(description = "Optional reason", example = "Reorganization")
    String reason
) {
}
