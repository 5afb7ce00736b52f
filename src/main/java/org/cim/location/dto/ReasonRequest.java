package org.cim.location.dto;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Optional request body carrying only a reason, used by archive and parent removal.
 */
@Schema(description = "Optional reason for the change")
public record ReasonRequest(
    @Schema(description = "Reason", example = "Site closed")
    String reason
) {
}
