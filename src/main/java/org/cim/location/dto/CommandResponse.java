package org.cim.location.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import org.cim.location.command.CommandResult;

/**
 * Response DTO for an accepted command.
 */
@Schema(description = "Outcome of a command")
public record CommandResponse(
    @Schema(description = "Location that changed") String locationId,
    @Schema(description = "Version after the change", example = "4") long version,
    @Schema(description = "Id of the appended event") String eventId,
    @Schema(description = "Type of the appended event", example = "ParentLocationSet")
    String eventType
) {
  /**
   * Creates a response from a command result.
   *
   * @param result the result
   * @return the response
   */
  public static CommandResponse from(CommandResult result) {
    return new CommandResponse(
        result.locationId().toString(),
        result.version(),
        result.event().eventId(),
        result.event().typeName());
  }
}
