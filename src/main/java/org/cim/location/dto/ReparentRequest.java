package org.cim.location.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

/**
 * Request DTO for moving several locations in one operation.
 */
@Schema(description = "Batch reparenting; applied completely or not at all")
public record ReparentRequest(
    @Schema(description = "Moves to apply")
    @NotEmpty(message = "At least one move is required")
    List<@Valid Move> moves,
    @Schema(description = "Optional reason", example = "Regional restructuring")
    String reason
) {
  /**
   * Compact constructor with defensive copying.
   *
   * @param moves the moves
   * @param reason the reason
   */
  public ReparentRequest {
    moves = moves != null ? List.copyOf(moves) : List.of();
  }

  /**
   * One move of the batch.
   *
   * @param locationId the location to move
   * @param parentId the new parent, or null to detach it
   */
  @Schema(description = "One move of a batch reparenting")
  public record Move(
      @Schema(description = "Location to move")
      @NotBlank(message = "Every move needs a location id")
      String locationId,
      @Schema(description = "New parent; null detaches the location") String parentId) {
  }
}
