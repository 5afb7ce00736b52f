package org.cim.location.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;

/**
 * Response DTO for a batch reparenting.
 */
@Schema(description = "Events appended by a batch reparenting")
public record ReparentResponse(
    @Schema(description = "One entry per moved location") List<CommandResponse> results
) {
  /**
   * Compact constructor with defensive copying.
   *
   * @param results the results
   */
  public ReparentResponse {
    results = results != null ? List.copyOf(results) : List.of();
  }
}
