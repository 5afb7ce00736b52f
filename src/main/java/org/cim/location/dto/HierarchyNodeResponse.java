package org.cim.location.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;
import org.cim.location.service.HierarchyNode;

/**
 * Response DTO for a location subtree.
 */
@Schema(description = "A location and its descendants")
public record HierarchyNodeResponse(
    @Schema(description = "The location") LocationResponse location,
    @Schema(description = "Child subtrees") List<HierarchyNodeResponse> children
) {
  /**
   * Compact constructor with defensive copying.
   *
   * @param location the location
   * @param children the children
   */
  public HierarchyNodeResponse {
    children = children != null ? List.copyOf(children) : List.of();
  }

  /**
   * Creates a response from a hierarchy node.
   *
   * @param node the node
   * @return the response
   */
  public static HierarchyNodeResponse from(HierarchyNode node) {
    return new HierarchyNodeResponse(
        LocationResponse.from(node.location()),
        node.children().stream().map(HierarchyNodeResponse::from).toList());
  }
}
