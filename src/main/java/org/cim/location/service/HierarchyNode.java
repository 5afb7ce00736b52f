package org.cim.location.service;

import java.util.List;
import java.util.Objects;
import org.cim.location.domain.Location;

/**
 * A location and its descendants, as returned by the hierarchy tree query.
 *
 * @param location the location
 * @param children the child subtrees, empty at leaves or at the depth limit
 */
public record HierarchyNode(Location location, List<HierarchyNode> children) {

  /**
   * Creates a new HierarchyNode.
   */
  public HierarchyNode {
    Objects.requireNonNull(location, "Location cannot be null");
    children = children == null ? List.of() : List.copyOf(children);
  }
}
