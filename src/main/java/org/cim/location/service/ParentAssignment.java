package org.cim.location.service;

import java.util.Objects;
import java.util.Optional;
import org.cim.location.domain.LocationId;

/**
 * One element of a batch reparenting: the child and its new parent.
 *
 * @param childId the location being moved
 * @param newParentId the new parent, or null to make the child a root
 */
public record ParentAssignment(LocationId childId, LocationId newParentId) {

  /**
   * Creates a new ParentAssignment.
   */
  public ParentAssignment {
    Objects.requireNonNull(childId, "Child id cannot be null");
  }

  public Optional<LocationId> newParent() {
    return Optional.ofNullable(newParentId);
  }
}
