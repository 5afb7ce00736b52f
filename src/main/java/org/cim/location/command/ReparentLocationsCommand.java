package org.cim.location.command;

import java.util.List;
import java.util.Objects;
import org.cim.location.service.ParentAssignment;

/**
 * Command to move several locations in one operation.
 * The batch is validated against the hierarchy as it will be after every move and is
 * applied completely or not at all.
 *
 * @param assignments the moves, each naming a child and its new parent (null for none)
 * @param reason optional reason
 */
public record ReparentLocationsCommand(
    List<ParentAssignment> assignments,
    String reason) implements Command {

  /**
   * Creates a new ReparentLocationsCommand with validation.
   *
   * @throws IllegalArgumentException if the batch is empty
   */
  public ReparentLocationsCommand {
    Objects.requireNonNull(assignments, "Assignments cannot be null");
    if (assignments.isEmpty()) {
      throw new IllegalArgumentException("Assignments cannot be empty");
    }
    assignments = List.copyOf(assignments);
  }
}
