package org.cim.location.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.cim.location.config.LocationProperties;
import org.cim.location.domain.Location;
import org.cim.location.domain.LocationId;
import org.cim.location.exception.CycleDetectedException;
import org.cim.location.exception.HierarchyDepthExceededException;
import org.cim.location.exception.LocationNotFoundException;
import org.cim.location.repository.LocationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Keeps the parent/child relation between locations acyclic.
 *
 * <p>Each location stores only its own parent, so the guard walks ancestor chains across
 * aggregates through the repository. The walk starts at the proposed parent and is bounded by
 * {@code location.max-hierarchy-depth}: the chain from the proposed parent up to its root may
 * hold at most that many locations.
 *
 * <p>The check is not transactional. A concurrent reparenting elsewhere can still close a cycle
 * between the check and the append; {@link #verifyCommitted(LocationId)} detects that case
 * after the fact.
 */
@Service
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public class HierarchyGuard {
  private static final Logger logger = LoggerFactory.getLogger(HierarchyGuard.class);

  private final LocationRepository repository;
  private final LocationProperties properties;

  /**
   * Constructs a HierarchyGuard.
   *
   * @param repository the location repository
   * @param properties the location properties
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Repository and properties are Spring-managed beans")
  public HierarchyGuard(LocationRepository repository, LocationProperties properties) {
    this.repository = repository;
    this.properties = properties;
  }

  /**
   * Validates that making {@code proposedParentId} the parent of {@code childId} keeps the
   * hierarchy acyclic and within the depth limit.
   *
   * @param childId the location being moved
   * @param proposedParentId the new parent
   * @throws CycleDetectedException if the child is an ancestor of the proposed parent
   * @throws HierarchyDepthExceededException if the ancestor chain is too long
   * @throws LocationNotFoundException if the proposed parent does not exist
   */
  @Timed(
      value = "location.hierarchy.validate",
      description = "Time spent walking ancestor chains"
  )
  public void validateNewParent(LocationId childId, LocationId proposedParentId) {
    validateEdge(childId, proposedParentId, Map.of());
  }

  /**
   * Validates a batch of parent assignments against the hierarchy as it will be after the
   * whole batch is applied.
   *
   * @param assignments the assignments; a null parent makes the child a root
   * @throws IllegalArgumentException if a child appears more than once
   * @throws CycleDetectedException if the post-batch hierarchy contains a cycle
   * @throws HierarchyDepthExceededException if a post-batch ancestor chain is too long
   * @throws LocationNotFoundException if a proposed parent does not exist
   */
  @Timed(
      value = "location.hierarchy.validate.batch",
      description = "Time spent validating batch reparenting"
  )
  public void validateBatch(List<ParentAssignment> assignments) {
    Map<LocationId, Optional<LocationId>> overlay = new HashMap<>();
    for (ParentAssignment assignment : assignments) {
      if (overlay.put(assignment.childId(), assignment.newParent()) != null) {
        throw new IllegalArgumentException("Location " + assignment.childId()
            + " appears more than once in the batch");
      }
    }

    for (ParentAssignment assignment : assignments) {
      if (assignment.newParentId() != null) {
        validateEdge(assignment.childId(), assignment.newParentId(), overlay);
      }
    }
    logger.debug("Validated batch of {} parent assignments", assignments.size());
  }

  /**
   * Re-checks a committed parent assignment. Used after the append to catch cycles closed by
   * a concurrent command.
   *
   * @param childId the location whose parent was just set
   * @return the cycle, starting and ending at the child, if the child is its own ancestor
   */
  public Optional<List<LocationId>> verifyCommitted(LocationId childId) {
    List<LocationId> path = new ArrayList<>();
    path.add(childId);
    Set<LocationId> visited = new HashSet<>();
    visited.add(childId);

    Optional<LocationId> current = repository.find(childId).flatMap(Location::parent);
    while (current.isPresent()) {
      LocationId ancestor = current.get();
      path.add(ancestor);
      if (ancestor.equals(childId)) {
        logger.warn("Committed hierarchy contains cycle {}", path);
        return Optional.of(List.copyOf(path));
      }
      if (!visited.add(ancestor)) {
        // A cycle above the child that does not pass through it
        logger.warn("Ancestor chain of {} loops at {} without reaching it", childId, ancestor);
        return Optional.empty();
      }
      current = repository.find(ancestor).flatMap(Location::parent);
    }
    return Optional.empty();
  }

  private void validateEdge(LocationId childId, LocationId proposedParentId,
      Map<LocationId, Optional<LocationId>> overlay) {
    if (childId.equals(proposedParentId)) {
      throw new CycleDetectedException(childId);
    }
    if (repository.find(proposedParentId).isEmpty()) {
      throw new LocationNotFoundException(proposedParentId);
    }

    int maxDepth = properties.getMaxHierarchyDepth();
    List<LocationId> path = new ArrayList<>();
    path.add(childId);

    Optional<LocationId> current = Optional.of(proposedParentId);
    int depth = 0;
    while (current.isPresent()) {
      LocationId ancestor = current.get();
      path.add(ancestor);
      if (ancestor.equals(childId)) {
        logger.info("Rejected parent {} for location {}: cycle {}",
            proposedParentId, childId, path);
        throw new CycleDetectedException("Setting parent " + proposedParentId + " of location "
            + childId + " would create a cycle", path);
      }
      depth++;
      if (depth > maxDepth) {
        throw new HierarchyDepthExceededException("Ancestor chain of " + proposedParentId
            + " exceeds the maximum hierarchy depth of " + maxDepth, maxDepth);
      }
      current = parentOf(ancestor, overlay);
    }
  }

  private Optional<LocationId> parentOf(LocationId id,
      Map<LocationId, Optional<LocationId>> overlay) {
    Optional<LocationId> pending = overlay.get(id);
    if (pending != null) {
      return pending;
    }
    Optional<Location> location = repository.find(id);
    if (location.isEmpty()) {
      logger.warn("Ancestor walk reached unknown location {}; treating it as a root", id);
      return Optional.empty();
    }
    return location.get().parent();
  }
}
