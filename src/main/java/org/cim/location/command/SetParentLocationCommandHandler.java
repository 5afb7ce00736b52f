package org.cim.location.command;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.cim.location.config.LocationProperties;
import org.cim.location.domain.Location;
import org.cim.location.domain.LocationId;
import org.cim.location.domain.LocationTransitions;
import org.cim.location.event.EventPublisher;
import org.cim.location.event.LocationEvent;
import org.cim.location.event.ParentLocationRemovedEvent;
import org.cim.location.event.ParentLocationSetEvent;
import org.cim.location.exception.ConcurrencyExhaustedException;
import org.cim.location.exception.CycleDetectedPostCommitException;
import org.cim.location.exception.TerminalStateViolationException;
import org.cim.location.exception.VersionConflictException;
import org.cim.location.repository.LocationRepository;
import org.cim.location.service.HierarchyGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Handles SetParentLocationCommand.
 *
 * <p>The hierarchy guard validates the new edge before the append. Because that check can race
 * with a concurrent reparenting elsewhere, the edge is verified again after the append when
 * {@code location.post-commit-verification} is on. If the committed hierarchy now contains a
 * cycle through the child, the edge is reverted by restoring the previous parent (or removing
 * the parent if there was none) and the caller receives {@link CycleDetectedPostCommitException}.
 */
@Component
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public class SetParentLocationCommandHandler
    extends AbstractLocationCommandHandler<SetParentLocationCommand> {

  private static final Logger logger =
      LoggerFactory.getLogger(SetParentLocationCommandHandler.class);

  private final HierarchyGuard hierarchyGuard;

  /**
   * Constructs a SetParentLocationCommandHandler.
   *
   * @param repository the location repository
   * @param eventPublisher the event publisher
   * @param properties the location properties
   * @param hierarchyGuard the hierarchy guard
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "HierarchyGuard is a Spring-managed bean")
  public SetParentLocationCommandHandler(
      LocationRepository repository,
      EventPublisher eventPublisher,
      LocationProperties properties,
      HierarchyGuard hierarchyGuard) {
    super(repository, eventPublisher, properties);
    this.hierarchyGuard = hierarchyGuard;
  }

  @Override
  protected LocationEvent decide(SetParentLocationCommand command, Location current) {
    return new ParentLocationSetEvent(command.locationId(), command.parentId(),
        current.parentId(), command.reason(), Instant.now());
  }

  @Override
  protected void beforeSave(SetParentLocationCommand command, Location current,
      LocationEvent event) {
    hierarchyGuard.validateNewParent(command.locationId(), command.parentId());
  }

  @Override
  protected CommandResult afterSave(SetParentLocationCommand command, Location current,
      LocationEvent event, long version) {
    if (properties.isPostCommitVerification()) {
      Optional<List<LocationId>> cycle = hierarchyGuard.verifyCommitted(command.locationId());
      if (cycle.isPresent()) {
        logger.error("Parent {} of location {} closed cycle {} after commit; reverting",
            command.parentId(), command.locationId(), cycle.get());
        long compensatedVersion = compensate(command, (ParentLocationSetEvent) event);
        throw new CycleDetectedPostCommitException(command.locationId(), compensatedVersion);
      }
    }
    return super.afterSave(command, current, event, version);
  }

  /**
   * Puts the child back under the parent it had before the command, or detaches it if it had
   * none. A child that is archived in the meantime cannot be changed any more; the cycle is
   * then logged and left in place.
   *
   * @return the version after the revert, or the current version if nothing was appended
   */
  private long compensate(SetParentLocationCommand command, ParentLocationSetEvent committed) {
    int attempts = properties.getCommand().getMaxConflictRetries() + 1;
    VersionConflictException lastConflict = null;
    for (int attempt = 1; attempt <= attempts; attempt++) {
      Location child = repository.load(command.locationId());
      if (!command.parentId().equals(child.parentId())) {
        logger.info("Location {} no longer has parent {}; nothing to revert",
            child.id(), command.parentId());
        return child.version();
      }

      String reason = "Reverted: parent " + command.parentId() + " closed a cycle";
      LocationEvent event = committed.previousParentId() != null
          ? new ParentLocationSetEvent(child.id(), committed.previousParentId(),
              child.parentId(), reason, Instant.now())
          : new ParentLocationRemovedEvent(child.id(), child.parentId(), reason, Instant.now());
      try {
        LocationTransitions.apply(child, event);
      } catch (TerminalStateViolationException e) {
        logger.error("Location {} was archived before its parent could be reverted; "
            + "cycle through parent {} remains", child.id(), command.parentId(), e);
        return child.version();
      }
      try {
        long version = repository.save(child.id(), child.version(), event);
        logger.info("Reverted parent of location {} at version {}", child.id(), version);
        publish(event, version);
        return version;
      } catch (VersionConflictException e) {
        lastConflict = e;
        logger.info("Version conflict while reverting parent of location {} (attempt {}/{})",
            child.id(), attempt, attempts);
      }
    }
    throw new ConcurrencyExhaustedException("Could not revert parent of location "
        + command.locationId() + " after " + attempts + " attempts", attempts, lastConflict);
  }
}
