package org.cim.location.command;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.annotation.Timed;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.cim.location.config.LocationProperties;
import org.cim.location.domain.Location;
import org.cim.location.domain.LocationId;
import org.cim.location.domain.LocationTransitions;
import org.cim.location.event.EventPublisher;
import org.cim.location.event.LocationEvent;
import org.cim.location.event.ParentLocationRemovedEvent;
import org.cim.location.event.ParentLocationSetEvent;
import org.cim.location.exception.CommandCancelledException;
import org.cim.location.exception.ConcurrencyExhaustedException;
import org.cim.location.exception.CycleDetectedPostCommitException;
import org.cim.location.exception.NoOpRejectedException;
import org.cim.location.exception.TerminalStateViolationException;
import org.cim.location.exception.VersionConflictException;
import org.cim.location.repository.LocationRepository;
import org.cim.location.service.HierarchyGuard;
import org.cim.location.service.ParentAssignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Handles ReparentLocationsCommand.
 *
 * <p>The whole batch is validated against the post-batch hierarchy before the first event is
 * appended. The events are then appended one location at a time. The event log has no
 * multi-aggregate transaction, so if an append fails part way, the moves already appended are
 * reverted in reverse order before the failure is rethrown. A version conflict restarts the
 * whole batch against freshly loaded state.
 */
@Component
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public class ReparentLocationsCommandHandler
    implements CommandHandler<ReparentLocationsCommand, List<CommandResult>> {

  private static final Logger logger =
      LoggerFactory.getLogger(ReparentLocationsCommandHandler.class);

  private final LocationRepository repository;
  private final EventPublisher eventPublisher;
  private final LocationProperties properties;
  private final HierarchyGuard hierarchyGuard;

  /**
   * Constructs a ReparentLocationsCommandHandler.
   *
   * @param repository the location repository
   * @param eventPublisher the event publisher
   * @param properties the location properties
   * @param hierarchyGuard the hierarchy guard
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "All dependencies are Spring-managed beans and are thread-safe")
  public ReparentLocationsCommandHandler(
      LocationRepository repository,
      EventPublisher eventPublisher,
      LocationProperties properties,
      HierarchyGuard hierarchyGuard) {
    this.repository = repository;
    this.eventPublisher = eventPublisher;
    this.properties = properties;
    this.hierarchyGuard = hierarchyGuard;
  }

  @Override
  @Timed(
      value = "location.command.reparent",
      description = "Time spent handling batch reparenting"
  )
  public List<CommandResult> handle(ReparentLocationsCommand command) {
    int attempts = properties.getCommand().getMaxConflictRetries() + 1;
    VersionConflictException lastConflict = null;
    for (int attempt = 1; attempt <= attempts; attempt++) {
      try {
        return attempt(command);
      } catch (VersionConflictException e) {
        lastConflict = e;
        logger.info("Version conflict in batch reparenting (attempt {}/{}), reloading",
            attempt, attempts);
      }
    }
    throw new ConcurrencyExhaustedException("Gave up on batch reparenting of "
        + command.assignments().size() + " locations after " + attempts
        + " conflicting attempts", attempts, lastConflict);
  }

  private List<CommandResult> attempt(ReparentLocationsCommand command) {
    checkCancelled();

    hierarchyGuard.validateBatch(command.assignments());

    List<Move> plan = new ArrayList<>();
    for (ParentAssignment assignment : command.assignments()) {
      Location current = repository.load(assignment.childId());
      if (current.archived()) {
        throw new TerminalStateViolationException("Location " + current.id()
            + " is archived and cannot be moved");
      }
      LocationEvent event = moveEvent(current, assignment.newParentId(), command.reason());
      LocationTransitions.apply(current, event);
      plan.add(new Move(current, event));
    }

    checkCancelled();
    List<CommandResult> applied = new ArrayList<>();
    try {
      for (Move move : plan) {
        long version = repository.save(move.before().id(), move.before().version(),
            move.event());
        applied.add(new CommandResult(move.before().id(), version, move.event()));
        publish(move.event(), version);
      }
    } catch (RuntimeException e) {
      logger.warn("Batch reparenting failed after {} of {} moves: {}",
          applied.size(), plan.size(), e.getMessage());
      revert(plan, applied).forEach(e::addSuppressed);
      throw e;
    }

    if (properties.isPostCommitVerification()) {
      verifyCommitted(plan, applied);
    }

    logger.info("Reparented {} locations", applied.size());
    return List.copyOf(applied);
  }

  private void verifyCommitted(List<Move> plan, List<CommandResult> applied) {
    for (CommandResult result : applied) {
      if (!(result.event() instanceof ParentLocationSetEvent)) {
        continue;
      }
      Optional<List<LocationId>> cycle = hierarchyGuard.verifyCommitted(result.locationId());
      if (cycle.isPresent()) {
        logger.error("Batch reparenting closed cycle {} after commit; reverting", cycle.get());
        Map<LocationId, Long> versions = new HashMap<>();
        List<RuntimeException> failures = revert(plan, applied, versions);
        CycleDetectedPostCommitException exception = new CycleDetectedPostCommitException(
            result.locationId(), versions.getOrDefault(result.locationId(), result.version()));
        failures.forEach(exception::addSuppressed);
        throw exception;
      }
    }
  }

  private List<RuntimeException> revert(List<Move> plan, List<CommandResult> applied) {
    return revert(plan, applied, new HashMap<>());
  }

  /**
   * Restores the previous parent of every applied move, newest first.
   * A move whose location was changed again in the meantime is left alone.
   *
   * @return the failures of individual reverts
   */
  private List<RuntimeException> revert(List<Move> plan, List<CommandResult> applied,
      Map<LocationId, Long> versions) {
    List<RuntimeException> failures = new ArrayList<>();
    for (int i = applied.size() - 1; i >= 0; i--) {
      Move move = plan.get(i);
      CommandResult result = applied.get(i);
      try {
        Location current = repository.load(result.locationId());
        if (current.version() != result.version()) {
          logger.warn("Location {} changed after batch move (version {} != {}); not reverting",
              current.id(), current.version(), result.version());
          continue;
        }
        LocationEvent undo = moveEvent(current, move.before().parentId(),
            "Reverted: batch reparenting did not complete");
        LocationTransitions.apply(current, undo);
        long version = repository.save(current.id(), current.version(), undo);
        versions.put(current.id(), version);
        publish(undo, version);
        logger.info("Reverted parent of location {} at version {}", current.id(), version);
      } catch (RuntimeException e) {
        logger.error("Could not revert batch move of location {}", result.locationId(), e);
        failures.add(e);
      }
    }
    return failures;
  }

  private static LocationEvent moveEvent(Location current, LocationId newParentId,
      String reason) {
    if (newParentId != null) {
      return new ParentLocationSetEvent(current.id(), newParentId, current.parentId(), reason,
          Instant.now());
    }
    if (current.parentId() == null) {
      throw new NoOpRejectedException("Location " + current.id() + " has no parent to remove");
    }
    return new ParentLocationRemovedEvent(current.id(), current.parentId(), reason,
        Instant.now());
  }

  private void publish(LocationEvent event, long version) {
    eventPublisher.publish(event, version)
        .whenComplete((result, ex) -> {
          if (ex != null) {
            logger.error("Failed to publish event {} to Kafka: {}",
                event.typeName(), ex.getMessage(), ex);
          } else {
            logger.debug("Successfully published event {} to Kafka", event.typeName());
          }
        });
  }

  private static void checkCancelled() {
    if (Thread.currentThread().isInterrupted()) {
      throw new CommandCancelledException("Batch reparenting was cancelled");
    }
  }

  private record Move(Location before, LocationEvent event) {
    Move {
      Objects.requireNonNull(before, "State cannot be null");
      Objects.requireNonNull(event, "Event cannot be null");
    }
  }
}
