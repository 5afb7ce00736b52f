package org.cim.location.command;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.annotation.Timed;
import org.cim.location.config.LocationProperties;
import org.cim.location.domain.Location;
import org.cim.location.domain.LocationTransitions;
import org.cim.location.event.EventPublisher;
import org.cim.location.event.LocationEvent;
import org.cim.location.exception.CommandCancelledException;
import org.cim.location.exception.ConcurrencyExhaustedException;
import org.cim.location.exception.LocationNotFoundException;
import org.cim.location.exception.TerminalStateViolationException;
import org.cim.location.exception.VersionConflictException;
import org.cim.location.repository.LocationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for handlers of single-location commands.
 *
 * <p>Each attempt loads the location, checks preconditions, lets the subclass decide on an
 * event, applies it to the loaded state as a dry run and appends it at the loaded version.
 * A {@link VersionConflictException} from the append starts a new attempt against the reloaded
 * state, up to {@code location.command.max-conflict-retries} times, unless the caller pinned an
 * expected version. The command can be cancelled by interrupting the handling thread until the
 * append is issued; after that it runs to completion.
 *
 * @param <C> the command type
 */
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public abstract class AbstractLocationCommandHandler<C extends LocationCommand>
    implements CommandHandler<C, CommandResult> {

  private static final Logger logger =
      LoggerFactory.getLogger(AbstractLocationCommandHandler.class);

  protected final LocationRepository repository;
  protected final EventPublisher eventPublisher;
  protected final LocationProperties properties;

  /**
   * Constructs the handler.
   *
   * @param repository the location repository
   * @param eventPublisher the event publisher
   * @param properties the location properties
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Repository, publisher and properties are Spring-managed beans")
  protected AbstractLocationCommandHandler(
      LocationRepository repository,
      EventPublisher eventPublisher,
      LocationProperties properties) {
    this.repository = repository;
    this.eventPublisher = eventPublisher;
    this.properties = properties;
  }

  @Override
  @Timed(
      value = "location.command",
      description = "Time spent handling location commands"
  )
  public CommandResult handle(C command) {
    boolean pinned = command.expectedVersion() != null;
    int maxRetries = pinned ? 0 : properties.getCommand().getMaxConflictRetries();

    VersionConflictException lastConflict = null;
    for (int attempt = 1; attempt <= maxRetries + 1; attempt++) {
      try {
        return attempt(command);
      } catch (VersionConflictException e) {
        if (pinned) {
          throw e;
        }
        lastConflict = e;
        logger.info("Version conflict on location {} (attempt {}/{}), reloading",
            command.locationId(), attempt, maxRetries + 1);
      }
    }
    throw new ConcurrencyExhaustedException("Gave up on " + command.getClass().getSimpleName()
        + " for location " + command.locationId() + " after " + (maxRetries + 1)
        + " conflicting attempts", maxRetries + 1, lastConflict);
  }

  private CommandResult attempt(C command) {
    checkCancelled(command);

    Location current = repository.find(command.locationId()).orElse(null);
    checkPreconditions(command, current);

    LocationEvent event = decide(command, current);
    // Dry run: reject invalid events before anything is appended
    LocationTransitions.apply(current, event);
    beforeSave(command, current, event);

    checkCancelled(command);
    long expectedVersion = current == null ? 0 : current.version();
    long version = repository.save(command.locationId(), expectedVersion, event);
    logger.info("{} appended to location {} at version {}",
        event.typeName(), command.locationId(), version);

    publish(event, version);
    return afterSave(command, current, event, version);
  }

  /**
   * Checks that the command may run against the loaded state.
   * The default requires an existing, unarchived location at the expected version.
   *
   * @param command the command
   * @param current the loaded state, or null if the location does not exist
   */
  protected void checkPreconditions(C command, Location current) {
    if (current == null) {
      throw new LocationNotFoundException(command.locationId());
    }
    if (current.archived()) {
      throw new TerminalStateViolationException("Location " + current.id()
          + " is archived and cannot be changed");
    }
    checkExpectedVersion(command, current);
  }

  /**
   * Fails with a version conflict when the caller pinned a version the location is not at.
   *
   * @param command the command
   * @param current the loaded state
   */
  protected final void checkExpectedVersion(C command, Location current) {
    Long expected = command.expectedVersion();
    long actual = current == null ? 0 : current.version();
    if (expected != null && expected != actual) {
      throw new VersionConflictException(command.locationId(), expected, actual);
    }
  }

  /**
   * Builds the event the command produces.
   *
   * @param command the command
   * @param current the loaded state, or null for a new location
   * @return the event to append
   */
  protected abstract LocationEvent decide(C command, Location current);

  /**
   * Runs after the dry run and before the append. Validation that needs other aggregates
   * goes here.
   *
   * @param command the command
   * @param current the loaded state
   * @param event the event about to be appended
   */
  protected void beforeSave(C command, Location current, LocationEvent event) {
  }

  /**
   * Runs after the append and publication.
   *
   * @param command the command
   * @param current the state the event was decided against
   * @param event the appended event
   * @param version the version it was appended at
   * @return the command result
   */
  protected CommandResult afterSave(C command, Location current, LocationEvent event,
      long version) {
    return new CommandResult(command.locationId(), version, event);
  }

  /**
   * Publishes an appended event. Publication failures are logged; the append stands.
   *
   * @param event the event
   * @param version its version
   */
  protected void publish(LocationEvent event, long version) {
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

  private void checkCancelled(C command) {
    if (Thread.currentThread().isInterrupted()) {
      throw new CommandCancelledException(command.getClass().getSimpleName()
          + " for location " + command.locationId() + " was cancelled");
    }
  }
}
