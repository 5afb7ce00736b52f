package org.cim.location.repository;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.cim.location.config.StoreRetryProperties;
import org.cim.location.domain.Location;
import org.cim.location.domain.LocationId;
import org.cim.location.event.LocationEvent;
import org.cim.location.event.LocationEventCodec;
import org.cim.location.exception.LocationNotFoundException;
import org.cim.location.exception.StoreUnavailableException;
import org.cim.location.exception.VersionConflictException;
import org.cim.location.service.HistoryEntry;
import org.cim.location.service.SnapshotService;
import org.cim.location.store.EventLogStore;
import org.cim.location.store.StoredEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Repository;

/**
 * Loads Location aggregates from snapshots plus events and appends new events with an
 * optimistic version check. The only component that talks to the event log and snapshot store.
 *
 * <p>{@link StoreUnavailableException} is retried here with exponential backoff
 * ({@code location.store.retry.*}); once retries are exhausted it propagates to the caller.
 * {@link VersionConflictException} is never retried here; the command handler reloads and
 * decides again. Interrupts do not cut a retry short; the interrupt flag survives the call.
 */
@Repository
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public class LocationRepository {

  private static final Logger logger = LoggerFactory.getLogger(LocationRepository.class);

  private final EventLogStore eventLogStore;
  private final LocationRehydrator rehydrator;
  private final LocationEventCodec codec;
  private final SnapshotService snapshotService;
  private final RetryTemplate retryTemplate;

  /**
   * Constructs a LocationRepository.
   *
   * @param eventLogStore the event log
   * @param rehydrator rebuilds state from snapshots and events
   * @param codec the event codec
   * @param snapshotService schedules snapshots
   * @param retryProperties backoff settings for store failures
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "All dependencies are Spring-managed beans and are thread-safe")
  public LocationRepository(
      EventLogStore eventLogStore,
      LocationRehydrator rehydrator,
      LocationEventCodec codec,
      SnapshotService snapshotService,
      StoreRetryProperties retryProperties) {
    this.eventLogStore = eventLogStore;
    this.rehydrator = rehydrator;
    this.codec = codec;
    this.snapshotService = snapshotService;
    this.retryTemplate = buildRetryTemplate(retryProperties);
  }

  /**
   * Loads the current state of a location.
   *
   * @param id the location id
   * @return the state at the head version
   * @throws LocationNotFoundException if the location has no events
   */
  public Location load(LocationId id) {
    return find(id).orElseThrow(() -> new LocationNotFoundException(id));
  }

  /**
   * Loads the state of a location as it was at a version.
   *
   * @param id the location id
   * @param targetVersion the version to load (must be &gt;= 1)
   * @return the state at exactly that version
   * @throws LocationNotFoundException if the location has no events
   * @throws IllegalArgumentException if the version is beyond the head
   */
  public Location load(LocationId id, long targetVersion) {
    if (targetVersion < 1) {
      throw new IllegalArgumentException("Version must be >= 1");
    }
    Location state = withRetry("load", id, () -> rehydrator.rehydrate(id, targetVersion))
        .orElseThrow(() -> new LocationNotFoundException(id));
    if (state.version() != targetVersion) {
      throw new IllegalArgumentException("Location " + id + " has no version " + targetVersion
          + " (head is " + state.version() + ")");
    }
    return state;
  }

  /**
   * Loads the current state of a location if it exists.
   *
   * @param id the location id
   * @return the state, or empty if the location has no events
   */
  public Optional<Location> find(LocationId id) {
    return withRetry("load", id, () -> rehydrator.rehydrate(id, Long.MAX_VALUE));
  }

  /**
   * Appends an event if the location is still at {@code expectedVersion}.
   * Schedules a snapshot when the new version is a multiple of the snapshot frequency;
   * snapshot problems are logged and never fail the save.
   *
   * @param id the location id
   * @param expectedVersion the version the event was decided against (0 for a new location)
   * @param event the event to append
   * @return the new version
   * @throws VersionConflictException if another writer appended first
   * @throws StoreUnavailableException if the store stays unreachable after all retries
   */
  public long save(LocationId id, long expectedVersion, LocationEvent event) {
    if (!id.equals(event.locationId())) {
      throw new IllegalArgumentException("Event for location " + event.locationId()
          + " cannot be saved to location " + id);
    }

    StoredEvent stored = codec.encode(event, expectedVersion + 1);
    long newVersion = withRetry("append", id,
        () -> eventLogStore.append(id, expectedVersion, stored));

    logger.debug("Saved {} for location {} at version {}", event.typeName(), id, newVersion);

    if (snapshotService.isSnapshotDue(newVersion)) {
      try {
        snapshotService.createSnapshotAsync(id, newVersion);
      } catch (RuntimeException e) {
        logger.warn("Could not schedule snapshot of location {} at version {}: {}",
            id, newVersion, e.getMessage());
      }
    }
    return newVersion;
  }

  /**
   * Reads the full event history of a location.
   *
   * @param id the location id
   * @return every event with its version, oldest first
   * @throws LocationNotFoundException if the location has no events
   */
  public List<HistoryEntry> history(LocationId id) {
    List<StoredEvent> events = withRetry("read", id, () -> eventLogStore.readFrom(id, 0));
    if (events.isEmpty()) {
      throw new LocationNotFoundException(id);
    }
    return events.stream()
        .map(stored -> new HistoryEntry(stored.version(), stored.schemaVersion(),
            codec.decode(stored)))
        .toList();
  }

  /**
   * Returns the ids of all known locations.
   *
   * @return location ids
   */
  public Set<LocationId> allIds() {
    return withRetry("list", null, eventLogStore::aggregateIds);
  }

  private <T> T withRetry(String operation, LocationId id, Supplier<T> action) {
    return retryTemplate.execute(context -> {
      if (context.getRetryCount() > 0) {
        logger.info("Retrying {} of location {} (attempt {})",
            operation, id, context.getRetryCount() + 1);
      }
      return action.get();
    });
  }

  private static RetryTemplate buildRetryTemplate(StoreRetryProperties properties) {
    ExponentialBackOffPolicy backOff = new ExponentialBackOffPolicy();
    backOff.setInitialInterval(properties.getInitialInterval());
    backOff.setMultiplier(properties.getMultiplier());
    backOff.setMaxInterval(Math.max(properties.getMaxInterval(),
        properties.getInitialInterval() + 1));
    backOff.setSleeper(new DeferredInterruptSleeper());
    return RetryTemplate.builder()
        .maxAttempts(properties.getMaxAttempts())
        .customBackoff(backOff)
        .retryOn(StoreUnavailableException.class)
        .withListener(new RetryListener() {
          @Override
          public <T, E extends Throwable> void onError(RetryContext context,
              RetryCallback<T, E> callback, Throwable throwable) {
            logger.warn("Store unavailable (attempt {}/{}): {}",
                context.getRetryCount(), properties.getMaxAttempts(), throwable.getMessage());
          }
        })
        .build();
  }

  /**
   * Backoff sleeper that is not cut short by an interrupt.
   * A retried append must finish with a result or a definitive conflict, so an interrupt
   * received while waiting is remembered and the flag is restored after the full period.
   * Command handlers see the flag at their next cancellation check.
   */
  static final class DeferredInterruptSleeper implements Sleeper {

    private static final long serialVersionUID = 1L;

    @Override
    public void sleep(long backOffPeriod) {
      boolean interrupted = Thread.interrupted();
      long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(backOffPeriod);
      long remaining = deadline - System.nanoTime();
      while (remaining > 0) {
        try {
          TimeUnit.NANOSECONDS.sleep(remaining);
        } catch (InterruptedException e) {
          interrupted = true;
        }
        remaining = deadline - System.nanoTime();
      }
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }
}
