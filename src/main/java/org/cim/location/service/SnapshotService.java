package org.cim.location.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.cim.location.config.LocationProperties;
import org.cim.location.domain.Location;
import org.cim.location.domain.LocationId;
import org.cim.location.repository.LocationRehydrator;
import org.cim.location.store.LocationSnapshot;
import org.cim.location.store.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Service for taking periodic snapshots of locations.
 * A snapshot is taken every N versions to bound the number of events replayed on load.
 * Snapshot failures are logged and never affect the save that triggered them.
 */
@Service
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public class SnapshotService {
  private static final Logger logger = LoggerFactory.getLogger(SnapshotService.class);

  private final LocationRehydrator rehydrator;
  private final SnapshotStore snapshotStore;
  private final LocationProperties properties;

  /**
   * Constructs a SnapshotService.
   *
   * @param rehydrator rebuilds the state to snapshot
   * @param snapshotStore the snapshot store
   * @param properties the location properties
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "All dependencies are Spring-managed beans and are thread-safe")
  public SnapshotService(
      LocationRehydrator rehydrator,
      SnapshotStore snapshotStore,
      LocationProperties properties) {
    this.rehydrator = rehydrator;
    this.snapshotStore = snapshotStore;
    this.properties = properties;
  }

  /**
   * Whether a save that reached the given version should trigger a snapshot.
   *
   * @param version the version just appended
   * @return true if a snapshot is due
   */
  public boolean isSnapshotDue(long version) {
    return properties.isSnapshotDue(version);
  }

  /**
   * Creates a snapshot in a separate thread.
   *
   * @param id the location id
   * @param version the version to snapshot
   * @return a future that completes once the attempt is over; it never completes exceptionally
   */
  @Async("snapshotExecutor")
  public CompletableFuture<Void> createSnapshotAsync(LocationId id, long version) {
    try {
      createSnapshot(id, version);
    } catch (RuntimeException e) {
      logger.error("Failed to create snapshot for location {} at version {}", id, version, e);
      // Don't rethrow - a missing snapshot only costs a longer replay
    }
    return CompletableFuture.completedFuture(null);
  }

  /**
   * Creates a snapshot synchronously.
   *
   * @param id the location id
   * @param version the version to snapshot
   * @return the stored snapshot, or empty if the location has not reached that version
   */
  public Optional<LocationSnapshot> createSnapshot(LocationId id, long version) {
    Optional<Location> state = rehydrator.rehydrate(id, version);
    if (state.isEmpty() || state.get().version() != version) {
      logger.warn("Skipping snapshot of location {}: version {} not found", id, version);
      return Optional.empty();
    }

    LocationSnapshot snapshot = LocationSnapshot.of(state.get());
    snapshotStore.put(snapshot);
    logger.info("Created snapshot of location {} at version {}", id, version);
    return Optional.of(snapshot);
  }
}
