package org.cim.location.repository;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Optional;
import org.cim.location.config.LocationProperties;
import org.cim.location.domain.Location;
import org.cim.location.domain.LocationId;
import org.cim.location.domain.LocationTransitions;
import org.cim.location.event.LocationEventCodec;
import org.cim.location.exception.StoreUnavailableException;
import org.cim.location.store.EventLogStore;
import org.cim.location.store.LocationSnapshot;
import org.cim.location.store.SnapshotStore;
import org.cim.location.store.StoredEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Rebuilds location state from the newest usable snapshot plus the events after it.
 * Shared by the repository and the snapshot service so that both derive state the same way.
 */
@Component
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public class LocationRehydrator {

  private static final Logger logger = LoggerFactory.getLogger(LocationRehydrator.class);

  private final EventLogStore eventLogStore;
  private final SnapshotStore snapshotStore;
  private final LocationEventCodec codec;
  private final LocationProperties properties;

  /**
   * Constructs a LocationRehydrator.
   *
   * @param eventLogStore the event log
   * @param snapshotStore the snapshot store
   * @param codec the event codec
   * @param properties the location properties
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Stores, codec and properties are Spring-managed beans and are "
          + "intentionally shared")
  public LocationRehydrator(
      EventLogStore eventLogStore,
      SnapshotStore snapshotStore,
      LocationEventCodec codec,
      LocationProperties properties) {
    this.eventLogStore = eventLogStore;
    this.snapshotStore = snapshotStore;
    this.codec = codec;
    this.properties = properties;
  }

  /**
   * Rebuilds the state of a location at a version, starting from a snapshot when one exists.
   *
   * @param id the location id
   * @param targetVersion the newest version to include ({@link Long#MAX_VALUE} for head)
   * @return the state, or empty if the location has no events
   * @throws StoreUnavailableException if the event log cannot be reached
   */
  public Optional<Location> rehydrate(LocationId id, long targetVersion) {
    Location base = properties.isSnapshotsEnabled()
        ? readSnapshot(id, targetVersion).map(LocationSnapshot::state).orElse(null)
        : null;
    return fold(id, base, targetVersion);
  }

  /**
   * Rebuilds the state of a location from its full log, ignoring snapshots.
   *
   * @param id the location id
   * @param targetVersion the newest version to include
   * @return the state, or empty if the location has no events
   */
  public Optional<Location> replay(LocationId id, long targetVersion) {
    return fold(id, null, targetVersion);
  }

  private Optional<Location> fold(LocationId id, Location base, long targetVersion) {
    long fromVersion = base == null ? 0 : base.version();
    List<StoredEvent> events = eventLogStore.readRange(id, fromVersion, targetVersion);
    if (base == null && events.isEmpty()) {
      return Optional.empty();
    }

    Location state = base;
    for (StoredEvent stored : events) {
      long expected = (state == null ? 0 : state.version()) + 1;
      if (stored.version() != expected) {
        throw new IllegalStateException("Event log of location " + id + " has a gap: expected "
            + "version " + expected + " but found " + stored.version());
      }
      state = LocationTransitions.apply(state, codec.decode(stored));
    }

    logger.debug("Rehydrated location {} at version {} ({} events replayed from version {})",
        id, state.version(), events.size(), fromVersion);
    return Optional.of(state);
  }

  private Optional<LocationSnapshot> readSnapshot(LocationId id, long targetVersion) {
    try {
      return snapshotStore.getLatest(id, targetVersion)
          .filter(snapshot -> snapshot.version() <= targetVersion);
    } catch (RuntimeException e) {
      // A snapshot is only a cache: fall back to a full replay
      logger.warn("Ignoring unreadable snapshot of location {}: {}", id, e.getMessage());
      return Optional.empty();
    }
  }
}
