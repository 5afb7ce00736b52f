package org.cim.location.store;

import java.time.Instant;
import java.util.Objects;
import org.cim.location.domain.Location;
import org.cim.location.domain.LocationId;

/**
 * Cached state of a location at a given version. Never authoritative: it must equal the
 * result of replaying events 1..version and may be dropped at any time.
 *
 * @param aggregateId the location id
 * @param version the version the state was taken at
 * @param state the state at that version
 * @param takenAt when the snapshot was created
 */
public record LocationSnapshot(
    LocationId aggregateId,
    long version,
    Location state,
    Instant takenAt) {

  /**
   * Creates a new LocationSnapshot with validation.
   *
   * @throws IllegalArgumentException if the state does not belong to the id or version
   */
  public LocationSnapshot {
    Objects.requireNonNull(aggregateId, "Aggregate id cannot be null");
    Objects.requireNonNull(state, "State cannot be null");
    Objects.requireNonNull(takenAt, "Timestamp cannot be null");
    if (!aggregateId.equals(state.id())) {
      throw new IllegalArgumentException("Snapshot state belongs to " + state.id()
          + ", not " + aggregateId);
    }
    if (version != state.version()) {
      throw new IllegalArgumentException("Snapshot version " + version
          + " does not match state version " + state.version());
    }
  }

  /**
   * Creates a snapshot of a state at its own version.
   *
   * @param state the state
   * @return the snapshot
   */
  public static LocationSnapshot of(Location state) {
    return new LocationSnapshot(state.id(), state.version(), state, Instant.now());
  }
}
