package org.cim.location.store;

import java.util.Optional;
import org.cim.location.domain.LocationId;

/**
 * Storage for location snapshots, keyed by aggregate id and version.
 */
public interface SnapshotStore {

  /**
   * Returns the newest snapshot at or below a version.
   *
   * @param aggregateId the location id
   * @param maxVersion inclusive upper bound
   * @return the snapshot, or empty if none qualifies
   * @throws org.cim.location.exception.StoreUnavailableException if the store cannot be reached
   */
  Optional<LocationSnapshot> getLatest(LocationId aggregateId, long maxVersion);

  /**
   * Stores a snapshot, replacing any snapshot at the same version.
   *
   * @param snapshot the snapshot
   */
  void put(LocationSnapshot snapshot);

  /**
   * Drops every snapshot of an aggregate.
   *
   * @param aggregateId the location id
   */
  void delete(LocationId aggregateId);
}
