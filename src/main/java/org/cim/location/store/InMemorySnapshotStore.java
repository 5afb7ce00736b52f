package org.cim.location.store;

import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import org.cim.location.domain.LocationId;
import org.springframework.stereotype.Repository;

/**
 * In-memory snapshot store.
 */
@Repository
public class InMemorySnapshotStore implements SnapshotStore {

  private final Map<LocationId, NavigableMap<Long, LocationSnapshot>> snapshots =
      new ConcurrentHashMap<>();

  @Override
  public Optional<LocationSnapshot> getLatest(LocationId aggregateId, long maxVersion) {
    NavigableMap<Long, LocationSnapshot> versions = snapshots.get(aggregateId);
    if (versions == null) {
      return Optional.empty();
    }
    Map.Entry<Long, LocationSnapshot> entry = versions.floorEntry(maxVersion);
    return entry == null ? Optional.empty() : Optional.of(entry.getValue());
  }

  @Override
  public void put(LocationSnapshot snapshot) {
    snapshots.computeIfAbsent(snapshot.aggregateId(), id -> new ConcurrentSkipListMap<>())
        .put(snapshot.version(), snapshot);
  }

  @Override
  public void delete(LocationId aggregateId) {
    snapshots.remove(aggregateId);
  }

  /**
   * Counts the snapshots held for an aggregate.
   *
   * @param aggregateId the location id
   * @return number of snapshots
   */
  public int count(LocationId aggregateId) {
    NavigableMap<Long, LocationSnapshot> versions = snapshots.get(aggregateId);
    return versions == null ? 0 : versions.size();
  }
}
