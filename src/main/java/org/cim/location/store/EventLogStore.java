package org.cim.location.store;

import java.util.List;
import java.util.Set;
import org.cim.location.domain.LocationId;
import org.cim.location.exception.StoreUnavailableException;
import org.cim.location.exception.VersionConflictException;

/**
 * Append-only, per-aggregate ordered event storage.
 *
 * <p>Implementations must make {@link #append} atomic per aggregate id: the head version check
 * and the write happen as one step, so two writers that loaded the same version cannot both
 * succeed.
 */
public interface EventLogStore {

  /**
   * Appends an event if the log's head is still at {@code expectedVersion}.
   *
   * @param aggregateId the location id
   * @param expectedVersion the head version the writer based its decision on (0 for a new log)
   * @param event the event envelope, whose version must be {@code expectedVersion + 1}
   * @return the new head version
   * @throws VersionConflictException if the head has moved
   * @throws StoreUnavailableException if the store cannot be reached
   */
  long append(LocationId aggregateId, long expectedVersion, StoredEvent event);

  /**
   * Reads the events after a version, in order.
   *
   * @param aggregateId the location id
   * @param fromVersion exclusive lower bound (0 reads the whole log)
   * @return events with version greater than {@code fromVersion}
   * @throws StoreUnavailableException if the store cannot be reached
   */
  List<StoredEvent> readFrom(LocationId aggregateId, long fromVersion);

  /**
   * Reads the events in a version range, in order.
   *
   * @param aggregateId the location id
   * @param fromVersion exclusive lower bound
   * @param toVersion inclusive upper bound
   * @return the matching events
   */
  default List<StoredEvent> readRange(LocationId aggregateId, long fromVersion, long toVersion) {
    return readFrom(aggregateId, fromVersion).stream()
        .filter(event -> event.version() <= toVersion)
        .toList();
  }

  /**
   * Returns the current head version.
   *
   * @param aggregateId the location id
   * @return the version of the last event, or 0 if the log is empty
   */
  long headVersion(LocationId aggregateId);

  /**
   * Returns the ids of all aggregates that have at least one event.
   *
   * @return aggregate ids
   */
  Set<LocationId> aggregateIds();
}
