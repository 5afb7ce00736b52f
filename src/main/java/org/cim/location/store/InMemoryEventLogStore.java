package org.cim.location.store;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.cim.location.domain.LocationId;
import org.cim.location.exception.VersionConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * In-memory event log.
 * Appends are serialized per aggregate id by {@link ConcurrentHashMap#compute}; readers
 * iterate a copy-on-write list and never block writers.
 */
@Repository
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public class InMemoryEventLogStore implements EventLogStore {

  private static final Logger logger = LoggerFactory.getLogger(InMemoryEventLogStore.class);

  private final Map<LocationId, CopyOnWriteArrayList<StoredEvent>> logs =
      new ConcurrentHashMap<>();

  @Override
  public long append(LocationId aggregateId, long expectedVersion, StoredEvent event) {
    if (!aggregateId.equals(event.aggregateId())) {
      throw new IllegalArgumentException("Event belongs to " + event.aggregateId()
          + ", not " + aggregateId);
    }
    if (event.version() != expectedVersion + 1) {
      throw new IllegalArgumentException("Event version " + event.version()
          + " does not follow expected version " + expectedVersion);
    }

    logs.compute(aggregateId, (id, log) -> {
      long head = log == null ? 0 : log.size();
      if (head != expectedVersion) {
        throw new VersionConflictException(id, expectedVersion, head);
      }
      CopyOnWriteArrayList<StoredEvent> target = log == null ? new CopyOnWriteArrayList<>() : log;
      target.add(event);
      return target;
    });

    logger.debug("Appended {} to location {} at version {}",
        event.type(), aggregateId, event.version());
    return event.version();
  }

  @Override
  public List<StoredEvent> readFrom(LocationId aggregateId, long fromVersion) {
    List<StoredEvent> log = logs.get(aggregateId);
    if (log == null) {
      return List.of();
    }
    return log.stream()
        .filter(event -> event.version() > fromVersion)
        .toList();
  }

  @Override
  public long headVersion(LocationId aggregateId) {
    List<StoredEvent> log = logs.get(aggregateId);
    return log == null ? 0 : log.size();
  }

  @Override
  public Set<LocationId> aggregateIds() {
    return Set.copyOf(logs.keySet());
  }

  /**
   * Removes all logs. For tests.
   */
  public void clear() {
    logs.clear();
  }
}
