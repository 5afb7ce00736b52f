package org.cim.location.testutil;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.cim.location.domain.LocationId;
import org.cim.location.exception.StoreUnavailableException;
import org.cim.location.exception.VersionConflictException;
import org.cim.location.store.InMemoryEventLogStore;
import org.cim.location.store.StoredEvent;

/**
 * In-memory event log that can simulate concurrent writers and outages.
 */
public class ScriptedEventLogStore extends InMemoryEventLogStore {

  private final AtomicReference<Runnable> beforeNextAppend = new AtomicReference<>();
  private final AtomicInteger forcedConflicts = new AtomicInteger();
  private final Set<LocationId> unavailable = ConcurrentHashMap.newKeySet();

  /**
   * Runs an action once, right before the next append is checked. The action may append
   * itself; it is cleared before it runs.
   *
   * @param action the action
   */
  public void beforeNextAppend(Runnable action) {
    beforeNextAppend.set(action);
  }

  /**
   * Makes the next appends fail with a version conflict as if another writer had won.
   *
   * @param count number of appends to reject
   */
  public void conflictNextAppends(int count) {
    forcedConflicts.set(count);
  }

  /**
   * Makes every append to a location fail as unavailable.
   *
   * @param id the location
   */
  public void failAppendsFor(LocationId id) {
    unavailable.add(id);
  }

  @Override
  public long append(LocationId aggregateId, long expectedVersion, StoredEvent event) {
    Runnable action = beforeNextAppend.getAndSet(null);
    if (action != null) {
      action.run();
    }
    if (unavailable.contains(aggregateId)) {
      throw new StoreUnavailableException("Event log unreachable for " + aggregateId);
    }
    if (forcedConflicts.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
      throw new VersionConflictException(aggregateId, expectedVersion, expectedVersion + 1);
    }
    return super.append(aggregateId, expectedVersion, event);
  }
}
