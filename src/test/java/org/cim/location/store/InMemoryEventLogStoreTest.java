package org.cim.location.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.cim.location.domain.LocationId;
import org.cim.location.exception.VersionConflictException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for InMemoryEventLogStore.
 */
class InMemoryEventLogStoreTest {

  private static final LocationId ID = LocationId.of("01933e4a-9d4e-7000-8000-000000000001");
  private static final LocationId OTHER = LocationId.of("01933e4a-9d4e-7000-8000-000000000002");

  private InMemoryEventLogStore store;

  @BeforeEach
  void setUp() {
    store = new InMemoryEventLogStore();
  }

  @Test
  void append_shouldGrowTheLogInOrder() {
    assertThat(store.append(ID, 0, event(ID, 1))).isEqualTo(1);
    assertThat(store.append(ID, 1, event(ID, 2))).isEqualTo(2);
    assertThat(store.append(ID, 2, event(ID, 3))).isEqualTo(3);

    assertThat(store.headVersion(ID)).isEqualTo(3);
    assertThat(store.readFrom(ID, 0)).extracting(StoredEvent::version).containsExactly(1L, 2L, 3L);
    assertThat(store.readFrom(ID, 1)).extracting(StoredEvent::version).containsExactly(2L, 3L);
    assertThat(store.readRange(ID, 0, 2)).extracting(StoredEvent::version)
        .containsExactly(1L, 2L);
  }

  @Test
  void readFrom_unknownAggregate_shouldBeEmpty() {
    assertThat(store.readFrom(OTHER, 0)).isEmpty();
    assertThat(store.headVersion(OTHER)).isZero();
  }

  @Test
  void append_withStaleExpectedVersion_shouldConflict() {
    store.append(ID, 0, event(ID, 1));
    store.append(ID, 1, event(ID, 2));

    assertThatThrownBy(() -> store.append(ID, 1, event(ID, 2)))
        .isInstanceOfSatisfying(VersionConflictException.class, e -> {
          assertThat(e.getExpectedVersion()).isEqualTo(1);
          assertThat(e.getActualVersion()).isEqualTo(2);
        });
    assertThat(store.headVersion(ID)).isEqualTo(2);
  }

  @Test
  void append_withWrongAggregate_shouldBeRejected() {
    assertThatThrownBy(() -> store.append(ID, 0, event(OTHER, 1)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void append_withNonConsecutiveVersion_shouldBeRejected() {
    assertThatThrownBy(() -> store.append(ID, 0, event(ID, 2)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("does not follow");
  }

  @Test
  void aggregateIds_shouldListEveryLog() {
    store.append(ID, 0, event(ID, 1));
    store.append(OTHER, 0, event(OTHER, 1));

    assertThat(store.aggregateIds()).containsExactlyInAnyOrder(ID, OTHER);

    store.clear();
    assertThat(store.aggregateIds()).isEmpty();
  }

  @Test
  void concurrentAppends_atSameVersion_shouldLetExactlyOneWin() throws Exception {
    store.append(ID, 0, event(ID, 1));
    int writers = 8;
    ExecutorService executor = Executors.newFixedThreadPool(writers);
    CountDownLatch start = new CountDownLatch(1);
    AtomicInteger conflicts = new AtomicInteger();
    List<Future<?>> futures = new ArrayList<>();

    try {
      for (int i = 0; i < writers; i++) {
        futures.add(executor.submit(() -> {
          start.await();
          try {
            store.append(ID, 1, event(ID, 2));
          } catch (VersionConflictException e) {
            conflicts.incrementAndGet();
          }
          return null;
        }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(5, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    assertThat(conflicts.get()).isEqualTo(writers - 1);
    assertThat(store.headVersion(ID)).isEqualTo(2);
    assertThat(store.readFrom(ID, 0)).hasSize(2);
  }

  private static StoredEvent event(LocationId id, long version) {
    ObjectNode payload = JsonNodeFactory.instance.objectNode();
    payload.put("locationId", id.toString());
    return new StoredEvent("LocationMetadataAdded", id, version, Instant.now(), 2, payload);
  }
}
