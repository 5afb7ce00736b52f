package org.cim.location.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import org.cim.location.config.LocationProperties;
import org.cim.location.domain.Location;
import org.cim.location.domain.LocationId;
import org.cim.location.domain.LocationType;
import org.cim.location.event.LocationDefinedEvent;
import org.cim.location.event.LocationMetadataAddedEvent;
import org.cim.location.event.ParentLocationSetEvent;
import org.cim.location.exception.LocationNotFoundException;
import org.cim.location.exception.StoreUnavailableException;
import org.cim.location.exception.VersionConflictException;
import org.cim.location.service.HistoryEntry;
import org.cim.location.store.EventLogStore;
import org.cim.location.store.InMemoryEventLogStore;
import org.cim.location.store.InMemorySnapshotStore;
import org.cim.location.store.SnapshotStore;
import org.cim.location.store.StoredEvent;
import org.cim.location.testutil.LocationFixture;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for LocationRepository.
 */
class LocationRepositoryTest {

  private static final LocationId ID = LocationId.of("01933e4a-9d4e-7000-8000-000000000001");
  private static final Instant T0 = Instant.parse("2025-01-15T10:00:00Z");

  @Test
  void saveThenLoad_shouldReturnFoldedState() {
    LocationRepository repository = new LocationFixture().repository();

    assertThat(repository.save(ID, 0, defined())).isEqualTo(1);
    assertThat(repository.save(ID, 1, metadata("floor", "3", 1))).isEqualTo(2);

    Location state = repository.load(ID);
    assertThat(state.version()).isEqualTo(2);
    assertThat(state.name()).isEqualTo("Depot");
    assertThat(state.metadata()).containsEntry("floor", "3");
    assertThat(repository.allIds()).containsExactly(ID);
  }

  @Test
  void load_unknownLocation_shouldThrowNotFound() {
    LocationRepository repository = new LocationFixture().repository();

    assertThatThrownBy(() -> repository.load(ID))
        .isInstanceOf(LocationNotFoundException.class);
    assertThat(repository.find(ID)).isEmpty();
  }

  @Test
  void loadAtVersion_shouldReturnHistoricalState() {
    LocationRepository repository = new LocationFixture().repository();
    repository.save(ID, 0, defined());
    repository.save(ID, 1, metadata("floor", "3", 1));
    repository.save(ID, 2, metadata("floor", "4", 2));

    assertThat(repository.load(ID, 2).metadata()).containsEntry("floor", "3");
    assertThat(repository.load(ID, 3).metadata()).containsEntry("floor", "4");
    assertThatThrownBy(() -> repository.load(ID, 4))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("has no version 4");
    assertThatThrownBy(() -> repository.load(ID, 0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void save_withStaleVersion_shouldConflict() {
    LocationRepository repository = new LocationFixture().repository();
    repository.save(ID, 0, defined());
    repository.save(ID, 1, metadata("a", "1", 1));

    assertThatThrownBy(() -> repository.save(ID, 1, metadata("b", "2", 2)))
        .isInstanceOf(VersionConflictException.class);
  }

  @Test
  void save_eventOfAnotherLocation_shouldBeRejected() {
    LocationRepository repository = new LocationFixture().repository();
    LocationId other = LocationId.generate();

    assertThatThrownBy(() -> repository.save(other, 0, defined()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void snapshots_shouldNotChangeLoadedState() {
    LocationProperties properties = new LocationProperties();
    properties.setSnapshotFrequency(2);
    InMemorySnapshotStore snapshotStore = new InMemorySnapshotStore();
    LocationFixture fixture =
        new LocationFixture(new InMemoryEventLogStore(), snapshotStore, properties);
    LocationRepository repository = fixture.repository();

    repository.save(ID, 0, defined());
    for (int i = 1; i <= 4; i++) {
      repository.save(ID, i, metadata("k" + i, "v" + i, i));
    }

    assertThat(snapshotStore.count(ID)).isEqualTo(2);
    Location fromSnapshot = repository.load(ID);
    Location fromReplay = fixture.rehydrator().replay(ID, Long.MAX_VALUE).orElseThrow();
    assertThat(fromSnapshot).isEqualTo(fromReplay);
    assertThat(fromSnapshot.version()).isEqualTo(5);
    assertThat(repository.load(ID, 3)).isEqualTo(fixture.rehydrator().replay(ID, 3).orElseThrow());
  }

  @Test
  void brokenSnapshotStore_shouldFallBackToReplay() {
    LocationProperties properties = new LocationProperties();
    properties.setSnapshotFrequency(1);
    SnapshotStore snapshotStore = mock(SnapshotStore.class);
    when(snapshotStore.getLatest(any(), anyLong()))
        .thenThrow(new IllegalStateException("corrupt snapshot"));
    doThrow(new IllegalStateException("disk full")).when(snapshotStore).put(any());
    LocationRepository repository =
        new LocationFixture(new InMemoryEventLogStore(), snapshotStore, properties).repository();

    repository.save(ID, 0, defined());
    repository.save(ID, 1, metadata("floor", "3", 1));

    assertThat(repository.load(ID).version()).isEqualTo(2);
  }

  @Test
  void unavailableSnapshotStore_shouldFallBackToReplay() {
    // Given
    SnapshotStore snapshotStore = mock(SnapshotStore.class);
    when(snapshotStore.getLatest(any(), anyLong()))
        .thenThrow(new StoreUnavailableException("snapshot db down"));
    InMemoryEventLogStore eventLogStore = new InMemoryEventLogStore();
    LocationRepository repository =
        new LocationFixture(eventLogStore, snapshotStore, new LocationProperties()).repository();
    repository.save(ID, 0, defined());

    // When
    Location state = repository.load(ID);

    // Then
    assertThat(state.version()).isEqualTo(1);
    assertThat(state.name()).isEqualTo("Depot");
    verify(snapshotStore, times(1)).getLatest(any(), anyLong());
  }

  @Test
  void save_shouldRetryWhileStoreIsUnavailable() {
    EventLogStore eventLogStore = mock(EventLogStore.class);
    when(eventLogStore.append(eq(ID), eq(0L), any(StoredEvent.class)))
        .thenThrow(new StoreUnavailableException("connection reset"))
        .thenThrow(new StoreUnavailableException("connection reset"))
        .thenReturn(1L);
    LocationRepository repository = new LocationFixture(eventLogStore,
        new InMemorySnapshotStore(), new LocationProperties()).repository();

    assertThat(repository.save(ID, 0, defined())).isEqualTo(1);
    verify(eventLogStore, times(3)).append(eq(ID), eq(0L), any(StoredEvent.class));
  }

  @Test
  void save_interruptedDuringBackoff_shouldCompleteAppendAndKeepInterruptFlag() {
    // Given
    EventLogStore eventLogStore = mock(EventLogStore.class);
    when(eventLogStore.append(eq(ID), eq(0L), any(StoredEvent.class)))
        .thenAnswer(invocation -> {
          Thread.currentThread().interrupt();
          throw new StoreUnavailableException("connection reset");
        })
        .thenReturn(1L);
    LocationRepository repository = new LocationFixture(eventLogStore,
        new InMemorySnapshotStore(), new LocationProperties()).repository();

    try {
      // When
      long version = repository.save(ID, 0, defined());

      // Then
      assertThat(version).isEqualTo(1);
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
      verify(eventLogStore, times(2)).append(eq(ID), eq(0L), any(StoredEvent.class));
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  void save_whenStoreStaysUnavailable_shouldGiveUp() {
    EventLogStore eventLogStore = mock(EventLogStore.class);
    when(eventLogStore.append(eq(ID), eq(0L), any(StoredEvent.class)))
        .thenThrow(new StoreUnavailableException("connection refused"));
    LocationRepository repository = new LocationFixture(eventLogStore,
        new InMemorySnapshotStore(), new LocationProperties()).repository();

    assertThatThrownBy(() -> repository.save(ID, 0, defined()))
        .isInstanceOf(StoreUnavailableException.class);
    verify(eventLogStore, times(3)).append(eq(ID), eq(0L), any(StoredEvent.class));
  }

  @Test
  void save_shouldNotRetryVersionConflicts() {
    EventLogStore eventLogStore = mock(EventLogStore.class);
    when(eventLogStore.append(eq(ID), eq(0L), any(StoredEvent.class)))
        .thenThrow(new VersionConflictException(ID, 0, 1));
    LocationRepository repository = new LocationFixture(eventLogStore,
        new InMemorySnapshotStore(), new LocationProperties()).repository();

    assertThatThrownBy(() -> repository.save(ID, 0, defined()))
        .isInstanceOf(VersionConflictException.class);
    verify(eventLogStore, times(1)).append(eq(ID), eq(0L), any(StoredEvent.class));
  }

  @Test
  void history_shouldListEventsWithVersions() {
    LocationRepository repository = new LocationFixture().repository();
    LocationId parent = LocationId.generate();
    repository.save(ID, 0, defined());
    repository.save(ID, 1, new ParentLocationSetEvent(ID, parent, null, "move", T0));

    List<HistoryEntry> history = repository.history(ID);

    assertThat(history).extracting(HistoryEntry::version).containsExactly(1L, 2L);
    assertThat(history.get(0).event()).isInstanceOf(LocationDefinedEvent.class);
    assertThat(history.get(1).event()).isInstanceOf(ParentLocationSetEvent.class);
    assertThat(history.get(1).schemaVersion()).isEqualTo(1);
    assertThatThrownBy(() -> repository.history(LocationId.generate()))
        .isInstanceOf(LocationNotFoundException.class);
  }

  private static LocationDefinedEvent defined() {
    return new LocationDefinedEvent(ID, "Depot", LocationType.LOGICAL, null, null, null, T0);
  }

  private static LocationMetadataAddedEvent metadata(String key, String value, int offset) {
    return new LocationMetadataAddedEvent(ID, key, value, T0.plusSeconds(offset));
  }
}
