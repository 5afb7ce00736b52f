package org.cim.location.domain;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.cim.location.event.LocationArchivedEvent;
import org.cim.location.event.LocationDefinedEvent;
import org.cim.location.event.LocationEvent;
import org.cim.location.event.LocationMetadataAddedEvent;
import org.cim.location.event.LocationUpdatedEvent;
import org.cim.location.event.ParentLocationRemovedEvent;
import org.cim.location.event.ParentLocationSetEvent;
import org.cim.location.exception.AlreadyArchivedException;
import org.cim.location.exception.CycleDetectedException;
import org.cim.location.exception.NoOpRejectedException;
import org.cim.location.exception.OutOfSequenceException;
import org.cim.location.exception.TerminalStateViolationException;

/**
 * The Location state transition function.
 *
 * <p>{@link #apply(Location, LocationEvent)} is pure: it never performs I/O, never mutates its
 * input and returns the same result for the same arguments. Rules that need other aggregates,
 * such as cycle detection beyond self-parenting, live in the hierarchy guard instead.
 */
public final class LocationTransitions {

  private LocationTransitions() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Applies one event to a state.
   *
   * @param state the current state, or null before the defining event
   * @param event the event to apply
   * @return the next state, with version incremented by one
   * @throws OutOfSequenceException if the event cannot follow the given state
   * @throws TerminalStateViolationException if the state is archived
   * @throws AlreadyArchivedException if an archived state is archived again
   * @throws org.cim.location.exception.InvalidFieldForTypeException if a field does not fit
   *     the location type
   * @throws NoOpRejectedException if the event would not change anything
   * @throws CycleDetectedException if a location is made its own parent
   */
  public static Location apply(Location state, LocationEvent event) {
    Objects.requireNonNull(event, "Event cannot be null");

    if (state == null) {
      if (event instanceof LocationDefinedEvent defined) {
        return define(defined);
      }
      throw new OutOfSequenceException(event.typeName()
          + " cannot be the first event of location " + event.locationId());
    }

    if (!state.id().equals(event.locationId())) {
      throw new OutOfSequenceException("Event for location " + event.locationId()
          + " cannot be applied to location " + state.id());
    }

    if (state.archived()) {
      if (event instanceof LocationArchivedEvent) {
        throw new AlreadyArchivedException("Location " + state.id() + " is already archived");
      }
      throw new TerminalStateViolationException("Location " + state.id()
          + " is archived and cannot accept " + event.typeName());
    }

    if (event instanceof LocationDefinedEvent) {
      throw new OutOfSequenceException("Location " + state.id() + " is already defined");
    }
    if (event instanceof LocationUpdatedEvent updated) {
      return update(state, updated);
    }
    if (event instanceof ParentLocationSetEvent parentSet) {
      return setParent(state, parentSet);
    }
    if (event instanceof ParentLocationRemovedEvent parentRemoved) {
      return removeParent(state, parentRemoved);
    }
    if (event instanceof LocationMetadataAddedEvent metadataAdded) {
      return addMetadata(state, metadataAdded);
    }
    if (event instanceof LocationArchivedEvent archived) {
      return next(state, state.name(), state.profile(), state.parentId(), state.metadata(),
          true, archived);
    }
    throw new IllegalStateException("Unhandled event type: " + event.getClass().getName());
  }

  /**
   * Folds an ordered event list from the empty state.
   *
   * @param events events in version order, starting with the defining event
   * @return the resulting state
   * @throws OutOfSequenceException if the list is empty or does not start with LocationDefined
   */
  public static Location replay(List<? extends LocationEvent> events) {
    if (events.isEmpty()) {
      throw new OutOfSequenceException("Cannot replay an empty event list");
    }
    return replay(null, events);
  }

  /**
   * Folds an ordered event list onto a starting state.
   *
   * @param from the starting state, or null for the empty state
   * @param events events following {@code from} in version order
   * @return the resulting state ({@code from} itself when events is empty)
   */
  public static Location replay(Location from, List<? extends LocationEvent> events) {
    Location state = from;
    for (LocationEvent event : events) {
      state = apply(state, event);
    }
    return state;
  }

  private static Location define(LocationDefinedEvent event) {
    LocationProfile profile = LocationProfile.of(event.locationType(), event.address(),
        event.coordinates(), event.virtualLocation());
    return new Location(event.locationId(), 1L, event.name(), profile, null, Map.of(), false,
        event.occurredAt(), event.occurredAt());
  }

  private static Location update(Location state, LocationUpdatedEvent event) {
    LocationPatch patch = event.patch();
    if (patch.isEmpty()) {
      throw new NoOpRejectedException("Update for location " + state.id()
          + " contains no changes");
    }

    String name = patch.name() != null ? patch.name() : state.name();
    LocationProfile profile = LocationProfile.of(
        state.locationType(),
        patch.address() != null ? patch.address() : state.address().orElse(null),
        patch.coordinates() != null ? patch.coordinates() : state.coordinates().orElse(null),
        patch.virtualLocation() != null
            ? patch.virtualLocation()
            : state.virtualLocation().orElse(null));

    if (name.equals(state.name()) && profile.equals(state.profile())) {
      throw new NoOpRejectedException("Update for location " + state.id()
          + " does not change any value");
    }
    return next(state, name, profile, state.parentId(), state.metadata(), false, event);
  }

  private static Location setParent(Location state, ParentLocationSetEvent event) {
    if (event.parentId().equals(state.id())) {
      throw new CycleDetectedException(state.id());
    }
    if (event.parentId().equals(state.parentId())) {
      throw new NoOpRejectedException("Location " + state.id() + " already has parent "
          + event.parentId());
    }
    return next(state, state.name(), state.profile(), event.parentId(), state.metadata(), false,
        event);
  }

  private static Location removeParent(Location state, ParentLocationRemovedEvent event) {
    if (state.parentId() == null) {
      throw new NoOpRejectedException("Location " + state.id() + " has no parent to remove");
    }
    return next(state, state.name(), state.profile(), null, state.metadata(), false, event);
  }

  private static Location addMetadata(Location state, LocationMetadataAddedEvent event) {
    Map<String, String> metadata = new HashMap<>(state.metadata());
    metadata.put(event.key(), event.value());
    return next(state, state.name(), state.profile(), state.parentId(), metadata, false, event);
  }

  private static Location next(Location state, String name, LocationProfile profile,
      LocationId parentId, Map<String, String> metadata, boolean archived, LocationEvent event) {
    return new Location(state.id(), state.version() + 1, name, profile, parentId, metadata,
        archived, state.createdAt(), event.occurredAt());
  }
}
