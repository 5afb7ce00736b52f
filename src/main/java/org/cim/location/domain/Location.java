package org.cim.location.domain;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Current state of a Location aggregate, derived by folding its events through
 * {@link LocationTransitions#apply(Location, org.cim.location.event.LocationEvent)}.
 * Instances are immutable; every transition returns a new value.
 *
 * @param id the aggregate id
 * @param version number of events applied so far
 * @param name display name
 * @param profile type-specific attributes
 * @param parentId optional parent location (weak reference)
 * @param metadata free-form key/value attributes
 * @param archived whether the location has reached its terminal state
 * @param createdAt timestamp of the defining event
 * @param updatedAt timestamp of the latest event
 */
public record Location(
    LocationId id,
    long version,
    String name,
    LocationProfile profile,
    LocationId parentId,
    Map<String, String> metadata,
    boolean archived,
    Instant createdAt,
    Instant updatedAt) {

  /**
   * Creates a new Location with validation.
   *
   * @throws IllegalArgumentException if the name is blank or the version is not positive
   */
  public Location {
    Objects.requireNonNull(id, "Location id cannot be null");
    Objects.requireNonNull(name, "Name cannot be null");
    Objects.requireNonNull(profile, "Profile cannot be null");
    Objects.requireNonNull(createdAt, "Created timestamp cannot be null");
    Objects.requireNonNull(updatedAt, "Updated timestamp cannot be null");
    if (name.isBlank()) {
      throw new IllegalArgumentException("Name cannot be blank");
    }
    if (version < 1) {
      throw new IllegalArgumentException("Version must be >= 1");
    }
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  public LocationType locationType() {
    return profile.type();
  }

  /**
   * Returns the address, present only for physical and hybrid locations.
   *
   * @return the address if set
   */
  public Optional<Address> address() {
    if (profile instanceof LocationProfile.Physical physical) {
      return Optional.of(physical.address());
    }
    if (profile instanceof LocationProfile.Hybrid hybrid) {
      return Optional.ofNullable(hybrid.address());
    }
    return Optional.empty();
  }

  /**
   * Returns the coordinates, never present for virtual locations.
   *
   * @return the coordinates if set
   */
  public Optional<GeoCoordinates> coordinates() {
    if (profile instanceof LocationProfile.Physical physical) {
      return Optional.ofNullable(physical.coordinates());
    }
    if (profile instanceof LocationProfile.Logical logical) {
      return Optional.ofNullable(logical.coordinates());
    }
    if (profile instanceof LocationProfile.Hybrid hybrid) {
      return Optional.ofNullable(hybrid.coordinates());
    }
    return Optional.empty();
  }

  /**
   * Returns the virtual location, present only for virtual and hybrid locations.
   *
   * @return the virtual location if set
   */
  public Optional<VirtualLocation> virtualLocation() {
    if (profile instanceof LocationProfile.Virtual virtual) {
      return Optional.of(virtual.virtualLocation());
    }
    if (profile instanceof LocationProfile.Hybrid hybrid) {
      return Optional.ofNullable(hybrid.virtualLocation());
    }
    return Optional.empty();
  }

  public Optional<LocationId> parent() {
    return Optional.ofNullable(parentId);
  }
}
