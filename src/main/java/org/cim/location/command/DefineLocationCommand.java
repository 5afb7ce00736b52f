package org.cim.location.command;

import java.util.Objects;
import org.cim.location.domain.Address;
import org.cim.location.domain.GeoCoordinates;
import org.cim.location.domain.LocationId;
import org.cim.location.domain.LocationType;
import org.cim.location.domain.VirtualLocation;

/**
 * Command to define a new location.
 *
 * @param locationId the id of the new location
 * @param name the location name
 * @param locationType the location type
 * @param address optional address (physical and hybrid only)
 * @param coordinates optional coordinates (not for virtual)
 * @param virtualLocation optional virtual location (virtual and hybrid only)
 */
public record DefineLocationCommand(
    LocationId locationId,
    String name,
    LocationType locationType,
    Address address,
    GeoCoordinates coordinates,
    VirtualLocation virtualLocation) implements LocationCommand {

  /**
   * Creates a new DefineLocationCommand with validation.
   *
   * @throws IllegalArgumentException if any validation fails
   */
  public DefineLocationCommand {
    Objects.requireNonNull(locationId, "Location id cannot be null");
    Objects.requireNonNull(name, "Name cannot be null");
    Objects.requireNonNull(locationType, "Location type cannot be null");

    if (name.isBlank()) {
      throw new IllegalArgumentException("Name cannot be blank");
    }
  }

  @Override
  public Long expectedVersion() {
    return null;
  }
}
