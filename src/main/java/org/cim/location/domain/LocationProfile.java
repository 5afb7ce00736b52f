package org.cim.location.domain;

import java.util.Objects;
import org.cim.location.exception.InvalidFieldForTypeException;

/**
 * The type-specific attributes of a Location.
 * Each variant holds exactly the fields its {@link LocationType} allows, so an
 * address on a virtual location or a virtual location on a physical one cannot be represented.
 */
public sealed interface LocationProfile
    permits LocationProfile.Physical,
        LocationProfile.Virtual,
        LocationProfile.Logical,
        LocationProfile.Hybrid {

  /**
   * Returns the location type this profile belongs to.
   *
   * @return the location type
   */
  LocationType type();

  /**
   * Builds the profile for a type from loose attributes, rejecting attributes the type
   * does not permit and missing ones it requires.
   *
   * @param type the location type
   * @param address optional address
   * @param coordinates optional coordinates
   * @param virtualLocation optional virtual location
   * @return the matching profile variant
   * @throws InvalidFieldForTypeException if an attribute is not allowed or a required one is absent
   */
  static LocationProfile of(LocationType type, Address address, GeoCoordinates coordinates,
      VirtualLocation virtualLocation) {
    Objects.requireNonNull(type, "Location type cannot be null");
    if (address != null && !type.canHavePhysicalAttributes()) {
      throw new InvalidFieldForTypeException("Field 'address' is not permitted for "
          + type + " locations");
    }
    if (virtualLocation != null && !type.canHaveVirtualAttributes()) {
      throw new InvalidFieldForTypeException("Field 'virtualLocation' is not permitted for "
          + type + " locations");
    }
    if (coordinates != null && !type.canHaveCoordinates()) {
      throw new InvalidFieldForTypeException("Field 'coordinates' is not permitted for "
          + type + " locations");
    }
    return switch (type) {
      case PHYSICAL -> new Physical(address, coordinates);
      case VIRTUAL -> new Virtual(virtualLocation);
      case LOGICAL -> new Logical(coordinates);
      case HYBRID -> new Hybrid(address, coordinates, virtualLocation);
    };
  }

  /**
   * A place with a postal address.
   *
   * @param address the address (required)
   * @param coordinates optional coordinates
   */
  record Physical(Address address, GeoCoordinates coordinates) implements LocationProfile {

    public Physical {
      if (address == null) {
        throw new InvalidFieldForTypeException("PHYSICAL locations require an address");
      }
    }

    @Override
    public LocationType type() {
      return LocationType.PHYSICAL;
    }
  }

  /**
   * A place that exists only online.
   *
   * @param virtualLocation the virtual location (required)
   */
  record Virtual(VirtualLocation virtualLocation) implements LocationProfile {

    public Virtual {
      if (virtualLocation == null) {
        throw new InvalidFieldForTypeException("VIRTUAL locations require a virtualLocation");
      }
    }

    @Override
    public LocationType type() {
      return LocationType.VIRTUAL;
    }
  }

  /**
   * An organizational grouping such as a region or a campus.
   *
   * @param coordinates optional representative point
   */
  record Logical(GeoCoordinates coordinates) implements LocationProfile {

    @Override
    public LocationType type() {
      return LocationType.LOGICAL;
    }
  }

  /**
   * A place with both a physical and an online presence.
   *
   * @param address optional address
   * @param coordinates optional coordinates
   * @param virtualLocation optional virtual location
   */
  record Hybrid(Address address, GeoCoordinates coordinates, VirtualLocation virtualLocation)
      implements LocationProfile {

    public Hybrid {
      if (address == null && virtualLocation == null) {
        throw new InvalidFieldForTypeException(
            "HYBRID locations require an address or a virtualLocation");
      }
    }

    @Override
    public LocationType type() {
      return LocationType.HYBRID;
    }
  }
}
