package org.cim.location.domain;

/**
 * Partial change to a location's descriptive fields. Null means "leave unchanged".
 *
 * @param name new name
 * @param address new address
 * @param coordinates new coordinates
 * @param virtualLocation new virtual location
 */
public record LocationPatch(
    String name,
    Address address,
    GeoCoordinates coordinates,
    VirtualLocation virtualLocation) {

  /**
   * Creates a new LocationPatch.
   *
   * @throws IllegalArgumentException if a name is given but blank
   */
  public LocationPatch {
    if (name != null && name.isBlank()) {
      throw new IllegalArgumentException("Name cannot be blank");
    }
  }

  /**
   * Whether the patch changes nothing at all.
   *
   * @return true if every field is null
   */
  public boolean isEmpty() {
    return name == null && address == null && coordinates == null && virtualLocation == null;
  }
}
