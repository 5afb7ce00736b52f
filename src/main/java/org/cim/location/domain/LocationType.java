package org.cim.location.domain;

/**
 * The kind of place a Location describes.
 * Determines which of address, coordinates and virtual location may be set.
 */
public enum LocationType {
  PHYSICAL,
  VIRTUAL,
  LOGICAL,
  HYBRID;

  /**
   * Whether a location of this type may carry a postal address.
   *
   * @return true for physical and hybrid locations
   */
  public boolean canHavePhysicalAttributes() {
    return this == PHYSICAL || this == HYBRID;
  }

  /**
   * Whether a location of this type may carry a virtual location.
   *
   * @return true for virtual and hybrid locations
   */
  public boolean canHaveVirtualAttributes() {
    return this == VIRTUAL || this == HYBRID;
  }

  /**
   * Whether a location of this type may carry coordinates.
   *
   * @return false only for purely virtual locations
   */
  public boolean canHaveCoordinates() {
    return this != VIRTUAL;
  }
}
