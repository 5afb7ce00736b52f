package org.cim.location.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A point on the earth's surface.
 *
 * @param latitude degrees in [-90, 90]
 * @param longitude degrees in [-180, 180]
 * @param altitude optional altitude in metres
 * @param coordinateSystem reference system, WGS84 when not given
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GeoCoordinates(
    double latitude,
    double longitude,
    Double altitude,
    String coordinateSystem) {

  public static final String WGS84 = "WGS84";

  private static final double EARTH_RADIUS_M = 6_371_000.0;

  /**
   * Creates new GeoCoordinates with range validation.
   *
   * @throws IllegalArgumentException if latitude or longitude is out of range
   */
  public GeoCoordinates {
    if (Double.isNaN(latitude) || latitude < -90.0 || latitude > 90.0) {
      throw new IllegalArgumentException(
          "Latitude " + latitude + " is out of range [-90, 90]");
    }
    if (Double.isNaN(longitude) || longitude < -180.0 || longitude > 180.0) {
      throw new IllegalArgumentException(
          "Longitude " + longitude + " is out of range [-180, 180]");
    }
    if (altitude != null && (altitude.isNaN() || altitude.isInfinite())) {
      throw new IllegalArgumentException("Altitude must be a finite number");
    }
    if (coordinateSystem == null || coordinateSystem.isBlank()) {
      coordinateSystem = WGS84;
    }
  }

  /**
   * Creates WGS84 coordinates without altitude.
   *
   * @param latitude degrees in [-90, 90]
   * @param longitude degrees in [-180, 180]
   */
  public GeoCoordinates(double latitude, double longitude) {
    this(latitude, longitude, null, WGS84);
  }

  /**
   * Great-circle distance to another point using the haversine formula.
   *
   * @param other the other point
   * @return distance in metres
   */
  public double distanceTo(GeoCoordinates other) {
    double lat1 = Math.toRadians(latitude);
    double lat2 = Math.toRadians(other.latitude);
    double deltaLat = Math.toRadians(other.latitude - latitude);
    double deltaLon = Math.toRadians(other.longitude - longitude);

    double a = Math.pow(Math.sin(deltaLat / 2), 2)
        + Math.cos(lat1) * Math.cos(lat2) * Math.pow(Math.sin(deltaLon / 2), 2);
    double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    return EARTH_RADIUS_M * c;
  }

  /**
   * Initial bearing towards another point.
   *
   * @param other the other point
   * @return bearing in degrees, normalized to [0, 360)
   */
  public double bearingTo(GeoCoordinates other) {
    double lat1 = Math.toRadians(latitude);
    double lat2 = Math.toRadians(other.latitude);
    double deltaLon = Math.toRadians(other.longitude - longitude);

    double x = Math.sin(deltaLon) * Math.cos(lat2);
    double y = Math.cos(lat1) * Math.sin(lat2)
        - Math.sin(lat1) * Math.cos(lat2) * Math.cos(deltaLon);
    double bearing = Math.toDegrees(Math.atan2(x, y));
    return (bearing + 360.0) % 360.0;
  }
}
