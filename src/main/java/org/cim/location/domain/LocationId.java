package org.cim.location.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.github.f4b6a3.uuid.UuidCreator;
import java.util.Objects;
import java.util.UUID;

/**
 * Value object identifying a Location aggregate.
 * Serialized as its plain UUID string.
 */
public record LocationId(UUID value) {

  /**
   * Creates a new LocationId.
   *
   * @param value the UUID (must be non-null)
   */
  public LocationId {
    Objects.requireNonNull(value, "LocationId value cannot be null");
  }

  /**
   * Generates a new LocationId using UUIDv7 (time-based epoch generator).
   *
   * @return a new LocationId
   */
  public static LocationId generate() {
    return new LocationId(UuidCreator.getTimeOrderedEpoch());
  }

  /**
   * Creates a LocationId from a UUID string.
   *
   * @param uuid the UUID string
   * @return a new LocationId
   * @throws IllegalArgumentException if uuid is blank or not a valid UUID
   */
  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static LocationId of(String uuid) {
    Objects.requireNonNull(uuid, "LocationId value cannot be null");
    if (uuid.isBlank()) {
      throw new IllegalArgumentException("LocationId value cannot be blank");
    }
    try {
      return new LocationId(UUID.fromString(uuid));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("LocationId value must be a valid UUID: " + uuid, e);
    }
  }

  @JsonValue
  @Override
  public String toString() {
    return value.toString();
  }
}
