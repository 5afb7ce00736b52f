package org.cim.location.command;

import java.util.Objects;
import org.cim.location.domain.LocationId;

/**
 * Command to add or overwrite one metadata entry.
 *
 * @param locationId the location id
 * @param key the metadata key
 * @param value the metadata value
 * @param expectedVersion optional expected version
 */
public record AddLocationMetadataCommand(
    LocationId locationId,
    String key,
    String value,
    Long expectedVersion) implements LocationCommand {

  /**
   * Creates a new AddLocationMetadataCommand with validation.
   *
   * @throws IllegalArgumentException if the key is blank
   */
  public AddLocationMetadataCommand {
    Objects.requireNonNull(locationId, "Location id cannot be null");
    Objects.requireNonNull(key, "Key cannot be null");
    Objects.requireNonNull(value, "Value cannot be null");

    if (key.isBlank()) {
      throw new IllegalArgumentException("Key cannot be blank");
    }
  }
}
