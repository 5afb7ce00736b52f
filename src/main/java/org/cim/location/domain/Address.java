package org.cim.location.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Postal address of a physical location.
 *
 * @param street1 first street line
 * @param street2 optional second street line
 * @param locality city or town
 * @param region state, province or county
 * @param country country name or code
 * @param postalCode postal code
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Address(
    String street1,
    String street2,
    String locality,
    String region,
    String country,
    String postalCode) {

  /**
   * Creates a new Address with validation.
   *
   * @throws IllegalArgumentException if any mandatory part is null or blank
   */
  public Address {
    requireText(street1, "Street address");
    requireText(locality, "Locality");
    requireText(region, "Region");
    requireText(country, "Country");
    requireText(postalCode, "Postal code");
    if (street2 != null && street2.isBlank()) {
      street2 = null;
    }
  }

  /**
   * Creates an Address without a second street line.
   *
   * @param street1 first street line
   * @param locality city or town
   * @param region state, province or county
   * @param country country name or code
   * @param postalCode postal code
   */
  public Address(String street1, String locality, String region, String country,
      String postalCode) {
    this(street1, null, locality, region, country, postalCode);
  }

  /**
   * Formats the address on one line, e.g.
   * {@code "1 Main St, Springfield, IL 62701, USA"}.
   *
   * @return the single-line form
   */
  public String formatSingleLine() {
    return String.join(", ", lines());
  }

  /**
   * Formats the address one part per line.
   *
   * @return the multi-line form
   */
  public String formatMultiLine() {
    return String.join("\n", lines());
  }

  private List<String> lines() {
    List<String> lines = new ArrayList<>(4);
    lines.add(street1);
    if (street2 != null) {
      lines.add(street2);
    }
    lines.add(locality + ", " + region + " " + postalCode);
    lines.add(country);
    return lines;
  }

  private static void requireText(String value, String field) {
    Objects.requireNonNull(value, field + " cannot be null");
    if (value.isBlank()) {
      throw new IllegalArgumentException(field + " cannot be blank");
    }
  }
}
