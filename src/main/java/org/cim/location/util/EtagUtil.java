package org.cim.location.util;

/**
 * Utility class for HTTP ETags on location resources.
 * <p>
 * The ETag of a location is its version. Clients send it back in {@code If-Match} to pin
 * the version a change was decided against.
 * </p>
 */
public final class EtagUtil {

  private EtagUtil() {
    // Utility class - prevent instantiation
  }

  /**
   * Creates a strong ETag from a version.
   *
   * @param version the location version
   * @return the strong ETag value (e.g., "7")
   */
  public static String createStrongEtag(long version) {
    return "\"" + version + "\"";
  }

  /**
   * Parses the version from an If-Match value.
   * <p>
   * Removes surrounding quotes and a weak prefix if present. Returns null if the input is null,
   * blank or {@code *}.
   * </p>
   *
   * @param etag the ETag value to parse
   * @return the version, or null if no version is pinned
   * @throws IllegalArgumentException if the value is not a version
   */
  public static Long parseVersion(String etag) {
    if (etag == null || etag.isBlank() || "*".equals(etag.trim())) {
      return null;
    }
    String value = etag.trim();
    if (value.startsWith("W/")) {
      value = value.substring(2);
    }
    value = value.replaceAll("^\"|\"$", "");
    try {
      long version = Long.parseLong(value);
      if (version < 0) {
        throw new IllegalArgumentException("Invalid ETag: " + etag);
      }
      return version;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid ETag: " + etag, e);
    }
  }
}
