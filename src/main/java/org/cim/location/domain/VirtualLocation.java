package org.cim.location.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;
import java.util.Objects;

/**
 * Online presence of a virtual or hybrid location, such as a meeting room or a website.
 *
 * @param platform hosting platform, e.g. "zoom" or "web"
 * @param platformId identifier of the location on that platform
 * @param url optional absolute URL
 * @param platformData free-form platform attributes
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VirtualLocation(
    String platform,
    String platformId,
    String url,
    Map<String, String> platformData) {

  /**
   * Creates a new VirtualLocation with validation.
   *
   * @throws IllegalArgumentException if platform or platformId is blank or the url is invalid
   */
  public VirtualLocation {
    Objects.requireNonNull(platform, "Platform cannot be null");
    Objects.requireNonNull(platformId, "Platform id cannot be null");
    if (platform.isBlank()) {
      throw new IllegalArgumentException("Platform cannot be blank");
    }
    if (platformId.isBlank()) {
      throw new IllegalArgumentException("Platform id cannot be blank");
    }
    if (url != null) {
      validateUrl(url);
    }
    platformData = platformData == null ? Map.of() : Map.copyOf(platformData);
  }

  /**
   * Creates a VirtualLocation without platform data.
   *
   * @param platform hosting platform
   * @param platformId identifier on the platform
   * @param url optional absolute URL
   */
  public VirtualLocation(String platform, String platformId, String url) {
    this(platform, platformId, url, Map.of());
  }

  private static void validateUrl(String url) {
    try {
      URI uri = new URI(url);
      if (!uri.isAbsolute()) {
        throw new IllegalArgumentException("URL must be absolute: " + url);
      }
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Invalid URL: " + url, e);
    }
  }
}
