package org.cim.location.service;

import java.util.List;
import org.cim.location.domain.Location;

/**
 * One page of search results.
 *
 * @param locations the matches on this page, ordered by name
 * @param offset number of matches skipped
 * @param limit page size that was requested
 * @param hasMore whether further matches exist after this page
 */
public record LocationPage(List<Location> locations, int offset, int limit, boolean hasMore) {

  public LocationPage {
    locations = locations != null ? List.copyOf(locations) : List.of();
  }
}
