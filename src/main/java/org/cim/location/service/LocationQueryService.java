package org.cim.location.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import org.cim.location.config.LocationProperties;
import org.cim.location.domain.Location;
import org.cim.location.domain.LocationId;
import org.cim.location.domain.LocationType;
import org.cim.location.exception.LocationNotFoundException;
import org.cim.location.repository.LocationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Read-side queries over locations and their hierarchy.
 * All answers are derived from the event log through the repository; nothing is cached here.
 */
@Service
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public class LocationQueryService {
  private static final Logger logger = LoggerFactory.getLogger(LocationQueryService.class);

  private static final Comparator<Location> BY_NAME =
      Comparator.comparing(Location::name).thenComparing(location -> location.id().toString());

  private final LocationRepository repository;
  private final LocationProperties properties;

  /**
   * Constructs a LocationQueryService.
   *
   * @param repository the location repository
   * @param properties the location properties
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Repository and properties are Spring-managed beans")
  public LocationQueryService(LocationRepository repository, LocationProperties properties) {
    this.repository = repository;
    this.properties = properties;
  }

  public Location getLocation(LocationId id) {
    return repository.load(id);
  }

  public Location getLocationAt(LocationId id, long version) {
    return repository.load(id, version);
  }

  public List<HistoryEntry> getHistory(LocationId id) {
    return repository.history(id);
  }

  /**
   * Returns the ancestors of a location, nearest first.
   * The walk stops at a root, at an unknown parent, at a repeated id or after
   * {@code location.max-hierarchy-depth} steps.
   *
   * @param id the location id
   * @return the ancestors
   * @throws LocationNotFoundException if the location does not exist
   */
  public List<Location> findAncestors(LocationId id) {
    Location location = repository.load(id);
    List<Location> ancestors = new ArrayList<>();
    Set<LocationId> visited = new HashSet<>();
    visited.add(id);

    Optional<LocationId> current = location.parent();
    while (current.isPresent() && ancestors.size() < properties.getMaxHierarchyDepth()) {
      LocationId parentId = current.get();
      if (!visited.add(parentId)) {
        logger.warn("Ancestor chain of {} loops at {}", id, parentId);
        break;
      }
      Optional<Location> parent = repository.find(parentId);
      if (parent.isEmpty()) {
        logger.warn("Ancestor chain of {} references unknown location {}", id, parentId);
        break;
      }
      ancestors.add(parent.get());
      current = parent.get().parent();
    }
    return ancestors;
  }

  /**
   * Returns the direct children of a location, ordered by name.
   *
   * @param id the parent id
   * @return the children, archived ones included
   * @throws LocationNotFoundException if the location does not exist
   */
  public List<Location> findChildren(LocationId id) {
    repository.load(id);
    return allLocations()
        .filter(candidate -> id.equals(candidate.parentId()))
        .sorted(BY_NAME)
        .toList();
  }

  /**
   * Searches all locations by name, type, parent and metadata.
   * Matches are ordered by name, then id, before the page is cut.
   *
   * @param criteria the filters and page bounds
   * @return the requested page
   */
  public LocationPage findLocations(LocationSearchCriteria criteria) {
    List<Location> matches = allLocations()
        .filter(criteria::matches)
        .sorted(BY_NAME)
        .toList();
    boolean hasMore = matches.size() > criteria.offset() + criteria.limit();
    List<Location> page = matches.stream()
        .skip(criteria.offset())
        .limit(criteria.limit())
        .toList();
    logger.debug("Location search matched {} of which {} returned", matches.size(), page.size());
    return new LocationPage(page, criteria.offset(), criteria.limit(), hasMore);
  }

  /**
   * Counts locations by state and type.
   *
   * @return the statistics
   */
  public LocationStatistics getStatistics() {
    long total = 0;
    long archived = 0;
    long withCoordinates = 0;
    Map<LocationType, Long> activeByType = new EnumMap<>(LocationType.class);
    for (Location location : allLocations().toList()) {
      total++;
      if (location.archived()) {
        archived++;
      } else {
        activeByType.merge(location.locationType(), 1L, Long::sum);
      }
      if (location.coordinates().isPresent()) {
        withCoordinates++;
      }
    }
    return new LocationStatistics(total, total - archived, archived, activeByType,
        withCoordinates);
  }

  /**
   * Builds the subtree below a location.
   *
   * @param rootId the root of the subtree
   * @param maxDepth number of levels below the root to include (0 returns the root alone)
   * @return the tree
   * @throws LocationNotFoundException if the root does not exist
   */
  public HierarchyNode buildHierarchyTree(LocationId rootId, int maxDepth) {
    if (maxDepth < 0) {
      throw new IllegalArgumentException("Max depth cannot be negative");
    }
    Set<LocationId> visited = new HashSet<>();
    return buildNode(repository.load(rootId), maxDepth, visited);
  }

  private Stream<Location> allLocations() {
    return repository.allIds().stream()
        .map(repository::find)
        .flatMap(Optional::stream);
  }

  private HierarchyNode buildNode(Location location, int remainingDepth,
      Set<LocationId> visited) {
    visited.add(location.id());
    if (remainingDepth == 0) {
      return new HierarchyNode(location, List.of());
    }
    List<HierarchyNode> children = new ArrayList<>();
    for (Location child : findChildren(location.id())) {
      if (visited.contains(child.id())) {
        continue;
      }
      children.add(buildNode(child, remainingDepth - 1, visited));
    }
    return new HierarchyNode(location, children);
  }
}
