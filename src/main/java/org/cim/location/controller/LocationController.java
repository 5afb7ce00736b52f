package org.cim.location.controller;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.headers.Header;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.cim.location.command.AddLocationMetadataCommand;
import org.cim.location.command.ArchiveLocationCommand;
import org.cim.location.command.CommandResult;
import org.cim.location.command.DefineLocationCommand;
import org.cim.location.command.LocationCommandDispatcher;
import org.cim.location.command.RemoveParentLocationCommand;
import org.cim.location.command.SetParentLocationCommand;
import org.cim.location.command.UpdateLocationCommand;
import org.cim.location.domain.Location;
import org.cim.location.domain.LocationId;
import org.cim.location.domain.LocationType;
import org.cim.location.dto.CommandResponse;
import org.cim.location.dto.DefineLocationRequest;
import org.cim.location.dto.HistoryResponse;
import org.cim.location.dto.LocationListResponse;
import org.cim.location.dto.LocationResponse;
import org.cim.location.dto.LocationStatisticsResponse;
import org.cim.location.dto.MetadataRequest;
import org.cim.location.dto.ReasonRequest;
import org.cim.location.dto.SetParentRequest;
import org.cim.location.dto.UpdateLocationRequest;
import org.cim.location.service.LocationPage;
import org.cim.location.service.LocationQueryService;
import org.cim.location.service.LocationSearchCriteria;
import org.cim.location.util.EtagUtil;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

/**
 * Location lifecycle endpoints.
 * Every write answers with the new version as a strong ETag; sending it back in
 * {@code If-Match} makes the write fail with 409 instead of being retried on a conflict.
 */
@RestController
@RequestMapping("/locations")
@Tag(name = "Locations", description = "Location lifecycle operations")
public class LocationController {

  private static final String PROBLEM_JSON = "application/problem+json";
  private static final int MAX_LIMIT = 1000;

  private final LocationCommandDispatcher dispatcher;
  private final LocationQueryService queryService;

  /**
   * Constructor for LocationController.
   *
   * @param dispatcher the command dispatcher
   * @param queryService the query service
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Spring-managed beans are intentionally shared references"
  )
  public LocationController(
      LocationCommandDispatcher dispatcher,
      LocationQueryService queryService) {
    this.dispatcher = dispatcher;
    this.queryService = queryService;
  }

  /**
   * Define a new location.
   *
   * @param request the definition
   * @return the appended event
   */
  @PostMapping(
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE
  )
  @Operation(summary = "Define location", description = "Create a new location at version 1")
  @ApiResponse(
      responseCode = "201",
      description = "Location defined",
      headers = {
          @Header(name = "Location", description = "URL of the new location",
              schema = @Schema(type = "string")),
          @Header(name = "ETag", description = "Version of the location",
              schema = @Schema(type = "string"))
      },
      content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE)
  )
  @ApiResponse(
      responseCode = "400",
      description = "Invalid request or field not allowed for the location type",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  @ApiResponse(
      responseCode = "409",
      description = "Location already exists",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  public ResponseEntity<CommandResponse> defineLocation(
      @Valid @RequestBody DefineLocationRequest request) {
    LocationId id = request.id() != null ? LocationId.of(request.id()) : LocationId.generate();

    CommandResult result = dispatcher.dispatch(new DefineLocationCommand(
        id,
        request.name(),
        request.locationType(),
        request.address(),
        request.coordinates(),
        request.virtualLocation()));

    URI location = ServletUriComponentsBuilder
        .fromCurrentRequest()
        .path("/{id}")
        .buildAndExpand(id.toString())
        .toUri();

    return ResponseEntity
        .created(location)
        .eTag(EtagUtil.createStrongEtag(result.version()))
        .body(CommandResponse.from(result));
  }

  /**
   * Search locations with pagination.
   *
   * @param name case-insensitive name substring
   * @param type location type
   * @param parentId direct parent id
   * @param metadata required metadata entries as {@code key:value}
   * @param includeArchived whether archived locations are returned
   * @param limit maximum number of results
   * @param offset number of results to skip
   * @return one page of matching locations
   */
  @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Search locations",
      description = "Filter by name, type, parent and metadata; ordered by name")
  @ApiResponse(
      responseCode = "200",
      description = "Matching locations",
      headers = @Header(
          name = "Link",
          description = "RFC 5988 pagination link (next page when available)",
          schema = @Schema(type = "string")
      )
  )
  @ApiResponse(
      responseCode = "400",
      description = "Invalid filter or pagination parameters",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  public ResponseEntity<LocationListResponse> searchLocations(
      @Parameter(description = "Name contains (case-insensitive)", example = "depot")
      @RequestParam(required = false) String name,
      @Parameter(description = "Location type", example = "PHYSICAL")
      @RequestParam(required = false) String type,
      @Parameter(description = "Direct parent id")
      @RequestParam(required = false) String parentId,
      @Parameter(description = "Metadata filter, repeatable", example = "region:EU")
      @RequestParam(required = false) List<String> metadata,
      @Parameter(description = "Include archived locations", example = "false")
      @RequestParam(defaultValue = "false") boolean includeArchived,
      @Parameter(description = "Maximum number of results (max 1000)", example = "100")
      @RequestParam(defaultValue = "100") int limit,
      @Parameter(description = "Offset for pagination", example = "0")
      @RequestParam(defaultValue = "0") int offset
  ) {
    if (limit < 1 || limit > MAX_LIMIT) {
      throw new IllegalArgumentException("Limit must be between 1 and " + MAX_LIMIT);
    }
    LocationSearchCriteria criteria = new LocationSearchCriteria(
        name,
        type == null ? null : parseType(type),
        parentId == null ? null : LocationId.of(parentId),
        parseMetadataFilters(metadata),
        includeArchived,
        offset,
        limit);
    LocationPage page = queryService.findLocations(criteria);

    HttpHeaders headers = new HttpHeaders();
    if (page.hasMore()) {
      String next = ServletUriComponentsBuilder.fromCurrentRequest()
          .replaceQueryParam("offset", offset + limit)
          .replaceQueryParam("limit", limit)
          .toUriString();
      headers.add("Link", String.format("<%s>; rel=\"next\"", next));
    }
    return ResponseEntity.ok().headers(headers).body(LocationListResponse.from(page));
  }

  /**
   * Count locations by state and type.
   *
   * @return the statistics
   */
  @GetMapping(value = "/statistics", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Location statistics",
      description = "Total, active and archived counts, active per type, with coordinates")
  @ApiResponse(responseCode = "200", description = "Statistics")
  public ResponseEntity<LocationStatisticsResponse> getStatistics() {
    return ResponseEntity.ok(LocationStatisticsResponse.from(queryService.getStatistics()));
  }

  /**
   * Get a location, optionally at a past version.
   *
   * @param id the location id
   * @param version optional version
   * @return the state
   */
  @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Get location", description = "Current state or state at a version")
  @ApiResponse(responseCode = "200", description = "Location state")
  @ApiResponse(
      responseCode = "404",
      description = "Location not found",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  public ResponseEntity<LocationResponse> getLocation(
      @Parameter(description = "Location id", required = true)
      @PathVariable String id,
      @Parameter(description = "Version to read (defaults to current)", example = "3")
      @RequestParam(required = false) Long version
  ) {
    LocationId locationId = LocationId.of(id);
    Location location = version == null
        ? queryService.getLocation(locationId)
        : queryService.getLocationAt(locationId, version);
    return ResponseEntity.ok()
        .eTag(EtagUtil.createStrongEtag(location.version()))
        .body(LocationResponse.from(location));
  }

  /**
   * Update the descriptive fields of a location.
   *
   * @param id the location id
   * @param request the changes
   * @param ifMatch optional expected version
   * @return the appended event
   */
  @PatchMapping(
      value = "/{id}",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE
  )
  @Operation(summary = "Update location", description = "Change name, address, "
      + "coordinates or virtual location")
  @ApiResponse(responseCode = "200", description = "Location updated")
  @ApiResponse(
      responseCode = "409",
      description = "Version conflict or location archived",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  @ApiResponse(
      responseCode = "422",
      description = "Update changes nothing",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  public ResponseEntity<CommandResponse> updateLocation(
      @PathVariable String id,
      @RequestBody UpdateLocationRequest request,
      @RequestHeader(value = HttpHeaders.IF_MATCH, required = false) String ifMatch
  ) {
    return accepted(dispatcher.dispatch(new UpdateLocationCommand(
        LocationId.of(id), request.toPatch(), request.reason(),
        EtagUtil.parseVersion(ifMatch))));
  }

  /**
   * Set the parent of a location.
   *
   * @param id the child id
   * @param request the parent
   * @param ifMatch optional expected version
   * @return the appended event
   */
  @PutMapping(
      value = "/{id}/parent",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE
  )
  @Operation(summary = "Set parent", description = "Attach a location below another; "
      + "rejected if it would create a cycle")
  @ApiResponse(responseCode = "200", description = "Parent set")
  @ApiResponse(
      responseCode = "404",
      description = "Location or parent not found",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  @ApiResponse(
      responseCode = "409",
      description = "Version conflict, or cycle closed by a concurrent change and reverted",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  @ApiResponse(
      responseCode = "422",
      description = "Cycle detected or hierarchy too deep",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  public ResponseEntity<CommandResponse> setParent(
      @PathVariable String id,
      @Valid @RequestBody SetParentRequest request,
      @RequestHeader(value = HttpHeaders.IF_MATCH, required = false) String ifMatch
  ) {
    return accepted(dispatcher.dispatch(new SetParentLocationCommand(
        LocationId.of(id), LocationId.of(request.parentId()), request.reason(),
        EtagUtil.parseVersion(ifMatch))));
  }

  /**
   * Remove the parent of a location.
   *
   * @param id the child id
   * @param reason optional reason
   * @param ifMatch optional expected version
   * @return the appended event
   */
  @DeleteMapping(value = "/{id}/parent", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Remove parent", description = "Make a location a root")
  @ApiResponse(responseCode = "200", description = "Parent removed")
  @ApiResponse(
      responseCode = "422",
      description = "Location has no parent",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  public ResponseEntity<CommandResponse> removeParent(
      @PathVariable String id,
      @RequestParam(required = false) String reason,
      @RequestHeader(value = HttpHeaders.IF_MATCH, required = false) String ifMatch
  ) {
    return accepted(dispatcher.dispatch(new RemoveParentLocationCommand(
        LocationId.of(id), reason, EtagUtil.parseVersion(ifMatch))));
  }

  /**
   * Add or overwrite a metadata entry.
   *
   * @param id the location id
   * @param key the metadata key
   * @param request the value
   * @param ifMatch optional expected version
   * @return the appended event
   */
  @PutMapping(
      value = "/{id}/metadata/{key}",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE
  )
  @Operation(summary = "Set metadata", description = "Add or overwrite one metadata entry")
  @ApiResponse(responseCode = "200", description = "Metadata stored")
  public ResponseEntity<CommandResponse> addMetadata(
      @PathVariable String id,
      @PathVariable String key,
      @Valid @RequestBody MetadataRequest request,
      @RequestHeader(value = HttpHeaders.IF_MATCH, required = false) String ifMatch
  ) {
    return accepted(dispatcher.dispatch(new AddLocationMetadataCommand(
        LocationId.of(id), key, request.value(), EtagUtil.parseVersion(ifMatch))));
  }

  /**
   * Archive a location.
   *
   * @param id the location id
   * @param request optional reason
   * @param ifMatch optional expected version
   * @return the appended event
   */
  @PostMapping(value = "/{id}/archive", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Archive location", description = "Move a location to its terminal "
      + "state; no further changes are accepted")
  @ApiResponse(responseCode = "200", description = "Location archived")
  @ApiResponse(
      responseCode = "409",
      description = "Already archived or version conflict",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  public ResponseEntity<CommandResponse> archiveLocation(
      @PathVariable String id,
      @RequestBody(required = false) ReasonRequest request,
      @RequestHeader(value = HttpHeaders.IF_MATCH, required = false) String ifMatch
  ) {
    String reason = request != null ? request.reason() : null;
    return accepted(dispatcher.dispatch(new ArchiveLocationCommand(
        LocationId.of(id), reason, EtagUtil.parseVersion(ifMatch))));
  }

  /**
   * Get the event history of a location.
   *
   * @param id the location id
   * @return all events, oldest first
   */
  @GetMapping(value = "/{id}/history", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Location history", description = "All events of a location")
  @ApiResponse(responseCode = "200", description = "Event history")
  @ApiResponse(
      responseCode = "404",
      description = "Location not found",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  public ResponseEntity<HistoryResponse> getHistory(@PathVariable String id) {
    LocationId locationId = LocationId.of(id);
    return ResponseEntity.ok(HistoryResponse.from(id, queryService.getHistory(locationId)));
  }

  private static ResponseEntity<CommandResponse> accepted(CommandResult result) {
    return ResponseEntity.ok()
        .eTag(EtagUtil.createStrongEtag(result.version()))
        .body(CommandResponse.from(result));
  }

  private static LocationType parseType(String type) {
    try {
      return LocationType.valueOf(type.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown location type: " + type, e);
    }
  }

  private static Map<String, String> parseMetadataFilters(List<String> filters) {
    Map<String, String> parsed = new LinkedHashMap<>();
    if (filters == null) {
      return parsed;
    }
    for (String filter : filters) {
      int separator = filter.indexOf(':');
      if (separator < 1) {
        throw new IllegalArgumentException(
            "Metadata filter must have the form key:value, got: " + filter);
      }
      parsed.put(filter.substring(0, separator), filter.substring(separator + 1));
    }
    return parsed;
  }
}
