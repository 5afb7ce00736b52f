package org.cim.location.controller;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import org.cim.location.command.LocationCommandDispatcher;
import org.cim.location.command.ReparentLocationsCommand;
import org.cim.location.domain.LocationId;
import org.cim.location.dto.CommandResponse;
import org.cim.location.dto.HierarchyNodeResponse;
import org.cim.location.dto.LocationResponse;
import org.cim.location.dto.ReparentRequest;
import org.cim.location.dto.ReparentResponse;
import org.cim.location.service.LocationQueryService;
import org.cim.location.service.ParentAssignment;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Location hierarchy endpoints.
 */
@RestController
@RequestMapping("/locations")
@Tag(name = "Hierarchy", description = "Parent/child navigation and batch reparenting")
public class HierarchyController {

  private static final String PROBLEM_JSON = "application/problem+json";

  private final LocationQueryService queryService;
  private final LocationCommandDispatcher dispatcher;

  /**
   * Constructor for HierarchyController.
   *
   * @param queryService the query service
   * @param dispatcher the command dispatcher
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Spring-managed beans are intentionally shared references"
  )
  public HierarchyController(
      LocationQueryService queryService,
      LocationCommandDispatcher dispatcher) {
    this.queryService = queryService;
    this.dispatcher = dispatcher;
  }

  /**
   * List the ancestors of a location, nearest first.
   *
   * @param id the location id
   * @return the ancestors
   */
  @GetMapping(value = "/{id}/ancestors", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "List ancestors", description = "Parent, grandparent and so on up to "
      + "the root or the maximum hierarchy depth")
  @ApiResponse(responseCode = "200", description = "Ancestors, nearest first")
  @ApiResponse(
      responseCode = "404",
      description = "Location not found",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  public List<LocationResponse> getAncestors(@PathVariable String id) {
    return queryService.findAncestors(LocationId.of(id)).stream()
        .map(LocationResponse::from)
        .toList();
  }

  /**
   * List the direct children of a location.
   *
   * @param id the location id
   * @return the children
   */
  @GetMapping(value = "/{id}/children", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "List children", description = "Direct children, ordered by name")
  @ApiResponse(responseCode = "200", description = "Children")
  @ApiResponse(
      responseCode = "404",
      description = "Location not found",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  public List<LocationResponse> getChildren(@PathVariable String id) {
    return queryService.findChildren(LocationId.of(id)).stream()
        .map(LocationResponse::from)
        .toList();
  }

  /**
   * Get the subtree below a location.
   *
   * @param id the root id
   * @param maxDepth levels to include below the root
   * @return the tree
   */
  @GetMapping(value = "/{id}/hierarchy", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Hierarchy tree", description = "The location and its descendants")
  @ApiResponse(responseCode = "200", description = "Subtree")
  @ApiResponse(
      responseCode = "404",
      description = "Location not found",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  public HierarchyNodeResponse getHierarchy(
      @PathVariable String id,
      @Parameter(description = "Levels below the root", example = "3")
      @RequestParam(required = false, defaultValue = "3") int maxDepth
  ) {
    return HierarchyNodeResponse.from(
        queryService.buildHierarchyTree(LocationId.of(id), maxDepth));
  }

  /**
   * Move several locations in one operation.
   *
   * @param request the moves
   * @return the appended events
   */
  @PostMapping(
      value = "/hierarchy/reparent",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE
  )
  @Operation(summary = "Batch reparent", description = "Validate all moves against the "
      + "resulting hierarchy, then apply them; nothing is applied if any move is rejected")
  @ApiResponse(responseCode = "200", description = "All moves applied")
  @ApiResponse(
      responseCode = "422",
      description = "The resulting hierarchy would contain a cycle",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  public ResponseEntity<ReparentResponse> reparent(@Valid @RequestBody ReparentRequest request) {
    List<ParentAssignment> assignments = request.moves().stream()
        .map(move -> new ParentAssignment(
            LocationId.of(move.locationId()),
            move.parentId() != null ? LocationId.of(move.parentId()) : null))
        .toList();

    List<CommandResponse> results = dispatcher
        .dispatch(new ReparentLocationsCommand(assignments, request.reason()))
        .stream()
        .map(CommandResponse::from)
        .toList();
    return ResponseEntity.ok(new ReparentResponse(results));
  }
}
