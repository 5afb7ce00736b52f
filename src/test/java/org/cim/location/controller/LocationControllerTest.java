package org.cim.location.controller;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.cim.location.command.AddLocationMetadataCommand;
import org.cim.location.command.ArchiveLocationCommand;
import org.cim.location.command.CommandResult;
import org.cim.location.command.DefineLocationCommand;
import org.cim.location.command.LocationCommandDispatcher;
import org.cim.location.command.RemoveParentLocationCommand;
import org.cim.location.command.SetParentLocationCommand;
import org.cim.location.command.UpdateLocationCommand;
import org.cim.location.domain.Address;
import org.cim.location.domain.Location;
import org.cim.location.domain.LocationId;
import org.cim.location.domain.LocationTransitions;
import org.cim.location.domain.LocationType;
import org.cim.location.event.LocationArchivedEvent;
import org.cim.location.event.LocationDefinedEvent;
import org.cim.location.event.LocationMetadataAddedEvent;
import org.cim.location.event.ParentLocationRemovedEvent;
import org.cim.location.exception.CycleDetectedException;
import org.cim.location.exception.LocationNotFoundException;
import org.cim.location.exception.TerminalStateViolationException;
import org.cim.location.exception.VersionConflictException;
import org.cim.location.service.HistoryEntry;
import org.cim.location.service.LocationPage;
import org.cim.location.service.LocationQueryService;
import org.cim.location.service.LocationStatistics;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Unit tests for LocationController.
 */
@WebMvcTest(LocationController.class)
@Import(SimpleMeterRegistry.class)
class LocationControllerTest {

  private static final String ID = "01933e4a-9d4e-7000-8000-000000000001";
  private static final LocationId LOCATION_ID = LocationId.of(ID);
  private static final Instant T0 = Instant.parse("2025-01-15T10:00:00Z");

  @Autowired
  private MockMvc mockMvc;

  @MockitoBean
  private LocationCommandDispatcher dispatcher;

  @MockitoBean
  private LocationQueryService queryService;

  @Test
  void defineLocation_returns201WithLocationAndEtag() throws Exception {
    LocationDefinedEvent event = new LocationDefinedEvent(LOCATION_ID, "HQ",
        LocationType.PHYSICAL, new Address("1 Main St", "Springfield", "IL", "USA", "62701"),
        null, null, T0);
    when(dispatcher.dispatch(any(DefineLocationCommand.class)))
        .thenReturn(new CommandResult(LOCATION_ID, 1, event));

    String body = """
        {
          "id": "%s",
          "name": "HQ",
          "locationType": "PHYSICAL",
          "address": {
            "street1": "1 Main St",
            "locality": "Springfield",
            "region": "IL",
            "country": "USA",
            "postalCode": "62701"
          }
        }
        """.formatted(ID);

    mockMvc.perform(post("/locations")
            .contentType(MediaType.APPLICATION_JSON)
            .content(body))
        .andExpect(status().isCreated())
        .andExpect(header().string("Location", "http://localhost/locations/" + ID))
        .andExpect(header().string("ETag", "\"1\""))
        .andExpect(jsonPath("$.locationId").value(ID))
        .andExpect(jsonPath("$.version").value(1))
        .andExpect(jsonPath("$.eventType").value("LocationDefined"));
  }

  @Test
  void defineLocation_withoutName_returns400() throws Exception {
    mockMvc.perform(post("/locations")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"locationType\":\"LOGICAL\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("invalid_argument"))
        .andExpect(jsonPath("$.title").value("Name is required"))
        .andExpect(jsonPath("$.errors[0]").value("name: Name is required"));
    verifyNoInteractions(dispatcher);
  }

  @Test
  void addMetadata_withoutValue_returns400() throws Exception {
    mockMvc.perform(put("/locations/{id}/metadata/{key}", ID, "region")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("invalid_argument"))
        .andExpect(jsonPath("$.title").value("Metadata value is required"));
    verifyNoInteractions(dispatcher);
  }

  @Test
  void defineLocation_withUnknownType_returns400() throws Exception {
    mockMvc.perform(post("/locations")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"name\":\"HQ\",\"locationType\":\"ORBITAL\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("invalid_request"));
  }

  @Test
  void searchLocations_passesFiltersAndLinksNextPage() throws Exception {
    Location depot = LocationTransitions.apply(null, new LocationDefinedEvent(LOCATION_ID,
        "Depot", LocationType.LOGICAL, null, null, null, T0));
    when(queryService.findLocations(any()))
        .thenReturn(new LocationPage(List.of(depot), 0, 1, true));

    mockMvc.perform(get("/locations")
            .param("name", "dep")
            .param("type", "logical")
            .param("metadata", "region:EU")
            .param("limit", "1"))
        .andExpect(status().isOk())
        .andExpect(header().string("Link", containsString("offset=1")))
        .andExpect(header().string("Link", containsString("rel=\"next\"")))
        .andExpect(jsonPath("$.locations[0].name").value("Depot"))
        .andExpect(jsonPath("$.pagination.limit").value(1))
        .andExpect(jsonPath("$.pagination.hasMore").value(true));

    verify(queryService).findLocations(argThat(criteria ->
        "dep".equals(criteria.namePattern())
            && criteria.locationType() == LocationType.LOGICAL
            && criteria.metadata().equals(Map.of("region", "EU"))
            && !criteria.includeArchived()
            && criteria.limit() == 1));
  }

  @Test
  void searchLocations_withMalformedMetadataFilter_returns400() throws Exception {
    mockMvc.perform(get("/locations").param("metadata", "region"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("invalid_argument"));
    mockMvc.perform(get("/locations").param("limit", "5000"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("invalid_argument"));
  }

  @Test
  void getStatistics_returnsCounts() throws Exception {
    when(queryService.getStatistics()).thenReturn(new LocationStatistics(
        5, 4, 1, Map.of(LocationType.PHYSICAL, 3L, LocationType.LOGICAL, 1L), 2));

    mockMvc.perform(get("/locations/statistics"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").value(5))
        .andExpect(jsonPath("$.active").value(4))
        .andExpect(jsonPath("$.archived").value(1))
        .andExpect(jsonPath("$.activeByType.PHYSICAL").value(3))
        .andExpect(jsonPath("$.activeByType.VIRTUAL").value(0))
        .andExpect(jsonPath("$.withCoordinates").value(2));
  }

  @Test
  void getLocation_returnsStateWithEtag() throws Exception {
    Location location = LocationTransitions.apply(null, new LocationDefinedEvent(LOCATION_ID,
        "Depot", LocationType.LOGICAL, null, null, null, T0));
    when(queryService.getLocation(LOCATION_ID)).thenReturn(location);

    mockMvc.perform(get("/locations/{id}", ID))
        .andExpect(status().isOk())
        .andExpect(header().string("ETag", "\"1\""))
        .andExpect(jsonPath("$.id").value(ID))
        .andExpect(jsonPath("$.name").value("Depot"))
        .andExpect(jsonPath("$.locationType").value("LOGICAL"))
        .andExpect(jsonPath("$.archived").value(false));
  }

  @Test
  void getLocation_whenUnknown_returns404() throws Exception {
    when(queryService.getLocation(LOCATION_ID))
        .thenThrow(new LocationNotFoundException(LOCATION_ID));

    mockMvc.perform(get("/locations/{id}", ID))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.status").value(404))
        .andExpect(jsonPath("$.code").value("location_not_found"));
  }

  @Test
  void getLocation_withMalformedId_returns400() throws Exception {
    mockMvc.perform(get("/locations/{id}", "not-a-uuid"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("invalid_argument"));
  }

  @Test
  void updateLocation_passesIfMatchAsExpectedVersion() throws Exception {
    when(dispatcher.dispatch(any(UpdateLocationCommand.class)))
        .thenThrow(new VersionConflictException(LOCATION_ID, 4, 5));

    mockMvc.perform(patch("/locations/{id}", ID)
            .contentType(MediaType.APPLICATION_JSON)
            .header("If-Match", "\"4\"")
            .content("{\"name\":\"New\"}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("version_conflict"))
        .andExpect(jsonPath("$.expectedVersion").value(4))
        .andExpect(jsonPath("$.actualVersion").value(5));

    verify(dispatcher).dispatch(argThat((UpdateLocationCommand command) ->
        Long.valueOf(4).equals(command.expectedVersion())
            && "New".equals(command.patch().name())));
  }

  @Test
  void updateArchived_returns409() throws Exception {
    when(dispatcher.dispatch(any(UpdateLocationCommand.class)))
        .thenThrow(new TerminalStateViolationException("Location is archived"));

    mockMvc.perform(patch("/locations/{id}", ID)
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"name\":\"New\"}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("terminal_state_violation"));
  }

  @Test
  void setParent_withCycle_returns422WithPath() throws Exception {
    String parent = "01933e4a-9d4e-7000-8000-000000000002";
    when(dispatcher.dispatch(any(SetParentLocationCommand.class)))
        .thenThrow(new CycleDetectedException("cycle",
            List.of(LOCATION_ID, LocationId.of(parent), LOCATION_ID)));

    mockMvc.perform(put("/locations/{id}/parent", ID)
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"parentId\":\"" + parent + "\"}"))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("cycle_detected"))
        .andExpect(jsonPath("$.path[1]").value(parent));
  }

  @Test
  void removeParent_returnsNewVersion() throws Exception {
    when(dispatcher.dispatch(any(RemoveParentLocationCommand.class)))
        .thenReturn(new CommandResult(LOCATION_ID, 3,
            new ParentLocationRemovedEvent(LOCATION_ID,
                LocationId.generate(), null, T0)));

    mockMvc.perform(delete("/locations/{id}/parent", ID))
        .andExpect(status().isOk())
        .andExpect(header().string("ETag", "\"3\""))
        .andExpect(jsonPath("$.eventType").value("ParentLocationRemoved"));
  }

  @Test
  void addMetadata_usesPathKey() throws Exception {
    when(dispatcher.dispatch(any(AddLocationMetadataCommand.class)))
        .thenReturn(new CommandResult(LOCATION_ID, 2,
            new LocationMetadataAddedEvent(LOCATION_ID, "floor", "3", T0)));

    mockMvc.perform(put("/locations/{id}/metadata/{key}", ID, "floor")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"value\":\"3\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.version").value(2));

    verify(dispatcher).dispatch(argThat((AddLocationMetadataCommand command) ->
        "floor".equals(command.key()) && "3".equals(command.value())));
  }

  @Test
  void archive_withoutBody_returns200() throws Exception {
    when(dispatcher.dispatch(any(ArchiveLocationCommand.class)))
        .thenReturn(new CommandResult(LOCATION_ID, 4,
            new LocationArchivedEvent(LOCATION_ID, null, T0)));

    mockMvc.perform(post("/locations/{id}/archive", ID))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.eventType").value("LocationArchived"));
  }

  @Test
  void getHistory_listsEvents() throws Exception {
    when(queryService.getHistory(LOCATION_ID)).thenReturn(List.of(
        new HistoryEntry(1, 1, new LocationDefinedEvent(LOCATION_ID, "Depot",
            LocationType.LOGICAL, null, null, null, T0)),
        new HistoryEntry(2, 1, new LocationArchivedEvent(LOCATION_ID, "closed", T0))));

    mockMvc.perform(get("/locations/{id}/history", ID))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.locationId").value(ID))
        .andExpect(jsonPath("$.events.length()").value(2))
        .andExpect(jsonPath("$.events[1].version").value(2))
        .andExpect(jsonPath("$.events[1].event.eventType").value("LocationArchived"));
  }
}
