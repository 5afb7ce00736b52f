package org.cim.location.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.cim.location.domain.LocationId;
import org.cim.location.repository.LocationRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/**
 * End-to-end tests through the HTTP API with the in-memory stores.
 * Kafka publication is disabled in the "it" profile.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("it")
class LocationApiIntegrationTest {

  @Autowired
  private MockMvc mockMvc;

  @Autowired
  private LocationRepository repository;

  @Test
  void defineThenRead_returnsVersionOne() throws Exception {
    String id = define("HQ", "PHYSICAL", """
        , "address": {"street1": "1 Main St", "locality": "Springfield",
                      "region": "IL", "country": "USA", "postalCode": "62701"}
        """);

    mockMvc.perform(get("/locations/{id}", id))
        .andExpect(status().isOk())
        .andExpect(header().string("ETag", "\"1\""))
        .andExpect(jsonPath("$.version").value(1))
        .andExpect(jsonPath("$.archived").value(false))
        .andExpect(jsonPath("$.address.locality").value("Springfield"));
  }

  @Test
  void updateAfterArchive_returns409() throws Exception {
    String id = define("Warehouse", "LOGICAL", "");

    mockMvc.perform(post("/locations/{id}/archive", id)
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"reason\":\"closed\"}"))
        .andExpect(status().isOk())
        .andExpect(header().string("ETag", "\"2\""));

    mockMvc.perform(patch("/locations/{id}", id)
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"name\":\"New\"}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("terminal_state_violation"));
  }

  @Test
  void staleIfMatch_returns409WithVersions() throws Exception {
    String id = define("Office", "LOGICAL", "");
    mockMvc.perform(put("/locations/{id}/metadata/{key}", id, "floor")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"value\":\"3\"}"))
        .andExpect(status().isOk());

    mockMvc.perform(patch("/locations/{id}", id)
            .contentType(MediaType.APPLICATION_JSON)
            .header("If-Match", "\"1\"")
            .content("{\"name\":\"Renamed\"}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.expectedVersion").value(1))
        .andExpect(jsonPath("$.actualVersion").value(2));
  }

  @Test
  void closingLoop_returns422AndLeavesHierarchyUnchanged() throws Exception {
    String a = define("A", "LOGICAL", "");
    String b = define("B", "LOGICAL", "");
    String c = define("C", "LOGICAL", "");
    setParent(a, b);
    setParent(b, c);

    mockMvc.perform(put("/locations/{id}/parent", c)
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"parentId\":\"" + a + "\"}"))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("cycle_detected"))
        .andExpect(jsonPath("$.path.length()").value(4));

    assertThat(repository.load(LocationId.of(c)).parentId()).isNull();
    mockMvc.perform(get("/locations/{id}/ancestors", a))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].id").value(b))
        .andExpect(jsonPath("$[1].id").value(c));
  }

  @Test
  void batchWithCycle_appliesNothing() throws Exception {
    String a = define("A", "LOGICAL", "");
    String b = define("B", "LOGICAL", "");
    String c = define("C", "LOGICAL", "");

    String body = """
        {"moves": [
          {"locationId": "%s", "parentId": "%s"},
          {"locationId": "%s", "parentId": "%s"},
          {"locationId": "%s", "parentId": "%s"}
        ]}
        """.formatted(a, b, b, c, c, a);

    mockMvc.perform(post("/locations/hierarchy/reparent")
            .contentType(MediaType.APPLICATION_JSON)
            .content(body))
        .andExpect(status().isUnprocessableEntity());

    for (String id : new String[] {a, b, c}) {
      assertThat(repository.load(LocationId.of(id)).version()).isEqualTo(1);
    }
  }

  @Test
  void history_survivesSnapshots() throws Exception {
    String id = define("Depot", "LOGICAL", "");
    for (int i = 0; i < 6; i++) {
      mockMvc.perform(put("/locations/{id}/metadata/{key}", id, "k" + i)
              .contentType(MediaType.APPLICATION_JSON)
              .content("{\"value\":\"v\"}"))
          .andExpect(status().isOk());
    }

    mockMvc.perform(get("/locations/{id}", id).param("version", "3"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.version").value(3))
        .andExpect(jsonPath("$.metadata.k1").value("v"))
        .andExpect(jsonPath("$.metadata.k2").doesNotExist());

    mockMvc.perform(get("/locations/{id}/history", id))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.events.length()").value(7))
        .andExpect(jsonPath("$.events[0].event.eventType").value("LocationDefined"));
  }

  private String define(String name, String type, String extraFields) throws Exception {
    String id = LocationId.generate().toString();
    String body = "{\"id\": \"" + id + "\", \"name\": \"" + name
        + "\", \"locationType\": \"" + type + "\"" + extraFields + "}";
    mockMvc.perform(post("/locations")
            .contentType(MediaType.APPLICATION_JSON)
            .content(body))
        .andExpect(status().isCreated());
    return id;
  }

  private void setParent(String child, String parent) throws Exception {
    mockMvc.perform(put("/locations/{id}/parent", child)
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"parentId\":\"" + parent + "\"}"))
        .andExpect(status().isOk());
  }
}
