package org.cim.location.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for EventUpcaster.
 */
class EventUpcasterTest {

  private final EventUpcaster upcaster = new EventUpcaster();
  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void currentVersion_shouldBeKnownForEveryType() {
    assertThat(upcaster.currentVersion(LocationDefinedEvent.TYPE)).isEqualTo(1);
    assertThat(upcaster.currentVersion(LocationUpdatedEvent.TYPE)).isEqualTo(2);
    assertThat(upcaster.currentVersion(LocationMetadataAddedEvent.TYPE)).isEqualTo(2);
    assertThatThrownBy(() -> upcaster.currentVersion("LocationTeleported"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void updatedV1_shouldRenameNewName() throws Exception {
    ObjectNode v1 = (ObjectNode) mapper.readTree("{\"newName\":\"Main\",\"reason\":\"r\"}");

    ObjectNode upcast = upcaster.upcast(LocationUpdatedEvent.TYPE, 1, v1);

    assertThat(upcast.get("name").asText()).isEqualTo("Main");
    assertThat(upcast.has("newName")).isFalse();
    assertThat(v1.has("newName")).isTrue();
  }

  @Test
  void metadataV1_shouldSplitSingleEntry() throws Exception {
    ObjectNode v1 = (ObjectNode) mapper.readTree("{\"addedMetadata\":{\"floor\":\"3\"}}");

    ObjectNode upcast = upcaster.upcast(LocationMetadataAddedEvent.TYPE, 1, v1);

    assertThat(upcast.get("key").asText()).isEqualTo("floor");
    assertThat(upcast.get("value").asText()).isEqualTo("3");
    assertThat(upcast.has("addedMetadata")).isFalse();
  }

  @Test
  void metadataV1_withSeveralEntries_shouldFail() throws Exception {
    ObjectNode v1 = (ObjectNode) mapper.readTree("{\"addedMetadata\":{\"a\":\"1\",\"b\":\"2\"}}");

    assertThatThrownBy(() -> upcaster.upcast(LocationMetadataAddedEvent.TYPE, 1, v1))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void newerThanSupported_shouldFail() throws Exception {
    ObjectNode payload = (ObjectNode) mapper.readTree("{}");

    assertThatThrownBy(() -> upcaster.upcast(LocationArchivedEvent.TYPE, 2, payload))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("newest supported is 1");
  }
}
