package org.cim.location.event;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.cim.location.config.KafkaProperties;
import org.cim.location.domain.LocationId;
import org.cim.location.domain.LocationType;
import org.cim.location.testutil.KafkaTestContainers;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.kafka.KafkaContainer;

/**
 * Integration test for EventPublisher using Testcontainers Kafka.
 */
@SpringBootTest
@ActiveProfiles("it")
class EventPublisherKafkaIT {

  // Eager initialization - container must be started before @DynamicPropertySource
  private static KafkaContainer kafkaContainer = KafkaTestContainers.createKafkaContainer();

  @Autowired
  private EventPublisher eventPublisher;

  @Autowired
  private KafkaProperties kafkaProperties;

  @Autowired
  private KafkaAdmin kafkaAdmin;

  @DynamicPropertySource
  static void configureKafka(DynamicPropertyRegistry registry) {
    registry.add("kafka.bootstrap-servers", kafkaContainer::getBootstrapServers);
    registry.add("kafka.publishing-enabled", () -> "true");
  }

  @Test
  void publishedEventsAreKeyedByLocationInOrder() throws Exception {
    // Given
    kafkaAdmin.initialize();
    LocationId id = LocationId.generate();
    LocationId parent = LocationId.generate();
    Instant now = Instant.now();

    // When
    eventPublisher.publish(new LocationDefinedEvent(id, "Depot", LocationType.LOGICAL,
        null, null, null, now), 1).get();
    eventPublisher.publish(new ParentLocationSetEvent(id, parent, null, "move",
        now.plusSeconds(1)), 2).get();

    // Then
    try (KafkaConsumer<String, String> consumer = createConsumer()) {
      consumer.subscribe(List.of(kafkaProperties.getTopic()));
      List<ConsumerRecord<String, String>> received = new ArrayList<>();

      await()
          .atMost(Duration.ofSeconds(15))
          .pollInterval(Duration.ofMillis(100))
          .untilAsserted(() -> {
            consumer.poll(Duration.ofMillis(100)).forEach(record -> {
              if (id.toString().equals(record.key())) {
                received.add(record);
              }
            });
            assertEquals(2, received.size(), "Should receive both events of the location");
          });

      assertHeaderExists(received.get(0), EventHeaders.EVENT_TYPE, "LocationDefined");
      assertHeaderExists(received.get(0), EventHeaders.VERSION, "1");
      assertHeaderExists(received.get(1), EventHeaders.EVENT_TYPE, "ParentLocationSet");
      assertHeaderExists(received.get(1), EventHeaders.SUBJECT,
          "events.location." + id + ".parent.set");

      String json = received.get(1).value();
      assertTrue(json.contains("\"eventType\":\"ParentLocationSet\""));
      assertTrue(json.contains("\"parentId\":\"" + parent + "\""));
    }
  }

  private KafkaConsumer<String, String> createConsumer() {
    return new KafkaConsumer<>(Map.of(
        ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafkaContainer.getBootstrapServers(),
        ConsumerConfig.GROUP_ID_CONFIG, "test-" + System.nanoTime(),
        ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest",
        ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class,
        ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class));
  }

  private static void assertHeaderExists(ConsumerRecord<String, String> record, String key,
      String expectedValue) {
    Header header = record.headers().lastHeader(key);
    assertNotNull(header, "Header " + key + " should exist");
    assertEquals(expectedValue, new String(header.value(), StandardCharsets.UTF_8));
  }
}
