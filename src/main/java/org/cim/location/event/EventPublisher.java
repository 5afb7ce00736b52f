package org.cim.location.event;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.annotation.Counted;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Headers;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.cim.location.config.KafkaProperties;
import org.cim.location.filter.CorrelationIdFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

/**
 * Service for publishing location events to Kafka after they have been appended.
 * Publication is fire-and-forget: a failure is logged and never undoes the append.
 */
@Service
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public class EventPublisher {
  private static final Logger logger = LoggerFactory.getLogger(EventPublisher.class);

  private final KafkaTemplate<String, LocationEvent> kafkaTemplate;
  private final KafkaProperties kafkaProperties;

  /**
   * Constructs an EventPublisher with the specified Kafka template and properties.
   *
   * @param kafkaTemplate the Kafka template for sending events
   * @param kafkaProperties the Kafka configuration properties
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Both KafkaTemplate and KafkaProperties are Spring beans,"
          + " thread-safe and immutable after initialization")
  public EventPublisher(
      KafkaTemplate<String, LocationEvent> kafkaTemplate,
      KafkaProperties kafkaProperties) {
    this.kafkaTemplate = kafkaTemplate;
    this.kafkaProperties = kafkaProperties;
  }

  /**
   * Publishes a committed event, keyed by location id so a location's events stay ordered.
   *
   * @param event the event to publish
   * @param version the version the event was appended at
   * @return a future with the send result; completes with null when publishing is disabled
   */
  @Counted(
      value = "location.event.published",
      description = "Location events published count"
  )
  public CompletableFuture<SendResult<String, LocationEvent>> publish(
      LocationEvent event, long version) {
    if (!kafkaProperties.isPublishingEnabled()) {
      logger.debug("Publishing disabled, skipping {} for location {}",
          event.typeName(), event.locationId());
      return CompletableFuture.completedFuture(null);
    }

    String topic = kafkaProperties.getTopic();
    String key = event.locationId().toString();

    ProducerRecord<String, LocationEvent> record =
        new ProducerRecord<>(topic, null, key, event);
    addHeaders(record.headers(), event, version);

    logger.info("Publishing event {} to topic {} with key {}",
        event.typeName(), topic, key);

    try {
      return kafkaTemplate.send(record)
          .whenComplete((result, ex) -> {
            if (ex != null) {
              logger.error("Failed to publish event {} to topic {}: {}",
                  event.eventId(), topic, ex.getMessage(), ex);
            } else {
              logger.debug("Event published successfully to topic {} partition {} offset {}",
                  topic, result.getRecordMetadata().partition(),
                  result.getRecordMetadata().offset());
            }
          });
    } catch (RuntimeException e) {
      // send() throws directly when the producer cannot fetch metadata within max.block.ms
      logger.error("Failed to hand event {} to the Kafka producer: {}",
          event.eventId(), e.getMessage(), e);
      return CompletableFuture.failedFuture(e);
    }
  }

  private void addHeaders(Headers headers, LocationEvent event, long version) {
    headers.add(header(EventHeaders.EVENT_ID, event.eventId()));
    headers.add(header(EventHeaders.EVENT_TYPE, event.typeName()));
    headers.add(header(EventHeaders.AGGREGATE_ID, event.locationId().toString()));
    headers.add(header(EventHeaders.VERSION, String.valueOf(version)));
    headers.add(header(EventHeaders.SUBJECT, EventHeaders.subjectOf(event)));
    headers.add(header(EventHeaders.TIMESTAMP,
        String.valueOf(event.occurredAt().toEpochMilli())));

    String correlationId = MDC.get(CorrelationIdFilter.CORRELATION_ID_KEY);
    if (correlationId != null) {
      headers.add(header(EventHeaders.CORRELATION_ID, correlationId));
    }
  }

  private static RecordHeader header(String key, String value) {
    return new RecordHeader(key, value.getBytes(StandardCharsets.UTF_8));
  }
}
