package org.cim.location.config;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.HashMap;
import java.util.Map;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.config.TopicConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.cim.location.event.LocationEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

/**
 * Kafka configuration for event publication.
 * Configures the producer, the admin client and the event topic.
 */
@Configuration
public class KafkaConfig {

  private final KafkaProperties kafkaProperties;

  /**
   * Constructs a KafkaConfig with the specified properties.
   *
   * @param kafkaProperties the Kafka configuration properties
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "KafkaProperties is a Spring configuration bean, "
          + "immutable after initialization")
  public KafkaConfig(KafkaProperties kafkaProperties) {
    this.kafkaProperties = kafkaProperties;
  }

  /**
   * Kafka admin client for topic management.
   * Auto-creation is disabled so startup does not block on an unreachable broker.
   *
   * @return KafkaAdmin instance
   */
  @Bean
  public KafkaAdmin kafkaAdmin() {
    Map<String, Object> configs = new HashMap<>();
    configs.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG,
        kafkaProperties.getBootstrapServers());
    KafkaAdmin admin = new KafkaAdmin(configs);
    admin.setAutoCreate(false);
    return admin;
  }

  /**
   * Producer factory for location events.
   *
   * @return ProducerFactory instance
   */
  @Bean
  public ProducerFactory<String, LocationEvent> producerFactory() {
    KafkaProperties.Producer producer = kafkaProperties.getProducer();

    Map<String, Object> configProps = new HashMap<>();
    configProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG,
        kafkaProperties.getBootstrapServers());
    configProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG,
        StringSerializer.class);
    configProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG,
        JsonSerializer.class);
    configProps.put(JsonSerializer.ADD_TYPE_INFO_HEADERS, false);

    configProps.put(ProducerConfig.ACKS_CONFIG, producer.getAcks());
    configProps.put(ProducerConfig.RETRIES_CONFIG, producer.getRetries());
    configProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, producer.isEnableIdempotence());
    configProps.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION,
        producer.getMaxInFlightRequests());
    configProps.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, producer.getCompressionType());
    configProps.put(ProducerConfig.LINGER_MS_CONFIG, producer.getLingerMs());
    configProps.put(ProducerConfig.BATCH_SIZE_CONFIG, producer.getBatchSize());
    // Bounds how long send() may block a command thread waiting for broker metadata
    configProps.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, producer.getMaxBlockMs());

    return new DefaultKafkaProducerFactory<>(configProps);
  }

  /**
   * Kafka template for sending location events.
   *
   * @return KafkaTemplate instance
   */
  @Bean
  public KafkaTemplate<String, LocationEvent> kafkaTemplate() {
    return new KafkaTemplate<>(producerFactory());
  }

  /**
   * Topic definition for location events. Created by an operator or by
   * {@link KafkaAdmin#initialize()}; not created automatically on startup.
   *
   * @return NewTopic definition
   */
  @Bean
  public NewTopic locationEventTopic() {
    return TopicBuilder
        .name(kafkaProperties.getTopic())
        .partitions(kafkaProperties.getPartitions())
        .replicas(kafkaProperties.getReplicationFactor())
        .config(TopicConfig.RETENTION_MS_CONFIG, String.valueOf(
            kafkaProperties.getRetentionMs() > 0 ? kafkaProperties.getRetentionMs() : -1))
        .config(TopicConfig.CLEANUP_POLICY_CONFIG, TopicConfig.CLEANUP_POLICY_DELETE)
        .build();
  }
}
