package org.cim.location.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for publishing location events to Kafka.
 */
@Component
@ConfigurationProperties(prefix = "kafka")
public class KafkaProperties {
  /**
   * Kafka bootstrap servers.
   */
  private String bootstrapServers = "localhost:9092";

  /**
   * Topic that receives all location events.
   */
  private String topic = "location.events";

  /**
   * Number of partitions for the event topic.
   */
  private int partitions = 3;

  /**
   * Replication factor for the event topic.
   */
  private short replicationFactor = 1;

  /**
   * Retention period in milliseconds (-1 for infinite).
   */
  private long retentionMs = -1;

  /**
   * Whether committed events are sent to Kafka at all.
   */
  private boolean publishingEnabled = true;

  /**
   * Producer configuration.
   */
  private Producer producer = new Producer();

  public String getBootstrapServers() {
    return bootstrapServers;
  }

  public void setBootstrapServers(String bootstrapServers) {
    this.bootstrapServers = bootstrapServers;
  }

  public String getTopic() {
    return topic;
  }

  /**
   * Sets the event topic.
   *
   * @param topic the topic name (must be non-blank)
   */
  public void setTopic(String topic) {
    if (topic == null || topic.isBlank()) {
      throw new IllegalArgumentException("Topic cannot be blank");
    }
    this.topic = topic;
  }

  public int getPartitions() {
    return partitions;
  }

  public void setPartitions(int partitions) {
    this.partitions = partitions;
  }

  public short getReplicationFactor() {
    return replicationFactor;
  }

  public void setReplicationFactor(short replicationFactor) {
    this.replicationFactor = replicationFactor;
  }

  public long getRetentionMs() {
    return retentionMs;
  }

  public void setRetentionMs(long retentionMs) {
    this.retentionMs = retentionMs;
  }

  public boolean isPublishingEnabled() {
    return publishingEnabled;
  }

  public void setPublishingEnabled(boolean publishingEnabled) {
    this.publishingEnabled = publishingEnabled;
  }

  @edu.umd.cs.findbugs.annotations.SuppressFBWarnings(
      value = "EI_EXPOSE_REP",
      justification = "Producer is a Spring configuration bean")
  public Producer getProducer() {
    return producer;
  }

  @edu.umd.cs.findbugs.annotations.SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Producer is a Spring configuration bean")
  public void setProducer(Producer producer) {
    this.producer = producer;
  }

  /**
   * Producer configuration properties.
   */
  public static class Producer {
    private int retries = 3;
    private String acks = "all";
    private boolean enableIdempotence = true;
    private int maxInFlightRequests = 5;
    private String compressionType = "none";
    private int lingerMs = 0;
    private int batchSize = 16384;
    private long maxBlockMs = 5000;

    public int getRetries() {
      return retries;
    }

    public void setRetries(int retries) {
      this.retries = retries;
    }

    public String getAcks() {
      return acks;
    }

    public void setAcks(String acks) {
      this.acks = acks;
    }

    public boolean isEnableIdempotence() {
      return enableIdempotence;
    }

    public void setEnableIdempotence(boolean enableIdempotence) {
      this.enableIdempotence = enableIdempotence;
    }

    public int getMaxInFlightRequests() {
      return maxInFlightRequests;
    }

    public void setMaxInFlightRequests(int maxInFlightRequests) {
      this.maxInFlightRequests = maxInFlightRequests;
    }

    public String getCompressionType() {
      return compressionType;
    }

    public void setCompressionType(String compressionType) {
      this.compressionType = compressionType;
    }

    public int getLingerMs() {
      return lingerMs;
    }

    public void setLingerMs(int lingerMs) {
      this.lingerMs = lingerMs;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public long getMaxBlockMs() {
      return maxBlockMs;
    }

    public void setMaxBlockMs(long maxBlockMs) {
      this.maxBlockMs = maxBlockMs;
    }
  }
}
