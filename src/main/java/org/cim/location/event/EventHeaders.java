package org.cim.location.event;

/**
 * Constants for Kafka event headers.
 * Headers let subscribers route and filter events without decoding the payload.
 */
public final class EventHeaders {
  /**
   * Header key for the globally unique event ID.
   * Lets subscribers drop redeliveries.
   */
  public static final String EVENT_ID = "eventId";

  /**
   * Header key for the event type, e.g. "ParentLocationSet".
   */
  public static final String EVENT_TYPE = "eventType";

  /**
   * Header key for the location id.
   */
  public static final String AGGREGATE_ID = "aggregateId";

  /**
   * Header key for the aggregate version the event was appended at.
   */
  public static final String VERSION = "version";

  /**
   * Header key for the hierarchical subject.
   * Format: "events.location.{id}.{suffix}", e.g. "events.location.0193...abc.parent.set"
   */
  public static final String SUBJECT = "subject";

  /**
   * Prefix of every subject.
   */
  public static final String SUBJECT_PREFIX = "events.location.";

  /**
   * Header key for the event timestamp (UTC epoch milliseconds).
   * Format: "1729593600000"
   */
  public static final String TIMESTAMP = "timestamp";

  /**
   * Header key for the correlation ID of the request that caused the event.
   * Format: UUIDv7 string (e.g., "01932c5c-8f7a-7890-b123-456789abcdef")
   */
  public static final String CORRELATION_ID = "correlationId";

  private EventHeaders() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Builds the subject for an event.
   *
   * @param event the event
   * @return the subject, e.g. {@code events.location.{id}.archived}
   */
  public static String subjectOf(LocationEvent event) {
    return SUBJECT_PREFIX + event.locationId() + "." + event.subjectSuffix();
  }
}
