package org.cim.location.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for retrying store calls that fail with
 * {@link org.cim.location.exception.StoreUnavailableException}.
 *
 * <p>Configuration example:
 * <pre>
 * location:
 *   store:
 *     retry:
 *       max-attempts: 3         # Total attempts including the first (default: 3)
 *       initial-interval: 100   # Initial backoff in ms (default: 100ms)
 *       multiplier: 2.0         # Exponential multiplier (default: 2.0)
 *       max-interval: 2000      # Max backoff in ms (default: 2s)
 * </pre>
 *
 * <p>Backoff progression (with defaults): attempt 2 after 100ms, attempt 3 after 200ms.
 */
@Configuration
@ConfigurationProperties(prefix = "location.store.retry")
public class StoreRetryProperties {

  /**
   * Total number of attempts, including the first.
   */
  private int maxAttempts = 3;

  /**
   * Initial backoff interval in milliseconds.
   */
  private long initialInterval = 100;

  /**
   * Exponential backoff multiplier.
   */
  private double multiplier = 2.0;

  /**
   * Maximum backoff interval in milliseconds (cap).
   */
  private long maxInterval = 2000;

  public int getMaxAttempts() {
    return maxAttempts;
  }

  /**
   * Sets the maximum number of attempts.
   *
   * @param maxAttempts total attempts (must be &gt;= 1)
   */
  public void setMaxAttempts(int maxAttempts) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    this.maxAttempts = maxAttempts;
  }

  public long getInitialInterval() {
    return initialInterval;
  }

  /**
   * Sets the initial backoff interval.
   *
   * @param initialInterval initial interval in ms (must be &gt;= 1)
   */
  public void setInitialInterval(long initialInterval) {
    if (initialInterval < 1) {
      throw new IllegalArgumentException("initialInterval must be >= 1");
    }
    this.initialInterval = initialInterval;
  }

  public double getMultiplier() {
    return multiplier;
  }

  /**
   * Sets the backoff multiplier.
   *
   * @param multiplier exponential multiplier (must be &gt; 1.0)
   */
  public void setMultiplier(double multiplier) {
    if (multiplier <= 1.0) {
      throw new IllegalArgumentException("multiplier must be > 1.0");
    }
    this.multiplier = multiplier;
  }

  public long getMaxInterval() {
    return maxInterval;
  }

  /**
   * Sets the maximum backoff interval.
   *
   * @param maxInterval maximum interval in ms (must be &gt;= 1)
   */
  public void setMaxInterval(long maxInterval) {
    if (maxInterval < 1) {
      throw new IllegalArgumentException("maxInterval must be >= 1");
    }
    this.maxInterval = maxInterval;
  }
}
