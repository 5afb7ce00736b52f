package org.cim.location.config;

import java.util.concurrent.Executor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for asynchronous task execution.
 * Provides one pool for snapshot creation and one for concurrently dispatched commands.
 */
@Configuration
@EnableAsync
@EnableConfigurationProperties({
    AsyncConfig.SnapshotExecutorProperties.class,
    AsyncConfig.CommandExecutorProperties.class
})
public class AsyncConfig {

  private final SnapshotExecutorProperties snapshotProperties;
  private final CommandExecutorProperties commandProperties;

  /**
   * Constructor for AsyncConfig.
   *
   * @param snapshotProperties snapshot executor properties
   * @param commandProperties command executor properties
   */
  @edu.umd.cs.findbugs.annotations.SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Executor properties are Spring-managed configuration beans")
  public AsyncConfig(SnapshotExecutorProperties snapshotProperties,
      CommandExecutorProperties commandProperties) {
    this.snapshotProperties = snapshotProperties;
    this.commandProperties = commandProperties;
  }

  /**
   * Thread pool executor for asynchronous snapshot creation.
   *
   * @return ThreadPoolTaskExecutor for snapshot operations
   */
  @Bean(name = "snapshotExecutor")
  public Executor snapshotExecutor() {
    return executor(snapshotProperties, "snapshot-");
  }

  /**
   * Thread pool executor for commands dispatched asynchronously.
   * Each command runs as an independent task; ordering per location comes from the event log.
   *
   * @return ThreadPoolTaskExecutor for command handling
   */
  @Bean(name = "commandExecutor")
  public Executor commandExecutor() {
    return executor(commandProperties, "command-");
  }

  private static ThreadPoolTaskExecutor executor(ExecutorProperties properties,
      String threadNamePrefix) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.getCorePoolSize());
    executor.setMaxPoolSize(properties.getMaxPoolSize());
    executor.setQueueCapacity(properties.getQueueCapacity());
    executor.setThreadNamePrefix(threadNamePrefix);
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(properties.getAwaitTerminationSeconds());
    executor.initialize();
    return executor;
  }

  /**
   * Common thread pool settings.
   */
  public abstract static class ExecutorProperties {
    private int corePoolSize;
    private int maxPoolSize;
    private int queueCapacity;
    private int awaitTerminationSeconds;

    protected ExecutorProperties(int corePoolSize, int maxPoolSize, int queueCapacity,
        int awaitTerminationSeconds) {
      this.corePoolSize = corePoolSize;
      this.maxPoolSize = maxPoolSize;
      this.queueCapacity = queueCapacity;
      this.awaitTerminationSeconds = awaitTerminationSeconds;
    }

    public int getCorePoolSize() {
      return corePoolSize;
    }

    public void setCorePoolSize(int corePoolSize) {
      this.corePoolSize = corePoolSize;
    }

    public int getMaxPoolSize() {
      return maxPoolSize;
    }

    public void setMaxPoolSize(int maxPoolSize) {
      this.maxPoolSize = maxPoolSize;
    }

    public int getQueueCapacity() {
      return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
    }

    public int getAwaitTerminationSeconds() {
      return awaitTerminationSeconds;
    }

    public void setAwaitTerminationSeconds(int awaitTerminationSeconds) {
      this.awaitTerminationSeconds = awaitTerminationSeconds;
    }
  }

  /**
   * Configuration properties for snapshot executor thread pool.
   */
  @ConfigurationProperties(prefix = "async.snapshot-executor")
  public static class SnapshotExecutorProperties extends ExecutorProperties {
    public SnapshotExecutorProperties() {
      super(2, 4, 100, 60);
    }
  }

  /**
   * Configuration properties for command executor thread pool.
   */
  @ConfigurationProperties(prefix = "async.command-executor")
  public static class CommandExecutorProperties extends ExecutorProperties {
    public CommandExecutorProperties() {
      super(4, 16, 500, 30);
    }
  }
}
