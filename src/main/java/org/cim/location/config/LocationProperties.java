package org.cim.location.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the Location aggregate: snapshot cadence,
 * hierarchy limits and command retry policy.
 *
 * <p>Configuration example:
 * <pre>
 * location:
 *   snapshot-frequency: 100        # snapshot every N versions, 0 disables
 *   snapshots-enabled: true
 *   max-hierarchy-depth: 10        # longest ancestor chain accepted
 *   post-commit-verification: true # re-check parent assignments after append
 *   command:
 *     max-conflict-retries: 3      # reload-and-retry budget on version conflicts
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "location")
public class LocationProperties {

  /**
   * A snapshot is taken whenever a save reaches a multiple of this version.
   * Zero disables snapshots.
   */
  private int snapshotFrequency = 100;

  /**
   * Whether snapshots are taken and consulted at all.
   */
  private boolean snapshotsEnabled = true;

  /**
   * Maximum number of ancestors walked before a chain is rejected.
   */
  private int maxHierarchyDepth = 10;

  /**
   * Whether parent assignments are re-verified after they are appended.
   */
  private boolean postCommitVerification = true;

  /**
   * Command handling configuration.
   */
  private Command command = new Command();

  public int getSnapshotFrequency() {
    return snapshotFrequency;
  }

  /**
   * Sets the snapshot frequency.
   *
   * @param snapshotFrequency versions between snapshots (must be &gt;= 0)
   */
  public void setSnapshotFrequency(int snapshotFrequency) {
    if (snapshotFrequency < 0) {
      throw new IllegalArgumentException("Snapshot frequency cannot be negative");
    }
    this.snapshotFrequency = snapshotFrequency;
  }

  public boolean isSnapshotsEnabled() {
    return snapshotsEnabled;
  }

  public void setSnapshotsEnabled(boolean snapshotsEnabled) {
    this.snapshotsEnabled = snapshotsEnabled;
  }

  public int getMaxHierarchyDepth() {
    return maxHierarchyDepth;
  }

  /**
   * Sets the maximum hierarchy depth.
   *
   * @param maxHierarchyDepth maximum ancestor count (must be &gt;= 1)
   */
  public void setMaxHierarchyDepth(int maxHierarchyDepth) {
    if (maxHierarchyDepth < 1) {
      throw new IllegalArgumentException("Max hierarchy depth must be >= 1");
    }
    this.maxHierarchyDepth = maxHierarchyDepth;
  }

  public boolean isPostCommitVerification() {
    return postCommitVerification;
  }

  public void setPostCommitVerification(boolean postCommitVerification) {
    this.postCommitVerification = postCommitVerification;
  }

  @edu.umd.cs.findbugs.annotations.SuppressFBWarnings(
      value = "EI_EXPOSE_REP",
      justification = "Command is a Spring configuration bean")
  public Command getCommand() {
    return command;
  }

  @edu.umd.cs.findbugs.annotations.SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Command is a Spring configuration bean")
  public void setCommand(Command command) {
    this.command = command;
  }

  /**
   * Whether a save that reached the given version should trigger a snapshot.
   *
   * @param version the version just appended
   * @return true if snapshots are enabled and the version is a multiple of the frequency
   */
  public boolean isSnapshotDue(long version) {
    return snapshotsEnabled && snapshotFrequency > 0 && version % snapshotFrequency == 0;
  }

  /**
   * Command handling properties.
   */
  public static class Command {
    private int maxConflictRetries = 3;

    public int getMaxConflictRetries() {
      return maxConflictRetries;
    }

    /**
     * Sets the retry budget for version conflicts.
     *
     * @param maxConflictRetries retries after the first attempt (must be &gt;= 0)
     */
    public void setMaxConflictRetries(int maxConflictRetries) {
      if (maxConflictRetries < 0) {
        throw new IllegalArgumentException("Max conflict retries cannot be negative");
      }
      this.maxConflictRetries = maxConflictRetries;
    }
  }
}
