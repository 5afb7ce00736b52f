package org.cim.location.command;

/**
 * Interface for command handlers.
 * Handlers validate a command against the current state, append the resulting event
 * and hand it to the publisher.
 *
 * @param <C> the command type
 * @param <R> the result type
 */
public interface CommandHandler<C extends Command, R> {
  /**
   * Handles a command.
   *
   * @param command the command to handle
   * @return the outcome of the command
   * @throws org.cim.location.exception.LocationException if the command is rejected
   * @throws IllegalArgumentException if the command is invalid
   */
  R handle(C command);
}
