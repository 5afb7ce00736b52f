package org.cim.location.command;

/**
 * Marker interface for all commands.
 * Commands represent intent to change the system state and produce events.
 */
public interface Command {
}
