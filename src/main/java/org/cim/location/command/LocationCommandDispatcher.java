package org.cim.location.command;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Routes commands to their handlers.
 *
 * <p>{@link #submit(LocationCommand)} runs a command as an independent task on the command
 * executor. Cancelling the returned future with {@code mayInterruptIfRunning} stops the command
 * if it has not yet issued its append.
 */
@Service
public class LocationCommandDispatcher {

  private final DefineLocationCommandHandler defineHandler;
  private final UpdateLocationCommandHandler updateHandler;
  private final SetParentLocationCommandHandler setParentHandler;
  private final RemoveParentLocationCommandHandler removeParentHandler;
  private final AddLocationMetadataCommandHandler metadataHandler;
  private final ArchiveLocationCommandHandler archiveHandler;
  private final ReparentLocationsCommandHandler reparentHandler;
  private final Executor commandExecutor;

  /**
   * Constructs a LocationCommandDispatcher.
   *
   * @param defineHandler handler for define commands
   * @param updateHandler handler for update commands
   * @param setParentHandler handler for set-parent commands
   * @param removeParentHandler handler for remove-parent commands
   * @param metadataHandler handler for metadata commands
   * @param archiveHandler handler for archive commands
   * @param reparentHandler handler for batch reparenting
   * @param commandExecutor executor for asynchronous commands
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Handlers and executor are Spring-managed beans")
  public LocationCommandDispatcher(
      DefineLocationCommandHandler defineHandler,
      UpdateLocationCommandHandler updateHandler,
      SetParentLocationCommandHandler setParentHandler,
      RemoveParentLocationCommandHandler removeParentHandler,
      AddLocationMetadataCommandHandler metadataHandler,
      ArchiveLocationCommandHandler archiveHandler,
      ReparentLocationsCommandHandler reparentHandler,
      @Qualifier("commandExecutor") Executor commandExecutor) {
    this.defineHandler = defineHandler;
    this.updateHandler = updateHandler;
    this.setParentHandler = setParentHandler;
    this.removeParentHandler = removeParentHandler;
    this.metadataHandler = metadataHandler;
    this.archiveHandler = archiveHandler;
    this.reparentHandler = reparentHandler;
    this.commandExecutor = commandExecutor;
  }

  /**
   * Handles a single-location command on the calling thread.
   *
   * @param command the command
   * @return the result
   */
  public CommandResult dispatch(LocationCommand command) {
    if (command instanceof DefineLocationCommand define) {
      return defineHandler.handle(define);
    }
    if (command instanceof UpdateLocationCommand update) {
      return updateHandler.handle(update);
    }
    if (command instanceof SetParentLocationCommand setParent) {
      return setParentHandler.handle(setParent);
    }
    if (command instanceof RemoveParentLocationCommand removeParent) {
      return removeParentHandler.handle(removeParent);
    }
    if (command instanceof AddLocationMetadataCommand metadata) {
      return metadataHandler.handle(metadata);
    }
    if (command instanceof ArchiveLocationCommand archive) {
      return archiveHandler.handle(archive);
    }
    throw new IllegalArgumentException("Unsupported command: "
        + command.getClass().getSimpleName());
  }

  /**
   * Handles a batch reparenting on the calling thread.
   *
   * @param command the command
   * @return one result per appended event
   */
  public List<CommandResult> dispatch(ReparentLocationsCommand command) {
    return reparentHandler.handle(command);
  }

  /**
   * Handles a single-location command on the command executor.
   *
   * @param command the command
   * @return a future for the result; {@code cancel(true)} interrupts the command
   */
  public Future<CommandResult> submit(LocationCommand command) {
    Map<String, String> context = MDC.getCopyOfContextMap();
    FutureTask<CommandResult> task = new FutureTask<>(() -> {
      if (context != null) {
        MDC.setContextMap(context);
      }
      try {
        return dispatch(command);
      } finally {
        MDC.clear();
      }
    });
    commandExecutor.execute(task);
    return task;
  }
}
