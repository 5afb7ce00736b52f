package org.cim.location.command;

import java.time.Instant;
import org.cim.location.config.LocationProperties;
import org.cim.location.domain.Location;
import org.cim.location.event.EventPublisher;
import org.cim.location.event.LocationEvent;
import org.cim.location.event.ParentLocationRemovedEvent;
import org.cim.location.repository.LocationRepository;
import org.springframework.stereotype.Component;

/**
 * Handles RemoveParentLocationCommand by producing a ParentLocationRemovedEvent.
 * Removing a parent can never close a cycle, so the hierarchy guard is not consulted.
 */
@Component
public class RemoveParentLocationCommandHandler
    extends AbstractLocationCommandHandler<RemoveParentLocationCommand> {

  /**
   * Constructs a RemoveParentLocationCommandHandler.
   *
   * @param repository the location repository
   * @param eventPublisher the event publisher
   * @param properties the location properties
   */
  public RemoveParentLocationCommandHandler(
      LocationRepository repository,
      EventPublisher eventPublisher,
      LocationProperties properties) {
    super(repository, eventPublisher, properties);
  }

  @Override
  protected LocationEvent decide(RemoveParentLocationCommand command, Location current) {
    return new ParentLocationRemovedEvent(command.locationId(), current.parentId(),
        command.reason(), Instant.now());
  }
}
