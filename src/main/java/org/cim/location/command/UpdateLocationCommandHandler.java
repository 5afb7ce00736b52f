package org.cim.location.command;

import java.time.Instant;
import org.cim.location.config.LocationProperties;
import org.cim.location.domain.Location;
import org.cim.location.event.EventPublisher;
import org.cim.location.event.LocationEvent;
import org.cim.location.event.LocationUpdatedEvent;
import org.cim.location.repository.LocationRepository;
import org.springframework.stereotype.Component;

/**
 * Handles UpdateLocationCommand by producing a LocationUpdatedEvent.
 * Empty or value-identical patches are rejected by the dry run.
 */
@Component
public class UpdateLocationCommandHandler
    extends AbstractLocationCommandHandler<UpdateLocationCommand> {

  /**
   * Constructs an UpdateLocationCommandHandler.
   *
   * @param repository the location repository
   * @param eventPublisher the event publisher
   * @param properties the location properties
   */
  public UpdateLocationCommandHandler(
      LocationRepository repository,
      EventPublisher eventPublisher,
      LocationProperties properties) {
    super(repository, eventPublisher, properties);
  }

  @Override
  protected LocationEvent decide(UpdateLocationCommand command, Location current) {
    return new LocationUpdatedEvent(command.locationId(), command.patch(), command.reason(),
        Instant.now());
  }
}
