package org.cim.location.command;

import java.time.Instant;
import org.cim.location.config.LocationProperties;
import org.cim.location.domain.Location;
import org.cim.location.event.EventPublisher;
import org.cim.location.event.LocationDefinedEvent;
import org.cim.location.event.LocationEvent;
import org.cim.location.exception.LocationAlreadyExistsException;
import org.cim.location.repository.LocationRepository;
import org.springframework.stereotype.Component;

/**
 * Handles DefineLocationCommand by producing the LocationDefinedEvent that starts a
 * location's log.
 */
@Component
public class DefineLocationCommandHandler
    extends AbstractLocationCommandHandler<DefineLocationCommand> {

  /**
   * Constructs a DefineLocationCommandHandler.
   *
   * @param repository the location repository
   * @param eventPublisher the event publisher
   * @param properties the location properties
   */
  public DefineLocationCommandHandler(
      LocationRepository repository,
      EventPublisher eventPublisher,
      LocationProperties properties) {
    super(repository, eventPublisher, properties);
  }

  @Override
  protected void checkPreconditions(DefineLocationCommand command, Location current) {
    if (current != null) {
      throw new LocationAlreadyExistsException("Location already exists: "
          + command.locationId());
    }
  }

  @Override
  protected LocationEvent decide(DefineLocationCommand command, Location current) {
    return new LocationDefinedEvent(
        command.locationId(),
        command.name(),
        command.locationType(),
        command.address(),
        command.coordinates(),
        command.virtualLocation(),
        Instant.now());
  }
}
