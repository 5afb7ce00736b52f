package org.cim.location.command;

import java.time.Instant;
import org.cim.location.config.LocationProperties;
import org.cim.location.domain.Location;
import org.cim.location.event.EventPublisher;
import org.cim.location.event.LocationEvent;
import org.cim.location.event.LocationMetadataAddedEvent;
import org.cim.location.repository.LocationRepository;
import org.springframework.stereotype.Component;

/**
 * Handles AddLocationMetadataCommand by producing a LocationMetadataAddedEvent.
 */
@Component
public class AddLocationMetadataCommandHandler
    extends AbstractLocationCommandHandler<AddLocationMetadataCommand> {

  /**
   * Constructs an AddLocationMetadataCommandHandler.
   *
   * @param repository the location repository
   * @param eventPublisher the event publisher
   * @param properties the location properties
   */
  public AddLocationMetadataCommandHandler(
      LocationRepository repository,
      EventPublisher eventPublisher,
      LocationProperties properties) {
    super(repository, eventPublisher, properties);
  }

  @Override
  protected LocationEvent decide(AddLocationMetadataCommand command, Location current) {
    return new LocationMetadataAddedEvent(command.locationId(), command.key(), command.value(),
        Instant.now());
  }
}
