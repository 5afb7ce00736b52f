package org.cim.location.command;

import java.time.Instant;
import org.cim.location.config.LocationProperties;
import org.cim.location.domain.Location;
import org.cim.location.event.EventPublisher;
import org.cim.location.event.LocationArchivedEvent;
import org.cim.location.event.LocationEvent;
import org.cim.location.exception.AlreadyArchivedException;
import org.cim.location.exception.LocationNotFoundException;
import org.cim.location.repository.LocationRepository;
import org.springframework.stereotype.Component;

/**
 * Handles ArchiveLocationCommand by producing a LocationArchivedEvent.
 * Children keep their parent reference to an archived location.
 */
@Component
public class ArchiveLocationCommandHandler
    extends AbstractLocationCommandHandler<ArchiveLocationCommand> {

  /**
   * Constructs an ArchiveLocationCommandHandler.
   *
   * @param repository the location repository
   * @param eventPublisher the event publisher
   * @param properties the location properties
   */
  public ArchiveLocationCommandHandler(
      LocationRepository repository,
      EventPublisher eventPublisher,
      LocationProperties properties) {
    super(repository, eventPublisher, properties);
  }

  @Override
  protected void checkPreconditions(ArchiveLocationCommand command, Location current) {
    if (current == null) {
      throw new LocationNotFoundException(command.locationId());
    }
    if (current.archived()) {
      throw new AlreadyArchivedException("Location " + current.id() + " is already archived");
    }
    checkExpectedVersion(command, current);
  }

  @Override
  protected LocationEvent decide(ArchiveLocationCommand command, Location current) {
    return new LocationArchivedEvent(command.locationId(), command.reason(), Instant.now());
  }
}
