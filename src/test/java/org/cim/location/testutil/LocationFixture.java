package org.cim.location.testutil;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.cim.location.command.AddLocationMetadataCommandHandler;
import org.cim.location.command.ArchiveLocationCommandHandler;
import org.cim.location.command.DefineLocationCommand;
import org.cim.location.command.DefineLocationCommandHandler;
import org.cim.location.command.LocationCommandDispatcher;
import org.cim.location.command.RemoveParentLocationCommandHandler;
import org.cim.location.command.ReparentLocationsCommandHandler;
import org.cim.location.command.SetParentLocationCommand;
import org.cim.location.command.SetParentLocationCommandHandler;
import org.cim.location.command.UpdateLocationCommandHandler;
import org.cim.location.config.LocationProperties;
import org.cim.location.config.StoreRetryProperties;
import org.cim.location.domain.LocationId;
import org.cim.location.domain.LocationType;
import org.cim.location.event.EventPublisher;
import org.cim.location.event.EventUpcaster;
import org.cim.location.event.LocationEventCodec;
import org.cim.location.repository.LocationRehydrator;
import org.cim.location.repository.LocationRepository;
import org.cim.location.service.HierarchyGuard;
import org.cim.location.service.LocationQueryService;
import org.cim.location.service.SnapshotService;
import org.cim.location.store.EventLogStore;
import org.cim.location.store.InMemoryEventLogStore;
import org.cim.location.store.InMemorySnapshotStore;
import org.cim.location.store.SnapshotStore;

/**
 * Wires the location components by hand over in-memory stores, without a Spring context.
 * Snapshots run synchronously because {@code @Async} is not applied outside Spring.
 * Publishing goes to a Mockito mock that always succeeds.
 */
public class LocationFixture {

  private final EventLogStore eventLogStore;
  private final SnapshotStore snapshotStore;
  private final LocationProperties properties;
  private final LocationEventCodec codec;
  private final LocationRehydrator rehydrator;
  private final SnapshotService snapshotService;
  private final LocationRepository repository;
  private final HierarchyGuard guard;
  private final EventPublisher eventPublisher;

  public LocationFixture() {
    this(new InMemoryEventLogStore(), new InMemorySnapshotStore(), new LocationProperties());
  }

  public LocationFixture(LocationProperties properties) {
    this(new InMemoryEventLogStore(), new InMemorySnapshotStore(), properties);
  }

  /**
   * Creates a fixture over the given stores.
   *
   * @param eventLogStore the event log
   * @param snapshotStore the snapshot store
   * @param properties the location properties
   */
  public LocationFixture(EventLogStore eventLogStore, SnapshotStore snapshotStore,
      LocationProperties properties) {
    this.eventLogStore = eventLogStore;
    this.snapshotStore = snapshotStore;
    this.properties = properties;
    this.codec = new LocationEventCodec(objectMapper(), new EventUpcaster());
    this.rehydrator = new LocationRehydrator(eventLogStore, snapshotStore, codec, properties);
    this.snapshotService = new SnapshotService(rehydrator, snapshotStore, properties);
    this.repository = new LocationRepository(eventLogStore, rehydrator, codec, snapshotService,
        fastRetry());
    this.guard = new HierarchyGuard(repository, properties);
    this.eventPublisher = mock(EventPublisher.class);
    lenient().when(eventPublisher.publish(any(), anyLong()))
        .thenReturn(CompletableFuture.completedFuture(null));
  }

  /**
   * Object mapper configured like the application's.
   *
   * @return a new mapper
   */
  public static ObjectMapper objectMapper() {
    return JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .build();
  }

  /**
   * Store retry settings with millisecond backoff.
   *
   * @return retry properties
   */
  public static StoreRetryProperties fastRetry() {
    StoreRetryProperties retry = new StoreRetryProperties();
    retry.setMaxAttempts(3);
    retry.setInitialInterval(1);
    retry.setMaxInterval(5);
    return retry;
  }

  public EventLogStore eventLogStore() {
    return eventLogStore;
  }

  public SnapshotStore snapshotStore() {
    return snapshotStore;
  }

  public LocationProperties properties() {
    return properties;
  }

  public LocationEventCodec codec() {
    return codec;
  }

  public LocationRehydrator rehydrator() {
    return rehydrator;
  }

  public SnapshotService snapshotService() {
    return snapshotService;
  }

  public LocationRepository repository() {
    return repository;
  }

  public HierarchyGuard guard() {
    return guard;
  }

  public EventPublisher eventPublisher() {
    return eventPublisher;
  }

  public LocationQueryService queryService() {
    return new LocationQueryService(repository, properties);
  }

  public DefineLocationCommandHandler defineHandler() {
    return new DefineLocationCommandHandler(repository, eventPublisher, properties);
  }

  public UpdateLocationCommandHandler updateHandler() {
    return new UpdateLocationCommandHandler(repository, eventPublisher, properties);
  }

  public SetParentLocationCommandHandler setParentHandler() {
    return setParentHandler(guard);
  }

  public SetParentLocationCommandHandler setParentHandler(HierarchyGuard hierarchyGuard) {
    return new SetParentLocationCommandHandler(repository, eventPublisher, properties,
        hierarchyGuard);
  }

  public RemoveParentLocationCommandHandler removeParentHandler() {
    return new RemoveParentLocationCommandHandler(repository, eventPublisher, properties);
  }

  public AddLocationMetadataCommandHandler metadataHandler() {
    return new AddLocationMetadataCommandHandler(repository, eventPublisher, properties);
  }

  public ArchiveLocationCommandHandler archiveHandler() {
    return new ArchiveLocationCommandHandler(repository, eventPublisher, properties);
  }

  public ReparentLocationsCommandHandler reparentHandler() {
    return new ReparentLocationsCommandHandler(repository, eventPublisher, properties, guard);
  }

  /**
   * Creates a dispatcher over this fixture's handlers.
   *
   * @param executor executor for submitted commands
   * @return the dispatcher
   */
  public LocationCommandDispatcher dispatcher(Executor executor) {
    return new LocationCommandDispatcher(defineHandler(), updateHandler(), setParentHandler(),
        removeParentHandler(), metadataHandler(), archiveHandler(), reparentHandler(), executor);
  }

  /**
   * Defines a logical location.
   *
   * @param name the name
   * @return its id
   */
  public LocationId define(String name) {
    LocationId id = LocationId.generate();
    defineHandler().handle(new DefineLocationCommand(id, name, LocationType.LOGICAL, null, null,
        null));
    return id;
  }

  /**
   * Sets a parent through the command handler.
   *
   * @param child the child
   * @param parent the parent
   */
  public void setParent(LocationId child, LocationId parent) {
    setParentHandler().handle(new SetParentLocationCommand(child, parent, null, null));
  }
}
