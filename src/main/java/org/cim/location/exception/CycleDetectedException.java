package org.cim.location.exception;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.cim.location.domain.LocationId;
import org.springframework.http.HttpStatus;

/**
 * Thrown when a parent assignment would close a loop in the location hierarchy.
 * Error code: cycle_detected
 * HTTP status: 422 Unprocessable Entity
 */
public class CycleDetectedException extends LocationException {

  private static final long serialVersionUID = 1L;

  @SuppressFBWarnings(
      value = "SE_TRANSIENT_FIELD_NOT_RESTORED",
      justification = "Exception is not serialized, only converted to JSON via exception handler"
  )
  private final transient List<LocationId> path;

  /**
   * Constructs a CycleDetectedException for a self-parenting attempt.
   *
   * @param locationId the location that named itself as parent
   */
  public CycleDetectedException(LocationId locationId) {
    this("Location " + locationId + " cannot be its own parent", List.of(locationId, locationId));
  }

  /**
   * Constructs a CycleDetectedException with the offending ancestor path.
   *
   * @param message the detail message
   * @param path the chain of ids that forms the loop, starting at the child
   */
  public CycleDetectedException(String message, List<LocationId> path) {
    super(message, "cycle_detected", HttpStatus.UNPROCESSABLE_ENTITY);
    this.path = path != null ? new ArrayList<>(path) : new ArrayList<>();
  }

  /**
   * Returns the ids forming the loop.
   *
   * @return unmodifiable cycle path
   */
  public List<LocationId> getPath() {
    return Collections.unmodifiableList(path);
  }
}
