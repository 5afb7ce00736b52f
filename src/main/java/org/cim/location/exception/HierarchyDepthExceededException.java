package org.cim.location.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when an ancestor walk does not terminate within the configured maximum depth.
 * Error code: hierarchy_depth_exceeded
 * HTTP status: 422 Unprocessable Entity
 */
public class HierarchyDepthExceededException extends LocationException {

  private static final long serialVersionUID = 1L;

  private final int maxDepth;

  /**
   * Constructs a HierarchyDepthExceededException.
   *
   * @param message the detail message
   * @param maxDepth the depth limit that was exceeded
   */
  public HierarchyDepthExceededException(String message, int maxDepth) {
    super(message, "hierarchy_depth_exceeded", HttpStatus.UNPROCESSABLE_ENTITY);
    this.maxDepth = maxDepth;
  }

  public int getMaxDepth() {
    return maxDepth;
  }
}
