package org.cim.location.exception;

import org.springframework.http.HttpStatus;

/**
 * Base exception for Location Server errors.
 * Carries a canonical error code and the HTTP status used when the error reaches a client.
 */
public class LocationException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final String code;
  private final int status;

  /**
   * Constructor with message, code, and status.
   *
   * @param message error message
   * @param code canonical error code
   * @param status HTTP status
   */
  public LocationException(String message, String code, HttpStatus status) {
    super(message);
    this.code = code;
    this.status = status.value();
  }

  /**
   * Constructor with message, code, status, and cause.
   *
   * @param message error message
   * @param code canonical error code
   * @param status HTTP status
   * @param cause the cause
   */
  public LocationException(String message, String code, HttpStatus status, Throwable cause) {
    super(message, cause);
    this.code = code;
    this.status = status.value();
  }

  public String getCode() {
    return code;
  }

  public int getStatus() {
    return status;
  }
}
