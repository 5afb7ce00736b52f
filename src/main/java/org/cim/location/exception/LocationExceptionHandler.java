package org.cim.location.exception;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.cim.location.domain.LocationId;
import org.cim.location.dto.ProblemDetail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Global exception handler for location exceptions.
 * Converts LocationException instances to RFC 7807 problem+json responses and counts them
 * by error code.
 */
@ControllerAdvice
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public class LocationExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(LocationExceptionHandler.class);

  private static final MediaType PROBLEM_JSON =
      MediaType.parseMediaType("application/problem+json");

  private final MeterRegistry meterRegistry;

  /**
   * Constructs a LocationExceptionHandler.
   *
   * @param meterRegistry the meter registry for metrics
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "MeterRegistry is a Spring-managed bean, not a mutable data structure"
  )
  public LocationExceptionHandler(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  /**
   * Handle cycle exceptions, exposing the offending path.
   *
   * @param ex the cycle exception
   * @return RFC 7807 problem+json response with the cycle path
   */
  @ExceptionHandler(CycleDetectedException.class)
  public ResponseEntity<ProblemDetail> handleCycleDetected(CycleDetectedException ex) {
    ProblemDetail problem = problem(ex)
        .with("path", ex.getPath().stream().map(LocationId::toString).toList());
    return respond(problem, ex.getStatus());
  }

  /**
   * Handle version conflicts with expected and actual versions.
   *
   * @param ex the version conflict exception
   * @return RFC 7807 problem+json response with 409 Conflict
   */
  @ExceptionHandler(VersionConflictException.class)
  public ResponseEntity<ProblemDetail> handleVersionConflict(VersionConflictException ex) {
    ProblemDetail problem = problem(ex)
        .with("expectedVersion", ex.getExpectedVersion())
        .with("actualVersion", ex.getActualVersion());
    return respond(problem, ex.getStatus());
  }

  /**
   * Handle post-commit cycles with the version of the compensating event.
   *
   * @param ex the post-commit cycle exception
   * @return RFC 7807 problem+json response with 409 Conflict
   */
  @ExceptionHandler(CycleDetectedPostCommitException.class)
  public ResponseEntity<ProblemDetail> handleCycleDetectedPostCommit(
      CycleDetectedPostCommitException ex) {
    logger.warn("Parent assignment reverted after commit: {}", ex.getMessage());
    ProblemDetail problem = problem(ex)
        .with("locationId", ex.getLocationId().toString())
        .with("compensatedVersion", ex.getCompensatedVersion());
    return respond(problem, ex.getStatus());
  }

  /**
   * Handle store outages that outlasted the repository's retries.
   *
   * @param ex the store unavailable exception
   * @return RFC 7807 problem+json response with 503 Service Unavailable
   */
  @ExceptionHandler(StoreUnavailableException.class)
  @SuppressWarnings("PMD.LooseCoupling") // HttpHeaders provides Spring-specific utility methods
  public ResponseEntity<ProblemDetail> handleStoreUnavailable(StoreUnavailableException ex) {
    logger.error("Event store unavailable: {}", ex.getMessage(), ex);
    meterRegistry.counter("location.errors", "code", ex.getCode()).increment();

    ProblemDetail problem = new ProblemDetail(
        "Event store is temporarily unavailable. Please try again later.",
        ex.getStatus(),
        ex.getCode()
    );

    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(PROBLEM_JSON);
    headers.add("Retry-After", "30");

    return new ResponseEntity<>(problem, headers, HttpStatus.valueOf(ex.getStatus()));
  }

  /**
   * Handle all LocationException instances.
   *
   * @param ex the location exception
   * @return RFC 7807 problem+json response
   */
  @ExceptionHandler(LocationException.class)
  public ResponseEntity<ProblemDetail> handleLocationException(LocationException ex) {
    return respond(problem(ex), ex.getStatus());
  }

  /**
   * Handle IllegalArgumentException (e.g., malformed ids or blank fields).
   *
   * @param ex the illegal argument exception
   * @return RFC 7807 problem+json response with 400 Bad Request
   */
  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ProblemDetail> handleIllegalArgument(IllegalArgumentException ex) {
    meterRegistry.counter("location.errors", "code", "invalid_argument").increment();
    return respond(new ProblemDetail(
        ex.getMessage(),
        HttpStatus.BAD_REQUEST.value(),
        "invalid_argument"
    ), HttpStatus.BAD_REQUEST.value());
  }

  /**
   * Handle request bodies rejected by Bean Validation ({@code @Valid}).
   * The first violation becomes the title; all of them are listed under {@code errors}.
   *
   * @param ex the validation exception
   * @return RFC 7807 problem+json response with 400 Bad Request
   */
  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ProblemDetail> handleInvalidBody(MethodArgumentNotValidException ex) {
    meterRegistry.counter("location.errors", "code", "invalid_argument").increment();
    List<String> errors = ex.getBindingResult().getFieldErrors().stream()
        .map(error -> error.getField() + ": " + error.getDefaultMessage())
        .toList();
    String title = ex.getBindingResult().getFieldErrors().isEmpty()
        ? "Invalid request body"
        : ex.getBindingResult().getFieldErrors().get(0).getDefaultMessage();
    return respond(new ProblemDetail(title, HttpStatus.BAD_REQUEST.value(), "invalid_argument")
        .with("errors", errors), HttpStatus.BAD_REQUEST.value());
  }

  /**
   * Handle request bodies that cannot be parsed, including values rejected by a
   * constructor during deserialization.
   *
   * @param ex the parse exception
   * @return RFC 7807 problem+json response with 400 Bad Request
   */
  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ProblemDetail> handleNotReadable(HttpMessageNotReadableException ex) {
    meterRegistry.counter("location.errors", "code", "invalid_request").increment();
    Throwable cause = ex.getMostSpecificCause();
    return respond(new ProblemDetail(
        "Malformed request body: " + cause.getMessage(),
        HttpStatus.BAD_REQUEST.value(),
        "invalid_request"
    ), HttpStatus.BAD_REQUEST.value());
  }

  private ProblemDetail problem(LocationException ex) {
    logger.debug("Rejected request: {} ({})", ex.getMessage(), ex.getCode());
    meterRegistry.counter("location.errors", "code", ex.getCode()).increment();
    return new ProblemDetail(ex.getMessage(), ex.getStatus(), ex.getCode());
  }

  @SuppressWarnings("PMD.LooseCoupling") // HttpHeaders provides Spring-specific utility methods
  private static ResponseEntity<ProblemDetail> respond(ProblemDetail problem, int status) {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(PROBLEM_JSON);
    return new ResponseEntity<>(problem, headers, HttpStatus.valueOf(status));
  }
}
