package org.cim.location.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.MDC;

/**
 * RFC 7807 Problem Details for HTTP APIs.
 * Used for all error responses of the location API (application/problem+json).
 *
 * <p>The problem {@code type} is derived from the canonical error code, so clients can
 * switch on either. Extension members (cycle path, conflicting versions) are written as
 * top-level fields.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProblemDetail {

  static final String TYPE_PREFIX = "urn:cim:location:problem:";

  private final String type;
  private final String title;
  private final int status;
  private final String code;
  private final String correlationId;
  private final Map<String, Object> extensions = new LinkedHashMap<>();

  /**
   * Creates a problem for the given error code.
   * The correlation id is taken from the current request's MDC, if any.
   *
   * @param title human-readable summary
   * @param status HTTP status code
   * @param code canonical error code
   */
  public ProblemDetail(String title, int status, String code) {
    this.type = TYPE_PREFIX + code;
    this.title = title;
    this.status = status;
    this.code = code;
    this.correlationId = MDC.get("correlationId");
  }

  /**
   * Adds an extension member.
   *
   * @param name the member name
   * @param value the member value
   * @return this problem
   */
  public ProblemDetail with(String name, Object value) {
    extensions.put(name, value);
    return this;
  }

  public String getType() {
    return type;
  }

  public String getTitle() {
    return title;
  }

  public int getStatus() {
    return status;
  }

  public String getCode() {
    return code;
  }

  public String getCorrelationId() {
    return correlationId;
  }

  @JsonAnyGetter
  public Map<String, Object> getExtras() {
    return Collections.unmodifiableMap(extensions);
  }
}
