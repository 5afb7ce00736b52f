package org.cim.location.filter;

import com.github.f4b6a3.uuid.UuidCreator;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet filter that assigns a correlation ID to each HTTP request.
 * The ID is stored in SLF4J MDC for logging, copied into the Kafka headers of every
 * event the request produces, and echoed back in the response.
 *
 * <p>A caller-supplied {@code X-Correlation-ID} is reused; otherwise a UUIDv7 is generated.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

  /**
   * MDC key for correlation ID (used in logging pattern and EventPublisher).
   */
  public static final String CORRELATION_ID_KEY = "correlationId";

  /**
   * Request and response header carrying the correlation ID.
   */
  public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

  private static final int MAX_HEADER_LENGTH = 128;

  @Override
  protected void doFilterInternal(HttpServletRequest request,
                                  HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    String correlationId = request.getHeader(CORRELATION_ID_HEADER);
    if (correlationId == null || correlationId.isBlank()
        || correlationId.length() > MAX_HEADER_LENGTH) {
      correlationId = UuidCreator.getTimeOrderedEpoch().toString();
    }

    MDC.put(CORRELATION_ID_KEY, correlationId);
    response.setHeader(CORRELATION_ID_HEADER, correlationId);

    try {
      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(CORRELATION_ID_KEY);
    }
  }
}
