package io.itemsapi.platform.http.filters;

import static net.logstash.logback.argument.StructuredArguments.value;

import io.itemsapi.platform.domain.correlation.CorrelationContext;
import io.itemsapi.platform.domain.correlation.CorrelationId;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Per-request correlation filter for Servlet applications.
 *
 * <p>Responsibilities:
 *
 * <ul>
 *   <li>Generates a fresh {@link CorrelationId} for every inbound request. Client-supplied ids are
 *       ignored.
 *   <li>Binds it through {@link CorrelationContext} (ThreadLocal + {@code MDC}).
 *   <li>Emits the request-entry log event (method, path).
 *   <li>Echoes the id on the response header (default {@code X-Request-Id}).
 *   <li>Restores the previous context after the chain completes, whatever the outcome.
 * </ul>
 *
 * <p>Thread-safety: stateless and thus thread-safe. Runs first so every later component (metrics,
 * handlers, exception advice) sees the bound id.
 */
@Order(CorrelationIdFilter.ORDER)
public final class CorrelationIdFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(CorrelationIdFilter.class);

  /** Run before every other application filter. */
  public static final int ORDER = Ordered.HIGHEST_PRECEDENCE + 10;

  public static final String DEFAULT_RESPONSE_HEADER = "X-Request-Id";

  private final String responseHeader;
  private final boolean echoHeader;

  /**
   * Creates the filter.
   *
   * @param responseHeader header name the id is echoed on (blank -> {@code X-Request-Id})
   * @param echoHeader whether to set the response header at all
   */
  public CorrelationIdFilter(String responseHeader, boolean echoHeader) {
    this.responseHeader =
        (responseHeader == null || responseHeader.isBlank())
            ? DEFAULT_RESPONSE_HEADER
            : responseHeader.trim();
    this.echoHeader = echoHeader;
  }

  @Override
  protected void doFilterInternal(
      @NonNull HttpServletRequest request,
      @NonNull HttpServletResponse response,
      @NonNull FilterChain chain)
      throws ServletException, IOException {

    CorrelationId id = CorrelationId.generate();
    if (echoHeader) {
      response.setHeader(responseHeader, id.value());
    }

    try (CorrelationContext.Scope ignored = CorrelationContext.open(id)) {
      log.info(
          "Incoming request {} {}",
          value("method", request.getMethod()),
          value("path", request.getRequestURI()));
      chain.doFilter(request, response);
    }
  }

  /** Returns the header the id is echoed on. */
  public String responseHeader() {
    return responseHeader;
  }
}
