package io.itemsapi.platform.http.filters;

import static net.logstash.logback.argument.StructuredArguments.value;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Records one counter increment and one latency observation per completed request, whatever the
 * outcome.
 *
 * <p>Micrometer meters (prefix configurable, default {@code items_api}):
 *
 * <ul>
 *   <li>{@code <prefix>.http.requests} (Counter; tags: method, path, status)
 *   <li>{@code <prefix>.http.request.duration} (Timer; tags: method, path, status)
 * </ul>
 *
 * <p>{@code path} is the matched route pattern (e.g. {@code /api/items/{id}}) so cardinality stays
 * bounded; requests no handler matched are tagged {@value #UNMATCHED}.
 */
@Order(RequestMetricsFilter.ORDER)
public final class RequestMetricsFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(RequestMetricsFilter.class);

  /** Runs right after {@link CorrelationIdFilter}. */
  public static final int ORDER = CorrelationIdFilter.ORDER + 10;

  public static final String DEFAULT_PREFIX = "items_api";
  public static final String UNMATCHED = "UNMATCHED";

  // {id:\d+} -> {id}
  private static final Pattern VARIABLE_REGEX = Pattern.compile("\\{(\\w+):[^}]*}");

  private final MeterRegistry registry;
  private final String requestsCounter;
  private final String durationTimer;

  /**
   * Creates the filter.
   *
   * @param registry Micrometer registry (required)
   * @param prefix meter name prefix (blank -> {@value #DEFAULT_PREFIX})
   */
  public RequestMetricsFilter(MeterRegistry registry, String prefix) {
    this.registry = Objects.requireNonNull(registry, "registry");
    String p = (prefix == null || prefix.isBlank()) ? DEFAULT_PREFIX : prefix.trim();
    this.requestsCounter = p + ".http.requests";
    this.durationTimer = p + ".http.request.duration";
  }

  @Override
  protected void doFilterInternal(
      @NonNull HttpServletRequest request,
      @NonNull HttpServletResponse response,
      @NonNull FilterChain chain)
      throws ServletException, IOException {

    final long startNanos = System.nanoTime();
    boolean completed = false;
    try {
      chain.doFilter(request, response);
      completed = true;
    } finally {
      long elapsed = System.nanoTime() - startNanos;
      int status = completed ? response.getStatus() : 500;
      record(request.getMethod(), pathGroup(request), status, elapsed);
    }
  }

  private void record(String method, String path, int status, long elapsedNanos) {
    Tags tags = Tags.of("method", method, "path", path, "status", Integer.toString(status));
    registry.counter(requestsCounter, tags).increment();
    Timer.builder(durationTimer)
        .description("Latency of handled HTTP requests")
        .tags(tags)
        .register(registry)
        .record(elapsedNanos, TimeUnit.NANOSECONDS);

    if (log.isDebugEnabled()) {
      log.debug(
          "Completed request {} {} -> {} in {} ms",
          value("method", method),
          value("path", path),
          value("status", status),
          value("duration_ms", TimeUnit.NANOSECONDS.toMillis(elapsedNanos)));
    }
  }

  /** Route pattern with inline regex constraints stripped, or {@value #UNMATCHED}. */
  static String pathGroup(HttpServletRequest request) {
    Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
    if (!(pattern instanceof String s) || s.isBlank()) {
      return UNMATCHED;
    }
    return VARIABLE_REGEX.matcher(s).replaceAll("{$1}");
  }
}
