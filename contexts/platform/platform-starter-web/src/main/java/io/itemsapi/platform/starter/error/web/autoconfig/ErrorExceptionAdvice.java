package io.itemsapi.platform.starter.error.web.autoconfig;

import static net.logstash.logback.argument.StructuredArguments.kv;

import io.itemsapi.platform.domain.correlation.CorrelationContext;
import io.itemsapi.platform.domain.correlation.CorrelationId;
import io.itemsapi.platform.domain.error.ItemsApiException;
import io.itemsapi.platform.domain.error.ProblemTypes;
import io.itemsapi.platform.domain.error.ProblemTypes.ProblemType;
import io.itemsapi.platform.http.error.ErrorHttpMapper;
import io.itemsapi.platform.http.error.ErrorPayload;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.event.Level;
import org.slf4j.spi.LoggingEventBuilder;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Centralized error mapping for web endpoints.
 *
 * <p>Every failure resolves to exactly one {@link ProblemType}, is logged once at the type's
 * severity with the bound correlation id, and is rendered as {@code {"error": message}} by {@link
 * ErrorHttpMapper}. Internal details never reach the response body.
 */
@Order(Ordered.HIGHEST_PRECEDENCE)
@RestControllerAdvice
public class ErrorExceptionAdvice {

  private static final Logger log = LoggerFactory.getLogger(ErrorExceptionAdvice.class);

  private final ErrorHttpMapper mapper;

  /**
   * Creates the advice.
   *
   * @param mapper maps problem types to JSON responses
   */
  public ErrorExceptionAdvice(ErrorHttpMapper mapper) {
    this.mapper = mapper;
  }

  // -------------------------- Domain --------------------------

  /** Maps {@link ItemsApiException} to its declared type. */
  @ExceptionHandler(ItemsApiException.class)
  public ResponseEntity<ErrorPayload> handleItemsApi(ItemsApiException ex) {
    report(ex.type(), ex.getMessage(), ex.extensions(), ex.type().isServerError() ? ex : null);
    return mapper.toResponse(ex.type());
  }

  // -------------------------- Dispatch boundary --------------------------

  /** No handler for the method and path. */
  @ExceptionHandler({NoHandlerFoundException.class, NoResourceFoundException.class})
  public ResponseEntity<ErrorPayload> handleNoRoute(HttpServletRequest req, Exception ex) {
    return routeNotFound(req);
  }

  /** Path variable matched the route but does not convert (e.g. id out of range). */
  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ErrorPayload> handleTypeMismatch(
      HttpServletRequest req, MethodArgumentTypeMismatchException ex) {
    return routeNotFound(req);
  }

  /** Maps method not allowed to 405 and sets Allow if available. */
  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ErrorPayload> handleMethodNotAllowed(
      HttpServletRequest req, HttpRequestMethodNotSupportedException ex) {
    ProblemType type = ProblemTypes.METHOD_NOT_ALLOWED;
    report(
        type, "Method " + req.getMethod() + " not allowed on " + req.getRequestURI(), Map.of(), null);

    HttpHeaders headers = new HttpHeaders();
    Set<HttpMethod> supported = ex.getSupportedHttpMethods();
    if (supported != null && !supported.isEmpty()) {
      headers.setAllow(supported);
    }
    return mapper.toResponse(type, headers);
  }

  // -------------------------- Request body --------------------------

  /** Absent or malformed JSON body on create. */
  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorPayload> handleUnreadable(HttpMessageNotReadableException ex) {
    ProblemType type = ProblemTypes.NAME_REQUIRED;
    report(type, "Invalid request data", Map.of(), null);
    return mapper.toResponse(type);
  }

  /** Body is not JSON. */
  @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
  public ResponseEntity<ErrorPayload> handleUnsupported(HttpMediaTypeNotSupportedException ex) {
    ProblemType type = ProblemTypes.UNSUPPORTED_MEDIA_TYPE;
    report(type, "Unsupported content type " + ex.getContentType(), Map.of(), null);

    HttpHeaders headers = new HttpHeaders();
    if (!ex.getSupportedMediaTypes().isEmpty()) {
      headers.setAccept(ex.getSupportedMediaTypes());
    }
    return mapper.toResponse(type, headers);
  }

  // -------------------------- Explicit status exceptions --------------------------

  /** Keeps the status of a {@link ResponseStatusException}; its reason goes to the log only. */
  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ErrorPayload> handleResponseStatus(ResponseStatusException ex) {
    return statusOnly(ex.getStatusCode().value(), ex.getReason());
  }

  /**
   * Keeps the status of any other status-carrying framework exception ({@link
   * ErrorResponseException}, or a negotiation failure such as {@link
   * HttpMediaTypeNotAcceptableException}).
   */
  @ExceptionHandler({ErrorResponseException.class, HttpMediaTypeNotAcceptableException.class})
  public ResponseEntity<ErrorPayload> handleErrorResponse(Exception ex) {
    ErrorResponse er = (ErrorResponse) ex;
    return statusOnly(er.getStatusCode().value(), er.getBody().getDetail());
  }

  // -------------------------- Fallback --------------------------

  /** Final safety net: hides internals and returns a 500. */
  @ExceptionHandler(Throwable.class)
  public ResponseEntity<ErrorPayload> handleOther(Throwable ex) {
    ProblemType type = ProblemTypes.INTERNAL_ERROR;
    report(type, "Internal server error", Map.of(), ex);
    return mapper.toResponse(type);
  }

  // -------------------------- helpers --------------------------

  private ResponseEntity<ErrorPayload> statusOnly(int status, String detail) {
    HttpStatus known = HttpStatus.resolve(status);
    ProblemType type =
        ProblemTypes.forStatus(status, known == null ? null : known.getReasonPhrase());
    String message = (detail == null || detail.isBlank()) ? "Request failed" : detail;
    report(type, message + " (status " + status + ")", Map.of(), null);
    return mapper.toResponse(type);
  }

  private ResponseEntity<ErrorPayload> routeNotFound(HttpServletRequest req) {
    ProblemType type = ProblemTypes.ROUTE_NOT_FOUND;
    report(type, "No route for " + req.getMethod() + " " + req.getRequestURI(), Map.of(), null);
    return mapper.toResponse(type);
  }

  /**
   * Emits one log event for a failure, tagged with {@link CorrelationContext#currentOrUnknown()}
   * (the bound id, or {@value CorrelationId#UNKNOWN} when the failure happened before the
   * correlation filter ran).
   */
  private static void report(
      ProblemType type, String message, Map<String, Object> extensions, Throwable cause) {
    String previous = MDC.get(CorrelationContext.MDC_REQUEST_ID);
    MDC.put(CorrelationContext.MDC_REQUEST_ID, CorrelationContext.currentOrUnknown());
    try {
      LoggingEventBuilder event =
          log.atLevel(toLevel(type.severity()))
              .addArgument(kv("problem", type.slug()))
              .addArgument(kv("status", type.status()));
      extensions.forEach((k, v) -> event.addArgument(kv(k.replace('-', '_'), v)));
      if (cause != null) {
        event.setCause(cause);
      }
      event.log(message);
    } finally {
      if (previous == null) {
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
      } else {
        MDC.put(CorrelationContext.MDC_REQUEST_ID, previous);
      }
    }
  }

  private static Level toLevel(ProblemTypes.Severity severity) {
    return switch (severity) {
      case WARN -> Level.WARN;
      case ERROR -> Level.ERROR;
    };
  }
}
