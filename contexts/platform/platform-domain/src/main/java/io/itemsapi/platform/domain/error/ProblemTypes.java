package io.itemsapi.platform.domain.error;

import java.util.List;
import java.util.Objects;

/**
 * ProblemTypes
 *
 * <p>Central registry of the error kinds the items API can surface. Each type carries a stable
 * kebab-case slug, the fixed client-facing message rendered as {@code {"error": message}}, the
 * HTTP status it maps to and the severity it is logged at.
 *
 * <h2>Principles</h2>
 *
 * <ul>
 *   <li><b>Fixed messages:</b> client messages never contain request data or internal detail.
 *   <li><b>Framework-agnostic:</b> no Spring or servlet dependencies here; the HTTP layer maps
 *       types to responses.
 *   <li><b>One outcome per failure:</b> every failure path resolves to exactly one type.
 * </ul>
 */
public final class ProblemTypes {

  // -------------------------------------------------------------------------------------
  // Item operations
  // -------------------------------------------------------------------------------------

  /** 404 – Requested item id does not exist in the store. */
  public static final ProblemType ITEM_NOT_FOUND =
      def("item-not-found", "Item not found", 404, Severity.WARN);

  /** 400 – Create request without a (non-empty) name. */
  public static final ProblemType NAME_REQUIRED =
      def("name-required", "Name is required", 400, Severity.ERROR);

  // -------------------------------------------------------------------------------------
  // Dispatch boundary
  // -------------------------------------------------------------------------------------

  /** 404 – No handler matches the method and path (includes malformed path ids). */
  public static final ProblemType ROUTE_NOT_FOUND =
      def("route-not-found", "Endpoint not found", 404, Severity.WARN);

  /** 405 – Path exists but not for this HTTP method. */
  public static final ProblemType METHOD_NOT_ALLOWED =
      def("method-not-allowed", "Method not allowed", 405, Severity.WARN);

  /** 415 – Request body is not JSON. */
  public static final ProblemType UNSUPPORTED_MEDIA_TYPE =
      def("unsupported-media-type", "Unsupported media type", 415, Severity.ERROR);

  // -------------------------------------------------------------------------------------
  // Fallback
  // -------------------------------------------------------------------------------------

  /** 500 – Any unexpected failure while handling a request. */
  public static final ProblemType INTERNAL_ERROR =
      def("internal-error", "Internal server error", 500, Severity.ERROR);

  /** Types a status-carrying framework exception is matched against before falling back. */
  private static final List<ProblemType> DISPATCH =
      List.of(ROUTE_NOT_FOUND, METHOD_NOT_ALLOWED, UNSUPPORTED_MEDIA_TYPE);

  private ProblemTypes() {}

  /**
   * Resolves the type for a failure that only carries an HTTP status (e.g. a framework exception
   * raised outside the item handlers).
   *
   * <p>Dispatch statuses (404, 405, 415) map to their catalog entry; any status outside 4xx maps to
   * {@link #INTERNAL_ERROR}; other 4xx statuses get an ad-hoc type with the given message.
   *
   * @param status HTTP status code
   * @param message client message for an ad-hoc 4xx type
   * @return the matching type, never null
   */
  public static ProblemType forStatus(int status, String message) {
    for (ProblemType t : DISPATCH) {
      if (t.status() == status) {
        return t;
      }
    }
    if (status < 400 || status > 499) {
      return INTERNAL_ERROR;
    }
    String text =
        (message == null || message.isBlank()) ? "Request could not be processed" : message;
    return def("http-" + status, text, status, Severity.WARN);
  }

  private static ProblemType def(String slug, String message, int status, Severity severity) {
    return new ProblemType(slug, message, status, severity);
  }

  /** Log severity a problem is reported at. */
  public enum Severity {
    WARN,
    ERROR
  }

  /**
   * Immutable descriptor of one error kind.
   *
   * @param slug stable kebab-case identifier, used in logs and metrics
   * @param message fixed client-facing message
   * @param status HTTP status code
   * @param severity log severity
   */
  public record ProblemType(String slug, String message, int status, Severity severity) {
    public ProblemType {
      Objects.requireNonNull(slug, "slug");
      Objects.requireNonNull(message, "message");
      Objects.requireNonNull(severity, "severity");
      if (status < 400 || status > 599) {
        throw new IllegalArgumentException("status must be a 4xx/5xx code: " + status);
      }
    }

    /** Returns {@code true} for server-side faults (5xx). */
    public boolean isServerError() {
      return status >= 500;
    }
  }
}
