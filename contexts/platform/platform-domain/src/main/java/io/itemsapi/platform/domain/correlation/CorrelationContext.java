package io.itemsapi.platform.domain.correlation;

import java.util.Objects;
import java.util.Optional;
import org.slf4j.MDC;

/**
 * Request-scoped correlation holder.
 *
 * <p>- Pure domain; no Spring dependencies. <br>
 * - Mirrors the active id to MDC ({@value #MDC_REQUEST_ID}) for JSON logs. <br>
 * - Deterministic scope restoration (no context bleed between requests sharing a worker thread).
 */
public final class CorrelationContext {

  /** MDC key for logs (must align with logging config). */
  public static final String MDC_REQUEST_ID = "request_id";

  private static final ThreadLocal<CorrelationId> TL_ID = new ThreadLocal<>();

  private CorrelationContext() {}

  // ---------------- Scoping ----------------

  /**
   * Opens a correlation scope and switches MDC accordingly.
   *
   * <p>Call {@link Scope#close()} in a finally block (or use try-with-resources) to restore the
   * previous context.
   *
   * @param id the id to bind
   * @return a {@link Scope} that restores the previous id/MDC on close
   * @throws NullPointerException if {@code id} is null
   */
  public static Scope open(CorrelationId id) {
    Objects.requireNonNull(id, "id");
    final CorrelationId prev = TL_ID.get();
    final String prevMdc = MDC.get(MDC_REQUEST_ID);

    TL_ID.set(id);
    MDC.put(MDC_REQUEST_ID, id.value());
    return new Scope(prev, prevMdc);
  }

  // ---------------- Accessors ----------------

  /**
   * Returns the id bound to the current thread, if any.
   *
   * @return optional correlation id
   */
  public static Optional<CorrelationId> current() {
    return Optional.ofNullable(TL_ID.get());
  }

  /**
   * Returns the current id's value, or {@link CorrelationId#UNKNOWN} when nothing is bound.
   *
   * @return correlation id value for logs and error paths
   */
  public static String currentOrUnknown() {
    CorrelationId id = TL_ID.get();
    return id == null ? CorrelationId.UNKNOWN : id.value();
  }

  // ---------------- Scope ----------------

  /** Disposable scope that restores the previous ThreadLocal/MDC id on close. */
  public static final class Scope implements AutoCloseable {
    private final CorrelationId previousId;
    private final String previousMdc;

    private Scope(CorrelationId previousId, String previousMdc) {
      this.previousId = previousId;
      this.previousMdc = previousMdc;
    }

    /** Restores the previous correlation id and MDC value. */
    @Override
    public void close() {
      if (previousId == null) {
        TL_ID.remove();
      } else {
        TL_ID.set(previousId);
      }

      if (previousMdc == null) {
        MDC.remove(MDC_REQUEST_ID);
      } else {
        MDC.put(MDC_REQUEST_ID, previousMdc);
      }
    }
  }
}
