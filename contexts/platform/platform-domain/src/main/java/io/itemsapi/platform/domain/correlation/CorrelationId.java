package io.itemsapi.platform.domain.correlation;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable per-request correlation identifier.
 *
 * <p>- Generated from a random (v4) UUID: 122 bits of randomness, rendered in canonical form. <br>
 * - Carries no business meaning; never validated or deduplicated. <br>
 * - Framework-agnostic (pure domain).
 */
public record CorrelationId(String value) implements Serializable {

  @Serial private static final long serialVersionUID = 1L;

  /** Placeholder used in logs when no correlation id has been bound. */
  public static final String UNKNOWN = "unknown";

  public CorrelationId {
    Objects.requireNonNull(value, "correlationId must not be null");
    if (value.isBlank()) {
      throw new IllegalArgumentException("correlationId must not be blank");
    }
  }

  /**
   * Generates a fresh, effectively-unique identifier.
   *
   * @return a new {@link CorrelationId}
   */
  public static CorrelationId generate() {
    return new CorrelationId(UUID.randomUUID().toString());
  }

  @Override
  public String toString() {
    return value;
  }
}
