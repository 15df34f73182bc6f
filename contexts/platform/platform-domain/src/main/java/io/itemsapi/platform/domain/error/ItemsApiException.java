package io.itemsapi.platform.domain.error;

import io.itemsapi.platform.domain.error.ProblemTypes.ProblemType;
import java.io.Serial;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * ItemsApiException
 *
 * <p>Framework-agnostic domain exception carrying a {@link ProblemType}. The client only ever sees
 * {@link ProblemType#message()}; the exception message ({@link #getMessage()}) and {@link
 * #extensions()} are internal context for logs.
 *
 * <h3>Typical usage</h3>
 *
 * <pre>{@code
 * throw ItemsApiException.notFound(itemId);
 *
 * throw ItemsApiException.builder(ProblemTypes.NAME_REQUIRED)
 *     .detail("name must not be empty")
 *     .build();
 * }</pre>
 *
 * <p>Stack traces are only captured for server errors (5xx); expected 4xx outcomes skip them.
 */
public final class ItemsApiException extends RuntimeException {

  @Serial private static final long serialVersionUID = 1L;

  private static final Pattern KEBAB = Pattern.compile("^[a-z0-9]+(?:-[a-z0-9]+)*$");

  private final transient ProblemType type;
  private final transient Map<String, Object> extensions;

  private ItemsApiException(Builder b) {
    super(
        Objects.requireNonNullElse(b.detail, b.type.message()), null, true, b.type.isServerError());
    this.type = b.type;
    this.extensions = Collections.unmodifiableMap(new LinkedHashMap<>(b.extensions));
  }

  // -------------------------------------------------------------------------------------
  // Factories
  // -------------------------------------------------------------------------------------

  /**
   * Item lookup miss.
   *
   * @param itemId the id that was not found
   * @return a new exception of type {@link ProblemTypes#ITEM_NOT_FOUND}
   */
  public static ItemsApiException notFound(long itemId) {
    return builder(ProblemTypes.ITEM_NOT_FOUND)
        .detail("Item " + itemId + " not found")
        .extension("item-id", itemId)
        .build();
  }

  /**
   * Create request without a usable name.
   *
   * @return a new exception of type {@link ProblemTypes#NAME_REQUIRED}
   */
  public static ItemsApiException nameRequired() {
    return builder(ProblemTypes.NAME_REQUIRED).detail("Invalid request data").build();
  }

  /**
   * Creates a builder for {@link ItemsApiException}.
   *
   * @param type the problem type (must not be null)
   * @return a new {@link Builder}
   */
  public static Builder builder(ProblemType type) {
    return new Builder(type);
  }

  // -------------------------------------------------------------------------------------
  // Accessors
  // -------------------------------------------------------------------------------------

  /** The problem type this failure is rendered and logged as. */
  public ProblemType type() {
    return type;
  }

  /** HTTP status derived from the type. */
  public int status() {
    return type.status();
  }

  /** Unmodifiable, log-only context (kebab-case keys, JSON-primitive values). */
  public Map<String, Object> extensions() {
    return extensions;
  }

  // -------------------------------------------------------------------------------------
  // Builder
  // -------------------------------------------------------------------------------------

  /** Fluent builder for {@link ItemsApiException}. */
  public static final class Builder {
    private final ProblemType type;
    private final Map<String, Object> extensions = new LinkedHashMap<>();
    private String detail;

    private Builder(ProblemType type) {
      this.type = Objects.requireNonNull(type, "type");
    }

    /**
     * Sets the internal detail message (non-blank).
     *
     * @param detail detail text
     * @return this builder
     */
    public Builder detail(String detail) {
      if (detail == null || detail.isBlank()) {
        throw new IllegalArgumentException("detail must not be blank");
      }
      this.detail = detail;
      return this;
    }

    /**
     * Adds one extension entry.
     *
     * @param key kebab-case key
     * @param value JSON primitive (String/Number/Boolean)
     * @return this builder
     */
    public Builder extension(String key, Object value) {
      if (key == null || !KEBAB.matcher(key).matches()) {
        throw new IllegalArgumentException("extension key must be kebab-case: " + key);
      }
      if (!(value instanceof String || value instanceof Number || value instanceof Boolean)) {
        throw new IllegalArgumentException("extension value must be a JSON primitive: " + key);
      }
      this.extensions.put(key, value);
      return this;
    }

    /** Builds the exception. */
    public ItemsApiException build() {
      return new ItemsApiException(this);
    }
  }
}
