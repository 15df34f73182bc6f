package io.itemsapi.items.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable item as held by an {@link ItemStore}.
 *
 * @param id store-assigned identifier, strictly positive
 * @param name non-empty name
 * @param description free text, never {@code null} (empty when not supplied)
 * @param createdAt creation instant, fixed at creation
 */
public record Item(long id, String name, String description, Instant createdAt) {

  public Item {
    if (id <= 0) {
      throw new IllegalArgumentException("id must be strictly positive: " + id);
    }
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(description, "description");
    Objects.requireNonNull(createdAt, "createdAt");
  }
}
