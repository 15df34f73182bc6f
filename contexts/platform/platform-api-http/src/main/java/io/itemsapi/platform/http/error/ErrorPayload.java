package io.itemsapi.platform.http.error;

import java.util.Objects;

/**
 * JSON error body: {@code {"error": "<message>"}}.
 *
 * @param error fixed, client-safe message
 */
public record ErrorPayload(String error) {
  public ErrorPayload {
    Objects.requireNonNull(error, "error");
  }
}
