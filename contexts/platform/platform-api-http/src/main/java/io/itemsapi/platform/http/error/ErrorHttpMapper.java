package io.itemsapi.platform.http.error;

import io.itemsapi.platform.domain.error.ProblemTypes.ProblemType;
import java.util.Objects;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

/**
 * Maps a domain {@link ProblemType} to the HTTP response the client receives.
 *
 * <p>Pure mapping: the body is always {@link ErrorPayload} built from {@link
 * ProblemType#message()}, the status is {@link ProblemType#status()}, and the content type is
 * {@code application/json}. Internal detail never reaches the body.
 *
 * <p>Thread-safety: stateless and therefore thread-safe.
 */
public final class ErrorHttpMapper {

  /**
   * Builds the response for a problem type.
   *
   * @param type the problem type (must not be {@code null})
   * @param headersOrNull extra headers (may be {@code null})
   * @return a JSON response entity
   */
  public ResponseEntity<ErrorPayload> toResponse(ProblemType type, HttpHeaders headersOrNull) {
    Objects.requireNonNull(type, "problem type");
    HttpHeaders headers = (headersOrNull == null ? new HttpHeaders() : headersOrNull);
    headers.setContentType(MediaType.APPLICATION_JSON);
    return new ResponseEntity<>(
        new ErrorPayload(type.message()), headers, HttpStatusCode.valueOf(type.status()));
  }

  /** Same as {@link #toResponse(ProblemType, HttpHeaders)} without extra headers. */
  public ResponseEntity<ErrorPayload> toResponse(ProblemType type) {
    return toResponse(type, null);
  }
}
