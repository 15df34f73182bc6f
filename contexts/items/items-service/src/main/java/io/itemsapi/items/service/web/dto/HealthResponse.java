package io.itemsapi.items.service.web.dto;

import java.time.Instant;

/**
 * Body of {@code GET /health}.
 *
 * @param status always {@code healthy} while the process serves requests
 * @param timestamp time of the check
 * @param service configured service name
 * @param version configured service version
 */
public record HealthResponse(String status, Instant timestamp, String service, String version) {

  public static final String HEALTHY = "healthy";
}
