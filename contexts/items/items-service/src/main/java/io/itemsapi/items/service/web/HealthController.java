package io.itemsapi.items.service.web;

import io.itemsapi.items.service.config.ItemsServiceProperties;
import io.itemsapi.items.service.web.dto.HealthResponse;
import java.time.Clock;
import java.time.Instant;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Liveness endpoint. Independent of store contents; never fails. */
@RestController
public class HealthController {

  private final ItemsServiceProperties props;
  private final Clock clock;

  public HealthController(ItemsServiceProperties props, Clock clock) {
    this.props = props;
    this.clock = clock;
  }

  @GetMapping("/health")
  public HealthResponse health() {
    return new HealthResponse(
        HealthResponse.HEALTHY, Instant.now(clock), props.getName(), props.getVersion());
  }
}
