package io.itemsapi.platform.starter.metrics.web.autoconfig;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Prefix: itemsapi.web.metrics */
@Validated
@ConfigurationProperties(prefix = "itemsapi.web.metrics")
public class RequestMetricsProperties {

  /** Record per-request counter and timer. */
  private boolean enabled = true;

  /** Meter name prefix. */
  @NotBlank private String prefix = "items_api";

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public String getPrefix() {
    return prefix;
  }

  public void setPrefix(String prefix) {
    this.prefix = prefix;
  }
}
