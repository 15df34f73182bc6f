package io.itemsapi.items.service.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity and startup settings (prefix: {@code items.service}).
 *
 * <p>Only affects the health payload and startup seeding; never the shape of item payloads.
 */
@Validated
@ConfigurationProperties(prefix = "items.service")
public class ItemsServiceProperties {

  /** Service name reported by {@code /health}. */
  @NotBlank private String name = "devops-project-api";

  /** Service version reported by {@code /health}. */
  @NotBlank private String version = "1.0.0";

  /** Whether the store starts with the two demo items. */
  private boolean seedEnabled = true;

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getVersion() {
    return version;
  }

  public void setVersion(String version) {
    this.version = version;
  }

  public boolean isSeedEnabled() {
    return seedEnabled;
  }

  public void setSeedEnabled(boolean seedEnabled) {
    this.seedEnabled = seedEnabled;
  }
}
