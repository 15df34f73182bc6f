package io.itemsapi.platform.starter.core.web.autoconfig;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * CORS configuration (prefix: {@code itemsapi.web.cors}).
 *
 * <p>Any request header is accepted and the correlation header is always exposed; only origins and
 * methods are configurable. Getters return copies; setters are null-safe.
 */
@Validated
@ConfigurationProperties(prefix = "itemsapi.web.cors")
public class CorsProperties {

  /** Whether the global CORS mapping is registered at all. */
  private boolean enabled = false;

  private Set<String> allowedOrigins = new LinkedHashSet<>(Set.of("*"));
  private Set<String> allowedMethods =
      new LinkedHashSet<>(Set.of("GET", "POST", "DELETE", "OPTIONS"));

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  /** Allowed origins; {@code *} (the default) allows any. */
  public Set<String> getAllowedOrigins() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(allowedOrigins));
  }

  public void setAllowedOrigins(Set<String> allowedOrigins) {
    this.allowedOrigins =
        (allowedOrigins == null) ? new LinkedHashSet<>() : new LinkedHashSet<>(allowedOrigins);
  }

  /** Allowed methods; defaults to the methods the API serves plus preflight. */
  public Set<String> getAllowedMethods() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(allowedMethods));
  }

  public void setAllowedMethods(Set<String> allowedMethods) {
    this.allowedMethods =
        (allowedMethods == null) ? new LinkedHashSet<>() : new LinkedHashSet<>(allowedMethods);
  }
}
