package io.itemsapi.platform.starter.core.web.autoconfig;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Correlation ID settings (prefix: {@code itemsapi.web.correlation}).
 *
 * <p>Ids are always generated server-side; these settings only control how they are echoed.
 */
@Validated
@ConfigurationProperties(prefix = "itemsapi.web.correlation")
public class CorrelationProperties {

  /** Response header carrying the request's correlation id. */
  @NotBlank private String header = "X-Request-Id";

  /** Whether to echo the id on responses. */
  private boolean echoHeader = true;

  public String getHeader() {
    return header;
  }

  public void setHeader(String header) {
    this.header = header;
  }

  public boolean isEchoHeader() {
    return echoHeader;
  }

  public void setEchoHeader(boolean echoHeader) {
    this.echoHeader = echoHeader;
  }
}
