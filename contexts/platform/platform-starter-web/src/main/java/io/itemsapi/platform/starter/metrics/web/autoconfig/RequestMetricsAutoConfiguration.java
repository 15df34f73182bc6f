package io.itemsapi.platform.starter.metrics.web.autoconfig;

import static jakarta.servlet.DispatcherType.ASYNC;
import static jakarta.servlet.DispatcherType.REQUEST;

import io.itemsapi.platform.http.filters.RequestMetricsFilter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumSet;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;

/**
 * Registers {@link RequestMetricsFilter} once a {@link MeterRegistry} is available (normally
 * provided by Spring Boot Actuator).
 */
@AutoConfiguration(
    afterName =
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnClass(MeterRegistry.class)
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(
    prefix = "itemsapi.web.metrics",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
@EnableConfigurationProperties(RequestMetricsProperties.class)
public class RequestMetricsAutoConfiguration {

  /**
   * Registers the metrics filter right after the correlation filter.
   *
   * @param registry meter registry
   * @param p metrics properties
   * @return filter registration bean
   */
  @Bean(name = "requestMetricsFilterRegistration")
  @ConditionalOnMissingBean(name = "requestMetricsFilterRegistration")
  public FilterRegistrationBean<RequestMetricsFilter> requestMetricsFilter(
      MeterRegistry registry, RequestMetricsProperties p) {
    var reg = new FilterRegistrationBean<>(new RequestMetricsFilter(registry, p.getPrefix()));
    reg.setDispatcherTypes(EnumSet.of(REQUEST, ASYNC));
    reg.setOrder(RequestMetricsFilter.ORDER);
    reg.addUrlPatterns("/*");
    reg.setAsyncSupported(true);
    return reg;
  }
}
