package io.itemsapi.platform.starter.core.web.autoconfig;

import static jakarta.servlet.DispatcherType.ASYNC;
import static jakarta.servlet.DispatcherType.REQUEST;

import io.itemsapi.platform.http.filters.CorrelationIdFilter;
import jakarta.servlet.DispatcherType;
import java.util.EnumSet;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.DispatcherServlet;
import org.springframework.web.servlet.config.annotation.ContentNegotiationConfigurer;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Core, always-on web wiring (no domain/app coupling).
 *
 * <ul>
 *   <li>CorrelationIdFilter (request id / MDC / entry log)
 *   <li>JSON-only content negotiation
 *   <li>Optional simple CORS from properties
 * </ul>
 */
@AutoConfiguration
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnClass(DispatcherServlet.class)
@EnableConfigurationProperties({CorrelationProperties.class, CorsProperties.class})
public class CoreWebAutoConfiguration {

  static final EnumSet<DispatcherType> DEFAULT_DISPATCHERS = EnumSet.of(REQUEST, ASYNC);

  // -----------------------------------------------------------------------------------------------
  // Correlation Id
  // -----------------------------------------------------------------------------------------------

  /**
   * Registers {@link CorrelationIdFilter} ahead of every other application filter.
   *
   * @param p correlation properties
   * @return filter registration bean
   */
  @Bean(name = "correlationIdFilterRegistration")
  @ConditionalOnMissingBean(name = "correlationIdFilterRegistration")
  public FilterRegistrationBean<CorrelationIdFilter> correlationIdFilter(CorrelationProperties p) {
    var filter = new CorrelationIdFilter(p.getHeader(), p.isEchoHeader());
    var reg = new FilterRegistrationBean<>(filter);
    reg.setDispatcherTypes(DEFAULT_DISPATCHERS);
    reg.setOrder(CorrelationIdFilter.ORDER);
    reg.addUrlPatterns("/*");
    reg.setAsyncSupported(true);
    return reg;
  }

  // -----------------------------------------------------------------------------------------------
  // Content negotiation
  // -----------------------------------------------------------------------------------------------

  /**
   * Every handler answers JSON whatever the client's {@code Accept} header says, so a request is
   * never failed after its handler already ran just because the response could not be negotiated.
   */
  @Bean(name = "jsonContentNegotiationConfigurer")
  @ConditionalOnMissingBean(name = "jsonContentNegotiationConfigurer")
  public WebMvcConfigurer jsonContentNegotiationConfigurer() {
    return new WebMvcConfigurer() {
      @Override
      public void configureContentNegotiation(ContentNegotiationConfigurer configurer) {
        configurer.ignoreAcceptHeader(true).defaultContentType(MediaType.APPLICATION_JSON);
      }
    };
  }

  // -----------------------------------------------------------------------------------------------
  // CORS (simple, optional)
  // -----------------------------------------------------------------------------------------------

  /**
   * Adds a global CORS mapping based on {@link CorsProperties}. The correlation header is exposed
   * so browser clients can read it.
   *
   * @param p CORS properties
   * @param correlation correlation properties (exposed header name)
   */
  @Bean(name = "corsConfigurer")
  @ConditionalOnProperty(prefix = "itemsapi.web.cors", name = "enabled", havingValue = "true")
  public WebMvcConfigurer corsConfigurer(CorsProperties p, CorrelationProperties correlation) {
    return new WebMvcConfigurer() {
      @Override
      public void addCorsMappings(CorsRegistry reg) {
        reg.addMapping("/**")
            .allowedOrigins(p.getAllowedOrigins().toArray(String[]::new))
            .allowedMethods(p.getAllowedMethods().toArray(String[]::new))
            .allowedHeaders("*")
            .exposedHeaders(correlation.getHeader());
      }
    };
  }
}
