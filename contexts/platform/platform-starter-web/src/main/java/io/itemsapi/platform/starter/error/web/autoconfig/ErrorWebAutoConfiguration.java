package io.itemsapi.platform.starter.error.web.autoconfig;

import io.itemsapi.platform.http.error.ErrorHttpMapper;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.web.servlet.DispatcherServlet;

/**
 * Auto-config for JSON error responses.
 *
 * <ul>
 *   <li>Provides {@link ErrorHttpMapper} if missing
 *   <li>Registers {@link ErrorExceptionAdvice} without relying on component-scan
 * </ul>
 */
@AutoConfiguration
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnClass(DispatcherServlet.class)
@Import(ErrorExceptionAdvice.class)
public class ErrorWebAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public ErrorHttpMapper errorHttpMapper() {
    return new ErrorHttpMapper();
  }
}
