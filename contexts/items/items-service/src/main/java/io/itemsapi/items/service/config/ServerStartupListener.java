package io.itemsapi.items.service.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

/** Logs the listening port once the embedded server is up. */
@Component
public class ServerStartupListener implements ApplicationListener<WebServerInitializedEvent> {

  private static final Logger log = LoggerFactory.getLogger(ServerStartupListener.class);

  private final ItemsServiceProperties props;

  public ServerStartupListener(ItemsServiceProperties props) {
    this.props = props;
  }

  @Override
  public void onApplicationEvent(WebServerInitializedEvent event) {
    log.info(
        "Started {} {} on port {}",
        props.getName(),
        props.getVersion(),
        event.getWebServer().getPort());
  }
}
