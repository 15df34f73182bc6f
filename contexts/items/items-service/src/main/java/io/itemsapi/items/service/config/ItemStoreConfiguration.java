package io.itemsapi.items.service.config;

import io.itemsapi.items.domain.InMemoryItemStore;
import io.itemsapi.items.domain.ItemStore;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the single, process-local {@link ItemStore}. */
@Configuration(proxyBeanMethods = false)
public class ItemStoreConfiguration {

  private static final Logger log = LoggerFactory.getLogger(ItemStoreConfiguration.class);

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /**
   * Creates the store and, unless disabled, seeds it through the regular create path so the id
   * counter continues after the seed items.
   *
   * @param clock clock used for creation timestamps
   * @param props service properties
   * @return the shared store
   */
  @Bean
  public ItemStore itemStore(Clock clock, ItemsServiceProperties props) {
    InMemoryItemStore store = new InMemoryItemStore(clock);
    if (props.isSeedEnabled()) {
      store.create("Item 1", "First item");
      store.create("Item 2", "Second item");
      log.info("Seeded item store with {} items", store.list().size());
    }
    return store;
  }
}
