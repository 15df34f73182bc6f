package io.itemsapi.items.service.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import io.itemsapi.items.domain.Item;
import io.itemsapi.items.domain.ItemStore;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class ItemStoreConfigurationTest {

  private static final Clock FIXED =
      Clock.fixed(Instant.parse("2026-10-19T08:30:00Z"), ZoneOffset.UTC);

  @Configuration(proxyBeanMethods = false)
  @EnableConfigurationProperties(ItemsServiceProperties.class)
  static class PropertiesConfig {}

  private final ApplicationContextRunner runner =
      new ApplicationContextRunner()
          .withUserConfiguration(PropertiesConfig.class, ItemStoreConfiguration.class);

  @Test
  void seedsTwoItemsAndContinuesNumbering() {
    runner
        .withBean(Clock.class, () -> FIXED)
        .run(
            ctx -> {
              ItemStore store = ctx.getBean(ItemStore.class);
              assertThat(store.list())
                  .extracting(Item::id, Item::name, Item::description)
                  .containsExactly(
                      tuple(1L, "Item 1", "First item"),
                      tuple(2L, "Item 2", "Second item"));
              assertThat(store.list()).allMatch(i -> i.createdAt().equals(FIXED.instant()));
              assertThat(store.create("Widget", null).id()).isEqualTo(3L);
            });
  }

  @Test
  void seedingCanBeDisabled() {
    runner
        .withPropertyValues("items.service.seed-enabled=false")
        .run(
            ctx -> {
              ItemStore store = ctx.getBean(ItemStore.class);
              assertThat(store.list()).isEmpty();
              assertThat(store.create("First", "").id()).isEqualTo(1L);
              assertThat(ctx).hasSingleBean(Clock.class);
            });
  }
}
