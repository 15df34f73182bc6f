package io.itemsapi.items.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/** Entry point of the items API. */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ItemsServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(ItemsServiceApplication.class, args);
  }
}
