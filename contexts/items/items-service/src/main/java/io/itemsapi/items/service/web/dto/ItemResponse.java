package io.itemsapi.items.service.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.itemsapi.items.domain.Item;
import java.time.Instant;

/**
 * Item as rendered on the wire.
 *
 * @param id store-assigned id
 * @param name item name
 * @param description description, empty when not supplied
 * @param createdAt creation instant, ISO-8601
 */
public record ItemResponse(
    long id, String name, String description, @JsonProperty("created_at") Instant createdAt) {

  public static ItemResponse from(Item item) {
    return new ItemResponse(item.id(), item.name(), item.description(), item.createdAt());
  }
}
