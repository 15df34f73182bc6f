package io.itemsapi.items.service.web.dto;

import io.itemsapi.items.domain.Item;
import java.util.List;

/**
 * Body of {@code GET /api/items}.
 *
 * @param items items in insertion order
 * @param count number of items
 */
public record ItemListResponse(List<ItemResponse> items, int count) {

  public static ItemListResponse of(List<Item> items) {
    List<ItemResponse> rendered = items.stream().map(ItemResponse::from).toList();
    return new ItemListResponse(rendered, rendered.size());
  }
}
