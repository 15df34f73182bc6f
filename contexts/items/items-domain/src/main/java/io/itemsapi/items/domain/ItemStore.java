package io.itemsapi.items.domain;

import io.itemsapi.platform.domain.error.ItemsApiException;
import java.util.List;

/**
 * Authoritative holder of {@link Item}s and of the identifier counter.
 *
 * <p>Implementations must be safe for concurrent use: identifier allocation never races, and
 * readers never observe a partially added or removed item. Failures are signalled with {@link
 * ItemsApiException}; no operation returns a silent default.
 */
public interface ItemStore {

  /**
   * Returns all items in insertion order (oldest first).
   *
   * @return an immutable snapshot, possibly empty
   */
  List<Item> list();

  /**
   * Returns the item with the given id.
   *
   * @param id item id
   * @return the item
   * @throws ItemsApiException of type {@code ITEM_NOT_FOUND} if no such item exists
   */
  Item get(long id);

  /**
   * Creates an item with the next identifier and the current timestamp.
   *
   * @param name required, non-empty
   * @param description optional; {@code null} is stored as an empty string
   * @return the created item
   * @throws ItemsApiException of type {@code NAME_REQUIRED} if {@code name} is null or empty
   */
  Item create(String name, String description);

  /**
   * Removes the item with the given id. Remaining items keep their ids and order.
   *
   * @param id item id
   * @return the removed item
   * @throws ItemsApiException of type {@code ITEM_NOT_FOUND} if no such item exists
   */
  Item delete(long id);
}
