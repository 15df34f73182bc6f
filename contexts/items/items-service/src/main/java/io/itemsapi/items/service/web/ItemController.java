package io.itemsapi.items.service.web;

import static net.logstash.logback.argument.StructuredArguments.value;

import io.itemsapi.items.domain.Item;
import io.itemsapi.items.domain.ItemStore;
import io.itemsapi.items.service.web.dto.CreateItemRequest;
import io.itemsapi.items.service.web.dto.ItemListResponse;
import io.itemsapi.items.service.web.dto.ItemResponse;
import io.itemsapi.items.service.web.dto.MessageResponse;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Item handlers. Each one calls exactly one {@link ItemStore} operation and maps the result to a
 * response body; store failures propagate as {@code ItemsApiException} and are rendered by the
 * platform exception advice.
 *
 * <p>The {@code \d+} constraint on ids keeps non-numeric ids a routing miss (404 "Endpoint not
 * found") rather than a handler error.
 */
@RestController
@RequestMapping("/api/items")
public class ItemController {

  private static final Logger log = LoggerFactory.getLogger(ItemController.class);

  private final ItemStore store;

  public ItemController(ItemStore store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  @GetMapping
  public ItemListResponse list() {
    log.info("Fetching all items");
    List<Item> items = store.list();
    return ItemListResponse.of(items);
  }

  @GetMapping("/{id:\\d+}")
  public ItemResponse get(@PathVariable("id") long id) {
    log.info("Fetching item {}", value("item_id", id));
    return ItemResponse.from(store.get(id));
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public ItemResponse create(@RequestBody CreateItemRequest body) {
    Item item = store.create(body.name(), body.description());
    log.info("Created item {}", value("item_id", item.id()));
    return ItemResponse.from(item);
  }

  @DeleteMapping("/{id:\\d+}")
  public MessageResponse delete(@PathVariable("id") long id) {
    log.info("Deleting item {}", value("item_id", id));
    store.delete(id);
    log.info("Deleted item {}", value("item_id", id));
    return new MessageResponse("Item " + id + " deleted successfully");
  }
}
