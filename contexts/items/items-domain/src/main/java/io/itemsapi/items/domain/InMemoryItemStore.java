package io.itemsapi.items.domain;

import io.itemsapi.platform.domain.error.ItemsApiException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local, non-persistent {@link ItemStore}.
 *
 * <p>Contract:
 *
 * <ul>
 *   <li>Items live in a {@link LinkedHashMap} keyed by id, so iteration is insertion order and
 *       removal leaves survivors untouched.
 *   <li>{@code nextId} only ever increases; ids of deleted items are never reissued.
 *   <li>One {@link ReadWriteLock} guards both the map and the counter. Mutations take the write
 *       lock, so id allocation and append happen as a single step; reads take the read lock and
 *       return immutable snapshots.
 * </ul>
 *
 * <p>Thread-safety: safe for concurrent use. All operations are in-memory and bounded.
 */
public final class InMemoryItemStore implements ItemStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryItemStore.class);

  private final Map<Long, Item> items = new LinkedHashMap<>();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final Clock clock;

  // guarded by lock
  private long nextId = 1L;

  /**
   * Creates an empty store.
   *
   * @param clock clock used to stamp {@link Item#createdAt()}
   */
  public InMemoryItemStore(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public List<Item> list() {
    lock.readLock().lock();
    try {
      return List.copyOf(items.values());
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public Item get(long id) {
    lock.readLock().lock();
    try {
      Item item = items.get(id);
      if (item == null) {
        throw ItemsApiException.notFound(id);
      }
      return item;
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public Item create(String name, String description) {
    if (name == null || name.isEmpty()) {
      throw ItemsApiException.nameRequired();
    }
    String desc = (description == null) ? "" : description;

    lock.writeLock().lock();
    try {
      Item item = new Item(nextId, name, desc, Instant.now(clock));
      items.put(item.id(), item);
      nextId++;
      log.debug("Stored item {} (size={})", item.id(), items.size());
      return item;
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public Item delete(long id) {
    lock.writeLock().lock();
    try {
      Item removed = items.remove(id);
      if (removed == null) {
        throw ItemsApiException.notFound(id);
      }
      log.debug("Removed item {} (size={})", id, items.size());
      return removed;
    } finally {
      lock.writeLock().unlock();
    }
  }
}
