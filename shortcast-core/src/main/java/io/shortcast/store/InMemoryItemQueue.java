package io.shortcast.store;

import io.shortcast.model.ItemStatus;
import io.shortcast.model.QueueItem;
import io.shortcast.spi.ItemQueue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Thread-safe in-memory {@link ItemQueue}. Contents are lost when the process exits.
 */
public final class InMemoryItemQueue implements ItemQueue {
  private final Map<String, QueueItem> items = new LinkedHashMap<>();
  private long nextSequence = 1;

  @Override
  public synchronized boolean enqueue(QueueItem item) {
    Objects.requireNonNull(item, "item");
    if (items.containsKey(item.id())) {
      return false;
    }
    items.put(item.id(), item.withSequence(nextSequence++));
    return true;
  }

  @Override
  public synchronized List<QueueItem> snapshot() {
    return List.copyOf(new ArrayList<>(items.values()));
  }

  /**
   * Flips the item's status to CONSUMED. Unknown ids are ignored.
   *
   * @param itemId the item id
   */
  synchronized void markConsumed(String itemId) {
    QueueItem current = items.get(itemId);
    if (current != null && current.isQueued()) {
      items.put(itemId, current.withStatus(ItemStatus.CONSUMED));
    }
  }
}
