package io.shortcast.select;

import io.shortcast.model.QueueItem;

import java.util.Collection;
import java.util.Comparator;
import java.util.Objects;
import java.util.Set;

/**
 * Picks the next item to publish.
 *
 * <p>An item is eligible when its status is QUEUED and its id is not in the consumed set.
 * The eligible item ranked first by the ordering wins; ties are broken by insertion
 * sequence, so selection is deterministic for a given queue snapshot.
 */
public final class ItemSelector {
  private final Comparator<QueueItem> ordering;

  public ItemSelector(QueueOrdering ordering) {
    this(Objects.requireNonNull(ordering, "ordering").comparator());
  }

  /**
   * Creates a selector with a custom ranking.
   *
   * @param ordering ranking comparator; insertion sequence is appended as the final tie-break
   */
  public ItemSelector(Comparator<QueueItem> ordering) {
    this.ordering = Objects.requireNonNull(ordering, "ordering")
        .thenComparingLong(QueueItem::sequence);
  }

  /**
   * Selects the next eligible item.
   *
   * @param queue           a snapshot of the queue
   * @param consumedItemIds ids that must not be selected again
   * @return the selected item, or {@link Selection#NONE}
   */
  public Selection selectNext(Collection<QueueItem> queue, Set<String> consumedItemIds) {
    Objects.requireNonNull(queue, "queue");
    Objects.requireNonNull(consumedItemIds, "consumedItemIds");
    QueueItem best = null;
    for (QueueItem item : queue) {
      if (!item.isQueued() || consumedItemIds.contains(item.id())) {
        continue;
      }
      if (best == null || ordering.compare(item, best) < 0) {
        best = item;
      }
    }
    return Selection.of(best);
  }
}
