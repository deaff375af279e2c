package io.shortcast.spi;

import io.shortcast.model.QueueItem;

import java.util.List;

/**
 * The queue discovery collaborators write into and publish cycles select from.
 *
 * @see io.shortcast.store.InMemoryItemQueue
 */
public interface ItemQueue {

    /**
     * Appends an item, assigning its insertion sequence.
     *
     * @param item the discovered item
     * @return {@code false} if an item with the same id is already queued or consumed
     */
    boolean enqueue(QueueItem item);

    /**
     * Returns every item currently held by the queue, in insertion order, including
     * consumed ones. The returned list is a snapshot and is not affected by later writes.
     *
     * @return the queue snapshot
     */
    List<QueueItem> snapshot();

    /**
     * Counts items still in QUEUED status.
     *
     * @return queued item count
     */
    default int countQueued() {
        return (int) snapshot().stream().filter(QueueItem::isQueued).count();
    }
}
