package io.shortcast.spi;

import io.shortcast.model.QueueItem;
import io.shortcast.model.SchedulerState;

import java.time.Instant;

/**
 * Durable record of the last fetch time and the consumed item ids.
 *
 * <p>Single writer: only the currently running cycle writes. Every method is atomic;
 * a failed write leaves the previously committed state untouched. {@link #load()} always
 * observes the latest committed write. The consumed set only ever grows.
 *
 * @see io.shortcast.store.InMemoryStateStore
 */
public interface StateStore {

    /**
     * Reads the committed state.
     *
     * @return a snapshot of the state
     */
    SchedulerState load();

    /**
     * Records a successful fetch. Called only after the discovery collaborator completed
     * without error.
     *
     * @param fetchedAt the fetch time to store
     */
    void recordFetch(Instant fetchedAt);

    /**
     * Adds the item to the consumed set and flips its queue status to CONSUMED, as one
     * atomic update. Idempotent.
     *
     * @param item       the published item
     * @param consumedAt the time of consumption
     */
    void markConsumed(QueueItem item, Instant consumedAt);
}
