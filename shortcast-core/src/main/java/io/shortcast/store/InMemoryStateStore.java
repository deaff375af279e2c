package io.shortcast.store;

import io.shortcast.model.QueueItem;
import io.shortcast.model.SchedulerState;
import io.shortcast.spi.StateStore;

import java.time.Instant;
import java.util.Objects;

/**
 * {@link StateStore} held in memory. Every write swaps in a new immutable
 * {@link SchedulerState}, so readers never observe a partial update.
 *
 * <p>When constructed with an {@link InMemoryItemQueue}, {@link #markConsumed} also flips the
 * item's status in that queue.
 */
public final class InMemoryStateStore implements StateStore {
  private final InMemoryItemQueue queue;
  private volatile SchedulerState state;

  public InMemoryStateStore() {
    this(null, SchedulerState.INITIAL);
  }

  public InMemoryStateStore(InMemoryItemQueue queue) {
    this(queue, SchedulerState.INITIAL);
  }

  public InMemoryStateStore(InMemoryItemQueue queue, SchedulerState initial) {
    this.queue = queue;
    this.state = Objects.requireNonNull(initial, "initial");
  }

  @Override
  public SchedulerState load() {
    return state;
  }

  @Override
  public synchronized void recordFetch(Instant fetchedAt) {
    state = state.withLastFetchTime(Objects.requireNonNull(fetchedAt, "fetchedAt"));
  }

  @Override
  public synchronized void markConsumed(QueueItem item, Instant consumedAt) {
    Objects.requireNonNull(item, "item");
    state = state.withConsumed(item.id());
    if (queue != null) {
      queue.markConsumed(item.id());
    }
  }
}
