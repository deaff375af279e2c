package io.shortcast.store;

import io.shortcast.model.ItemStatus;
import io.shortcast.model.QueueItem;
import io.shortcast.model.SchedulerState;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static io.shortcast.testing.Items.item;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryStoresTest {
    private static final Instant NOW = Instant.parse("2024-05-01T09:00:00Z");

    @Test
    void queueAssignsIncreasingSequenceAndRejectsDuplicates() {
        InMemoryItemQueue queue = new InMemoryItemQueue();

        assertTrue(queue.enqueue(item("A")));
        assertTrue(queue.enqueue(item("B")));
        assertFalse(queue.enqueue(item("A")));

        List<QueueItem> snapshot = queue.snapshot();
        assertEquals(List.of("A", "B"), snapshot.stream().map(QueueItem::id).toList());
        assertTrue(snapshot.get(0).sequence() < snapshot.get(1).sequence());
        assertEquals(2, queue.countQueued());
    }

    @Test
    void snapshotIsNotAffectedByLaterWrites() {
        InMemoryItemQueue queue = new InMemoryItemQueue();
        queue.enqueue(item("A"));
        List<QueueItem> snapshot = queue.snapshot();

        queue.enqueue(item("B"));

        assertEquals(1, snapshot.size());
    }

    @Test
    void stateStartsEmpty() {
        SchedulerState state = new InMemoryStateStore().load();

        assertSame(SchedulerState.INITIAL, state);
        assertTrue(state.lastFetchTime().isEmpty());
    }

    @Test
    void markConsumedUpdatesStateAndQueueTogether() {
        InMemoryItemQueue queue = new InMemoryItemQueue();
        InMemoryStateStore store = new InMemoryStateStore(queue);
        queue.enqueue(item("A"));

        store.markConsumed(item("A"), NOW);
        store.markConsumed(item("A"), NOW);

        assertEquals(Set.of("A"), store.load().consumedItemIds());
        assertEquals(ItemStatus.CONSUMED, queue.snapshot().get(0).status());
        assertEquals(0, queue.countQueued());
    }

    @Test
    void recordFetchReplacesLastFetchTime() {
        InMemoryStateStore store = new InMemoryStateStore();
        SchedulerState before = store.load();

        store.recordFetch(NOW);

        assertEquals(Optional.of(NOW), store.load().lastFetchTime());
        assertTrue(before.lastFetchTime().isEmpty());
    }
}
