package io.shortcast.select;

import io.shortcast.model.ItemStatus;
import io.shortcast.model.QueueItem;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static io.shortcast.testing.Items.item;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ItemSelectorTest {

    private static String selectedId(Selection selection) {
        return assertInstanceOf(Selection.Selected.class, selection).item().id();
    }

    @Test
    void fifoSelectsFirstInsertedEligibleItem() {
        ItemSelector selector = new ItemSelector(QueueOrdering.FIFO);
        List<QueueItem> queue = List.of(item("A", 0, 1), item("B", 0, 2));

        assertEquals("A", selectedId(selector.selectNext(queue, Set.of())));
        assertEquals("B", selectedId(selector.selectNext(queue, Set.of("A"))));
    }

    @Test
    void consumedStatusIsNotEligible() {
        ItemSelector selector = new ItemSelector(QueueOrdering.FIFO);
        List<QueueItem> queue = List.of(item("A", 0, 1).withStatus(ItemStatus.CONSUMED), item("B", 0, 2));

        assertEquals("B", selectedId(selector.selectNext(queue, Set.of())));
    }

    @Test
    void scoreOrderingPrefersHigherScore() {
        ItemSelector selector = new ItemSelector(QueueOrdering.SCORE_DESC);
        List<QueueItem> queue = List.of(item("low", 5, 1), item("high", 90, 2), item("mid", 40, 3));

        assertEquals("high", selectedId(selector.selectNext(queue, Set.of())));
    }

    @Test
    void scoreTiesBreakOnCreationThenInsertion() {
        ItemSelector selector = new ItemSelector(QueueOrdering.SCORE_DESC);
        QueueItem older = QueueItem.builder("older").id("older").score(10)
                .createdAt(Instant.parse("2024-01-01T00:00:00Z")).sequence(3).build();
        QueueItem newer = QueueItem.builder("newer").id("newer").score(10)
                .createdAt(Instant.parse("2024-01-02T00:00:00Z")).sequence(1).build();
        assertEquals("older", selectedId(selector.selectNext(List.of(newer, older), Set.of())));

        List<QueueItem> sameInstant = List.of(item("second", 10, 2), item("first", 10, 1));
        assertEquals("first", selectedId(selector.selectNext(sameInstant, Set.of())));
    }

    @Test
    void customComparatorTiesFallBackToSequence() {
        ItemSelector selector = new ItemSelector((a, b) -> 0);

        assertEquals("x", selectedId(selector.selectNext(List.of(item("y", 0, 9), item("x", 0, 4)), Set.of())));
    }

    @Test
    void emptyOrExhaustedQueueYieldsNoItemAvailable() {
        ItemSelector selector = new ItemSelector(QueueOrdering.FIFO);

        assertSame(Selection.NONE, selector.selectNext(List.of(), Set.of()));
        assertInstanceOf(Selection.NoItemAvailable.class,
                selector.selectNext(List.of(item("A", 0, 1)), Set.of("A")));
    }

    @Test
    void parsesOrderingNames() {
        assertEquals(QueueOrdering.SCORE_DESC, QueueOrdering.parse("score-desc"));
        assertEquals(QueueOrdering.FIFO, QueueOrdering.parse(" fifo "));
        assertThrows(IllegalArgumentException.class, () -> QueueOrdering.parse("random"));
    }
}
