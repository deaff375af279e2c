package io.shortcast.cycle;

import io.shortcast.config.ChannelConfig;
import io.shortcast.config.PublisherConfig;
import io.shortcast.fanout.FanoutCoordinator;
import io.shortcast.model.CycleReport;
import io.shortcast.model.ErrorKind;
import io.shortcast.model.ItemStatus;
import io.shortcast.model.QueueItem;
import io.shortcast.model.SchedulerState;
import io.shortcast.notify.NotificationBridge;
import io.shortcast.notify.NotificationEvent;
import io.shortcast.registry.DefaultPublisherRegistry;
import io.shortcast.select.ItemSelector;
import io.shortcast.select.QueueOrdering;
import io.shortcast.store.InMemoryItemQueue;
import io.shortcast.store.InMemoryStateStore;
import io.shortcast.testing.MutableClock;
import io.shortcast.testing.RecordingTransport;
import io.shortcast.testing.StubDiscovery;
import io.shortcast.testing.StubMediaGenerator;
import io.shortcast.testing.StubPublisher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import static io.shortcast.testing.Items.item;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PublishCycleTest {
    private final MutableClock clock = MutableClock.at("2024-05-01T09:00:00Z");
    private final InMemoryItemQueue queue = new InMemoryItemQueue();
    private final InMemoryStateStore store = new InMemoryStateStore(queue);
    private final StubMediaGenerator generator = new StubMediaGenerator();
    private final StubPublisher primary = StubPublisher.primary();
    private final StubPublisher secondary = StubPublisher.secondary();
    private final StubDiscovery discovery = new StubDiscovery();
    private final RecordingTransport transport = new RecordingTransport();
    private final NotificationBridge notifications = NotificationBridge.builder().transport(transport).build();

    @AfterEach
    void tearDown() {
        notifications.close();
    }

    private PublishCycle cycle(boolean refillOnEmpty) {
        PublisherConfig config = PublisherConfig.builder()
                .channel(ChannelConfig.primary("primary1", null, null))
                .channel(ChannelConfig.secondary("secondary1", null))
                .build();
        FanoutCoordinator fanout = FanoutCoordinator.builder()
                .channels(FanoutCoordinator.bind(config,
                        new DefaultPublisherRegistry().register(primary).register(secondary)))
                .generator(generator)
                .notifications(notifications)
                .clock(clock)
                .build();
        return PublishCycle.builder()
                .stateStore(store)
                .queue(queue)
                .selector(new ItemSelector(QueueOrdering.FIFO))
                .fanout(fanout)
                .discovery(discovery)
                .refillOnEmpty(refillOnEmpty)
                .notifications(notifications)
                .clock(clock)
                .build();
    }

    private Map<String, QueueItem> queueById() {
        return queue.snapshot().stream().collect(Collectors.toMap(QueueItem::id, Function.identity()));
    }

    @Test
    void successfulCycleConsumesSelectedItemAndLeavesTheRest() {
        queue.enqueue(item("A"));
        queue.enqueue(item("B"));

        CycleReport report = cycle(false).run(true);

        assertEquals("A", report.itemId().orElseThrow());
        assertEquals(2, report.successCount());
        assertEquals(Set.of("A"), store.load().consumedItemIds());
        assertEquals(ItemStatus.CONSUMED, queueById().get("A").status());
        assertEquals(ItemStatus.QUEUED, queueById().get("B").status());

        CycleReport next = cycle(false).run(true);
        assertEquals("B", next.itemId().orElseThrow());
    }

    @Test
    void partialSuccessStillConsumes() {
        queue.enqueue(item("A"));
        primary.reject("primary1", ErrorKind.UPLOAD);

        CycleReport report = cycle(false).run(true);

        assertEquals(1, report.successCount());
        assertTrue(store.load().isConsumed("A"));
    }

    @Test
    void missingUploaderLibraryOnOneChannelStillConsumes() {
        queue.enqueue(item("A"));
        secondary.fail("secondary1", new NoClassDefFoundError("uploader/SecondaryUploader"));

        CycleReport report = cycle(false).run(true);

        assertTrue(report.fatalError().isEmpty());
        assertEquals(2, report.outcomes().size());
        assertEquals(1, report.successCount());
        assertEquals(ErrorKind.UNKNOWN, report.outcomes().get(1).errorKind().orElseThrow());
        assertTrue(store.load().isConsumed("A"));
        assertEquals(ItemStatus.CONSUMED, queueById().get("A").status());
    }

    @Test
    void allChannelsFailingKeepsItemQueuedForRetry() {
        queue.enqueue(item("A"));
        primary.reject("primary1", ErrorKind.CREDENTIAL);
        secondary.reject("secondary1", ErrorKind.UPLOAD);

        CycleReport report = cycle(false).run(true);

        assertFalse(report.anySuccess());
        assertEquals(2, report.outcomes().size());
        assertTrue(store.load().consumedItemIds().isEmpty());
        assertEquals(ItemStatus.QUEUED, queueById().get("A").status());

        CycleReport retry = cycle(false).run(true);
        assertEquals("A", retry.itemId().orElseThrow());
    }

    @Test
    void artifactFailureAbortsWithoutTouchingState() throws Exception {
        queue.enqueue(item("A"));
        SchedulerState before = store.load();
        generator.failAudio(new IllegalStateException("tts down"));

        CycleReport report = cycle(false).run(true);

        assertTrue(report.outcomes().isEmpty());
        assertTrue(report.isAborted());
        assertEquals("A", report.itemId().orElseThrow());
        assertEquals(before, store.load());
        assertTrue(primary.calls.isEmpty());
        assertTrue(transport.awaitEvents(1, Duration.ofSeconds(5)));
        NotificationEvent.FatalPipelineError error =
                transport.eventsOf(NotificationEvent.FatalPipelineError.class).get(0);
        assertEquals("publish", error.context());
        assertEquals("A", error.itemId());
    }

    @Test
    void nextCycleRunsNormallyAfterArtifactFailure() {
        queue.enqueue(item("A"));
        PublishCycle cycle = cycle(false);
        generator.failAudio(new IllegalStateException("tts down"));
        cycle.run(true);

        generator.failAudio(null);
        CycleReport report = cycle.run(true);

        assertTrue(report.anySuccess());
        assertTrue(store.load().isConsumed("A"));
    }

    @Test
    void emptyQueueYieldsEmptyReport() {
        CycleReport report = cycle(false).run(true);

        assertTrue(report.itemId().isEmpty());
        assertTrue(report.outcomes().isEmpty());
        assertFalse(report.isAborted());
        assertEquals(0, generator.audioCalls.get());
        assertEquals(0, discovery.calls.get());
    }

    @Test
    void emptyQueueIsRefilledWithoutRecordingAFetch() {
        discovery.willQueue(item("fresh"));

        CycleReport report = cycle(true).run(true);

        assertEquals("fresh", report.itemId().orElseThrow());
        assertEquals(1, discovery.calls.get());
        assertTrue(store.load().lastFetchTime().isEmpty());
    }

    @Test
    void refillIsSkippedWhenNotAllowedForThisRun() {
        discovery.willQueue(item("fresh"));

        CycleReport report = cycle(true).run(false);

        assertTrue(report.itemId().isEmpty());
        assertEquals(0, discovery.calls.get());
    }

    @Test
    void failedRefillEndsCycleQuietly() {
        discovery.failWith(new IllegalStateException("scraper broken"));

        CycleReport report = cycle(true).run(true);

        assertTrue(report.itemId().isEmpty());
        assertFalse(report.isAborted());
    }

    @Test
    void consumedIdsAreNeverSelectedAgain() {
        queue.enqueue(item("A"));
        store.markConsumed(item("A"), clock.instant());

        assertTrue(cycle(false).run(true).itemId().isEmpty());
    }
}
