package io.shortcast.notify;

import io.shortcast.config.PlatformKind;
import io.shortcast.model.ErrorKind;
import io.shortcast.spi.MetricsExporter;
import io.shortcast.testing.RecordingTransport;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NotificationBridgeTest {
    private static final Instant NOW = Instant.parse("2024-05-01T09:00:00Z");

    private static NotificationEvent fatal(String message) {
        return new NotificationEvent.FatalPipelineError("publish", null, message, NOW);
    }

    @Test
    void deliversEventsWithRecipients() throws Exception {
        RecordingTransport transport = new RecordingTransport();
        try (NotificationBridge bridge = NotificationBridge.builder()
                .transport(transport)
                .recipients(List.of("ops@example.test"))
                .build()) {
            assertTrue(bridge.notify(fatal("boom")));
            assertTrue(transport.awaitEvents(1, Duration.ofSeconds(5)));
        }
        assertEquals(List.of("ops@example.test"), transport.recipients.get(0));
    }

    @Test
    void transportFailureIsNotPropagated() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        RecordingTransport after = new RecordingTransport();
        try (NotificationBridge bridge = NotificationBridge.builder()
                .transport((event, recipients) -> {
                    if (attempts.incrementAndGet() == 1) {
                        throw new IllegalStateException("smtp down");
                    }
                    after.send(event, recipients);
                })
                .build()) {
            assertTrue(bridge.notify(fatal("first")));
            assertTrue(bridge.notify(fatal("second")));
            assertTrue(after.awaitEvents(1, Duration.ofSeconds(5)));
        }
        assertEquals(2, attempts.get());
    }

    @Test
    void fullQueueDropsWithoutBlocking() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch firstTaken = new CountDownLatch(1);
        AtomicInteger dropped = new AtomicInteger();
        NotificationBridge bridge = NotificationBridge.builder()
                .transport((event, recipients) -> {
                    firstTaken.countDown();
                    release.await(5, TimeUnit.SECONDS);
                })
                .queueCapacity(1)
                .metrics(new CountingMetrics(dropped))
                .drainTimeoutMs(100)
                .build();
        try {
            assertTrue(bridge.notify(fatal("in flight")));
            assertTrue(firstTaken.await(5, TimeUnit.SECONDS));
            assertTrue(bridge.notify(fatal("waiting")));
            assertFalse(bridge.notify(fatal("dropped")));
            assertEquals(1, dropped.get());
        } finally {
            release.countDown();
            bridge.close();
        }
        assertFalse(bridge.notify(fatal("after close")));
    }

    @Test
    void subjectsDescribeEvents() {
        assertEquals("Upload failed on yt1 (CREDENTIAL)", new NotificationEvent.ChannelUploadFailed(
                "yt1", PlatformKind.PRIMARY, "A", "Title", ErrorKind.CREDENTIAL, "revoked", NOW).subject());
        assertEquals("Pipeline error during fetch", new NotificationEvent.FatalPipelineError(
                "fetch", null, "x", NOW).subject());
    }

    @Test
    void builderRejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> NotificationBridge.builder().queueCapacity(0).build());
    }

    private static final class CountingMetrics implements MetricsExporter {
        private final AtomicInteger dropped;

        CountingMetrics(AtomicInteger dropped) {
            this.dropped = dropped;
        }

        @Override
        public void incrementNotificationDropped() {
            dropped.incrementAndGet();
        }

        @Override
        public void incrementFetchRan(int itemsQueued) {
        }

        @Override
        public void incrementFetchSkipped() {
        }

        @Override
        public void incrementFetchFailed() {
        }

        @Override
        public void incrementCycleCompleted() {
        }

        @Override
        public void incrementCycleEmpty() {
        }

        @Override
        public void incrementCycleAborted() {
        }

        @Override
        public void incrementChannelSuccess(PlatformKind platformKind) {
        }

        @Override
        public void incrementChannelFailure(PlatformKind platformKind, ErrorKind errorKind) {
        }

        @Override
        public void recordQueueDepth(int depth) {
        }
    }
}
