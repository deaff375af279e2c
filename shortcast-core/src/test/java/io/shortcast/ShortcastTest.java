package io.shortcast;

import io.shortcast.config.ChannelConfig;
import io.shortcast.config.ConfigInvalidException;
import io.shortcast.config.PublisherConfig;
import io.shortcast.cycle.FetchOutcome;
import io.shortcast.model.CycleReport;
import io.shortcast.notify.NotificationEvent;
import io.shortcast.registry.DefaultPublisherRegistry;
import io.shortcast.spi.CredentialHealth;
import io.shortcast.store.InMemoryItemQueue;
import io.shortcast.store.InMemoryStateStore;
import io.shortcast.testing.MutableClock;
import io.shortcast.testing.RecordingTransport;
import io.shortcast.testing.StubDiscovery;
import io.shortcast.testing.StubMediaGenerator;
import io.shortcast.testing.StubPublisher;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static io.shortcast.testing.Items.item;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ShortcastTest {
    private final MutableClock clock = MutableClock.at("2024-05-01T09:00:00Z");
    private final InMemoryItemQueue queue = new InMemoryItemQueue();
    private final InMemoryStateStore store = new InMemoryStateStore(queue);
    private final StubDiscovery discovery = new StubDiscovery();
    private final StubMediaGenerator generator = new StubMediaGenerator();
    private final StubPublisher youtube = StubPublisher.primary();
    private final StubPublisher tiktok = StubPublisher.secondary();
    private final RecordingTransport transport = new RecordingTransport();

    private final PublisherConfig config = PublisherConfig.builder()
            .channel("primary1", "youtube", true, "tokens/primary1.json", "assets/primary1")
            .channel("secondary1", "tiktok", true, "cookies/secondary1.txt", null)
            .publishTimes(List.of("03:00", "09:00", "13:00", "17:00", "20:00"))
            .build();

    private Shortcast.Builder builder() {
        return Shortcast.builder()
                .config(config)
                .publishers(new DefaultPublisherRegistry().register(youtube).register(tiktok))
                .discovery(discovery)
                .generator(generator)
                .stateStore(store)
                .queue(queue)
                .notificationTransport(transport)
                .recipients(List.of("ops@example.test"))
                .clock(clock);
    }

    @Test
    void runOnceScenario() {
        discovery.willQueue(item("A"), item("B"));

        try (Shortcast shortcast = builder().build()) {
            CycleReport report = shortcast.runOnce(false).orElseThrow();

            assertEquals("A", report.itemId().orElseThrow());
            assertEquals(2, report.successCount());
            assertEquals(report.outcomes().get(0).media(), report.outcomes().get(1).media());
        }
        assertEquals(Set.of("A"), store.load().consumedItemIds());
        assertEquals(1, queue.countQueued());
    }

    @Test
    void fetchOnlyRespectsCooldownUnlessForced() {
        store.recordFetch(clock.instant().minus(Duration.ofHours(1)));

        try (Shortcast shortcast = builder().build()) {
            assertInstanceOf(FetchOutcome.Skipped.class, shortcast.fetchOnly(false).orElseThrow());
            assertInstanceOf(FetchOutcome.Ran.class, shortcast.fetchOnly(true).orElseThrow());
        }
        assertEquals(Optional.of(clock.instant()), store.load().lastFetchTime());
    }

    @Test
    void runDispatchesOnMode() {
        discovery.willQueue(item("A"));

        try (Shortcast shortcast = builder().build()) {
            shortcast.run(RunMode.FETCH_ONLY, false);
            assertEquals(1, queue.countQueued());
            assertTrue(store.load().consumedItemIds().isEmpty());

            shortcast.run(RunMode.RUN_ONCE, false);
            assertTrue(store.load().isConsumed("A"));
        }
    }

    @Test
    void continuousModeStartsScheduler() {
        try (Shortcast shortcast = builder().build()) {
            shortcast.run(RunMode.CONTINUOUS, false);

            assertTrue(shortcast.scheduler().nextWakeUp().isPresent());
        }
    }

    @Test
    void missingPublisherIsAConfigurationError() {
        Shortcast.Builder builder = builder().publishers(new DefaultPublisherRegistry().register(youtube));

        assertThrows(ConfigInvalidException.class, builder::build);
    }

    @Test
    void builderCannotBeReused() {
        Shortcast.Builder builder = builder();
        builder.build().close();

        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void expiredCredentialsRaiseWarning() throws Exception {
        youtube.credentials("primary1", new CredentialHealth(CredentialHealth.Status.EXPIRED, "expired 2024-04-30"));
        tiktok.credentials("secondary1", new CredentialHealth(CredentialHealth.Status.OK, "cookie jar present"));

        try (Shortcast shortcast = builder().build()) {
            Map<String, CredentialHealth> health = shortcast.checkCredentials();

            assertEquals(CredentialHealth.Status.EXPIRED, health.get("primary1").status());
            assertEquals(CredentialHealth.Status.OK, health.get("secondary1").status());
            assertTrue(transport.awaitEvents(1, Duration.ofSeconds(5)));
        }
        List<NotificationEvent.CredentialWarning> warnings =
                transport.eventsOf(NotificationEvent.CredentialWarning.class);
        assertEquals(1, warnings.size());
        assertEquals("primary1", warnings.get(0).channelId());
        assertEquals(List.of("ops@example.test"), transport.recipients.get(0));
    }

    @Test
    void defaultsToInMemoryStores() {
        discovery.willQueue(item("A"));

        try (Shortcast shortcast = Shortcast.builder()
                .config(config)
                .publishers(new DefaultPublisherRegistry().register(youtube).register(tiktok))
                .discovery(discovery)
                .generator(generator)
                .build()) {
            assertEquals("A", shortcast.runOnce(false).orElseThrow().itemId().orElseThrow());
        }
    }

    @Test
    void runModeParsing() {
        assertEquals(RunMode.CONTINUOUS, RunMode.parse(null));
        assertEquals(RunMode.FETCH_ONLY, RunMode.parse("fetch-only"));
        assertEquals(RunMode.RUN_ONCE, RunMode.parse("RUN_ONCE"));
        assertThrows(IllegalArgumentException.class, () -> RunMode.parse("daemon"));
    }
}
