package io.shortcast.spring.boot;

import io.shortcast.Shortcast;
import io.shortcast.config.ChannelConfig;
import io.shortcast.config.PlatformKind;
import io.shortcast.config.PublisherConfig;
import io.shortcast.model.MediaRef;
import io.shortcast.model.QueueItem;
import io.shortcast.registry.DefaultPublisherRegistry;
import io.shortcast.spi.ChannelPublisher;
import io.shortcast.spi.MediaGenerator;
import io.shortcast.spi.PublishResult;
import io.shortcast.store.InMemoryItemQueue;
import io.shortcast.store.InMemoryStateStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ShortcastRunnerTest {
  private static final Instant NOW = Instant.parse("2024-05-01T09:00:00Z");

  private final InMemoryItemQueue queue = new InMemoryItemQueue();
  private final InMemoryStateStore store = new InMemoryStateStore(queue);
  private final AtomicInteger discoveryCalls = new AtomicInteger();
  private final AtomicInteger uploads = new AtomicInteger();
  private Shortcast shortcast;

  @BeforeEach
  void setUp() {
    store.recordFetch(NOW.minusSeconds(3600));
    shortcast = Shortcast.builder()
        .config(PublisherConfig.builder()
            .channel(ChannelConfig.primary("primary1", null, null))
            .publishTimes(List.of("13:00"))
            .build())
        .publishers(new DefaultPublisherRegistry().register(new ChannelPublisher() {
          @Override
          public PlatformKind platform() {
            return PlatformKind.PRIMARY;
          }

          @Override
          public PublishResult publish(ChannelConfig channel, QueueItem item, MediaRef media) {
            uploads.incrementAndGet();
            return PublishResult.published("https://example.test/" + item.id());
          }
        }))
        .discovery(q -> {
          discoveryCalls.incrementAndGet();
          return q.enqueue(QueueItem.builder("Story").id("s" + discoveryCalls.get()).createdAt(NOW).build()) ? 1 : 0;
        })
        .generator(new MediaGenerator() {
          @Override
          public MediaRef generateSharedAudio(QueueItem item) {
            return MediaRef.sharedAudio("a.mp3");
          }

          @Override
          public MediaRef generateVideo(QueueItem item, ChannelConfig channel, MediaRef audio) {
            return MediaRef.video("v.mp4", channel.id());
          }
        })
        .stateStore(store)
        .queue(queue)
        .clock(Clock.fixed(NOW, ZoneOffset.UTC))
        .build();
  }

  @AfterEach
  void tearDown() {
    shortcast.close();
  }

  @Test
  void fetchOnlyRespectsCooldown() throws Exception {
    new ShortcastRunner(shortcast, false).run(new DefaultApplicationArguments("--mode=fetch-only"));

    assertEquals(0, discoveryCalls.get());
    assertEquals(0, uploads.get());
  }

  @Test
  void bareForceFetchBypassesCooldown() throws Exception {
    new ShortcastRunner(shortcast, false).run(new DefaultApplicationArguments("--mode=fetch-only", "--force-fetch"));

    assertEquals(1, discoveryCalls.get());
    assertEquals(NOW, store.load().lastFetchTime().orElseThrow());
  }

  @Test
  void runOnceWithForcedFetchPublishes() throws Exception {
    new ShortcastRunner(shortcast, false).run(new DefaultApplicationArguments("--mode=run-once", "--force-fetch=true"));

    assertEquals(1, uploads.get());
    assertTrue(store.load().isConsumed("s1"));
  }

  @Test
  void continuousIsDefaultMode() throws Exception {
    new ShortcastRunner(shortcast, false).run(new DefaultApplicationArguments());

    assertTrue(shortcast.scheduler().nextWakeUp().isPresent());
    assertEquals(0, uploads.get());
  }

  @Test
  void unknownModeIsRejected() {
    ShortcastRunner runner = new ShortcastRunner(shortcast, false);

    assertThrows(IllegalArgumentException.class,
        () -> runner.run(new DefaultApplicationArguments("--mode=daemon")));
  }
}
