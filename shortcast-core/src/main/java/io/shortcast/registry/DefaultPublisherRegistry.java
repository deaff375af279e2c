package io.shortcast.registry;

import io.shortcast.config.PlatformKind;
import io.shortcast.spi.ChannelPublisher;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe registry holding at most one publisher per platform kind.
 *
 * <pre>{@code
 * PublisherRegistry registry = new DefaultPublisherRegistry()
 *     .register(new YouTubePublisher(tokens))
 *     .register(new TikTokPublisher(cookies));
 * }</pre>
 */
public final class DefaultPublisherRegistry implements PublisherRegistry {
  private final Map<PlatformKind, ChannelPublisher> publishers = new ConcurrentHashMap<>();

  /**
   * Registers a publisher under its {@link ChannelPublisher#platform()}.
   *
   * @param publisher the publisher
   * @return this registry for chaining
   * @throws IllegalStateException if a publisher is already registered for the same kind
   */
  public DefaultPublisherRegistry register(ChannelPublisher publisher) {
    Objects.requireNonNull(publisher, "publisher");
    PlatformKind kind = Objects.requireNonNull(publisher.platform(), "publisher.platform()");
    ChannelPublisher existing = publishers.putIfAbsent(kind, publisher);
    if (existing != null && existing != publisher) {
      throw new IllegalStateException("Publisher already registered for " + kind);
    }
    return this;
  }

  @Override
  public Optional<ChannelPublisher> publisherFor(PlatformKind kind) {
    return Optional.ofNullable(publishers.get(kind));
  }
}
