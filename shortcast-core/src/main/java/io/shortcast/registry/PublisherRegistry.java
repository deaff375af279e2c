package io.shortcast.registry;

import io.shortcast.config.PlatformKind;
import io.shortcast.spi.ChannelPublisher;

import java.util.Optional;

/**
 * Registry for looking up the publisher that serves a platform kind.
 *
 * <p>The fan-out resolves one publisher per enabled channel through this registry when
 * the orchestrator is built.
 *
 * @see ChannelPublisher
 * @see DefaultPublisherRegistry
 */
public interface PublisherRegistry {

  /**
   * Returns the publisher registered for the given platform kind.
   *
   * @param kind the platform kind
   * @return the publisher, or empty if none is registered
   */
  Optional<ChannelPublisher> publisherFor(PlatformKind kind);
}
