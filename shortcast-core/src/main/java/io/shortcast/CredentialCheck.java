package io.shortcast;

import io.shortcast.config.ChannelConfig;
import io.shortcast.config.PublisherConfig;
import io.shortcast.notify.NotificationBridge;
import io.shortcast.notify.NotificationEvent;
import io.shortcast.registry.PublisherRegistry;
import io.shortcast.spi.ChannelPublisher;
import io.shortcast.spi.CredentialHealth;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Startup inspection of every enabled channel's credentials. Expired or missing credentials
 * raise a {@link NotificationEvent.CredentialWarning}; nothing here stops the process.
 */
final class CredentialCheck {
  private static final Logger logger = Logger.getLogger(CredentialCheck.class.getName());

  private CredentialCheck() {}

  static Map<String, CredentialHealth> run(PublisherConfig config, PublisherRegistry registry,
      NotificationBridge notifications, Clock clock) {
    Map<String, CredentialHealth> results = new LinkedHashMap<>();
    for (ChannelConfig channel : config.channels()) {
      if (!channel.enabled()) {
        continue;
      }
      Optional<ChannelPublisher> publisher = registry.publisherFor(channel.platformKind());
      if (publisher.isEmpty()) {
        continue;
      }
      CredentialHealth health;
      try {
        health = publisher.get().inspectCredentials(channel);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Credential inspection failed for channel " + channel.id(), e);
        continue;
      }
      if (health == null) {
        health = CredentialHealth.UNKNOWN;
      }
      results.put(channel.id(), health);
      switch (health.status()) {
        case OK -> logger.log(Level.INFO, "Credentials for {0}: OK ({1})",
            new Object[]{channel.id(), health.detail()});
        case EXPIRING -> logger.log(Level.WARNING, "Credentials for {0} are expiring: {1}",
            new Object[]{channel.id(), health.detail()});
        case UNKNOWN -> logger.log(Level.FINE, "Credentials for {0} not inspected", channel.id());
        default -> logger.log(Level.WARNING, "Credentials for {0} are {1}: {2}",
            new Object[]{channel.id(), health.status(), health.detail()});
      }
      if (health.needsAttention()) {
        notifications.notify(new NotificationEvent.CredentialWarning(channel.id(), health, clock.instant()));
      }
    }
    return results;
  }
}
