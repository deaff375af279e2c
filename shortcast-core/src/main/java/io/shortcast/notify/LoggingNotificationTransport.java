package io.shortcast.notify;

import io.shortcast.spi.NotificationTransport;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Transport that writes notifications to the log. Used when no real transport is configured.
 */
public final class LoggingNotificationTransport implements NotificationTransport {
  private static final Logger logger = Logger.getLogger(LoggingNotificationTransport.class.getName());

  @Override
  public void send(NotificationEvent event, List<String> recipients) {
    Level level = event instanceof NotificationEvent.ChannelUploadSucceeded ? Level.INFO : Level.WARNING;
    logger.log(level, "[notification] {0} -> {1}: {2}",
        new Object[]{event.subject(), recipients.isEmpty() ? "(no recipients)" : recipients, event});
  }
}
