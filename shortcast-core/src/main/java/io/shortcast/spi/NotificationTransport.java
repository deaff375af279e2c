package io.shortcast.spi;

import io.shortcast.notify.NotificationEvent;

import java.util.List;

/**
 * Delivers notifications to operators (e-mail, chat...). Retries, if any, are the
 * transport's own business.
 *
 * @see io.shortcast.notify.LoggingNotificationTransport
 */
@FunctionalInterface
public interface NotificationTransport {

    /**
     * Sends one event.
     *
     * @param event      the event
     * @param recipients configured recipients, possibly empty
     * @throws Exception if delivery fails; logged by the caller and otherwise ignored
     */
    void send(NotificationEvent event, List<String> recipients) throws Exception;
}
