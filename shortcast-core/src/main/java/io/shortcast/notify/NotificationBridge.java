package io.shortcast.notify;

import io.shortcast.spi.MetricsExporter;
import io.shortcast.spi.NotificationTransport;
import io.shortcast.util.DaemonThreadFactory;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Best-effort, non-blocking delivery of {@link NotificationEvent}s.
 *
 * <p>{@link #notify(NotificationEvent)} only offers the event to a bounded queue; a single
 * daemon thread drains it into the {@link NotificationTransport}. A full queue drops the
 * event, and a failing transport is logged. Neither ever reaches the caller.
 *
 * <p>Create instances via {@link #builder()}. The sender thread starts lazily on the first
 * notification.
 */
public final class NotificationBridge implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(NotificationBridge.class.getName());

  private final NotificationTransport transport;
  private final List<String> recipients;
  private final BlockingQueue<NotificationEvent> queue;
  private final long drainTimeoutMs;
  private final MetricsExporter metrics;

  private ExecutorService sender;
  private volatile boolean closed;

  private NotificationBridge(Builder builder) {
    this.transport = builder.transport != null ? builder.transport : new LoggingNotificationTransport();
    this.recipients = builder.recipients == null ? List.of() : List.copyOf(builder.recipients);
    if (builder.queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be > 0");
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.queue = new LinkedBlockingQueue<>(builder.queueCapacity);
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Queues an event for delivery. Never blocks and never throws.
   *
   * @param event the event
   * @return {@code true} if the event was queued, {@code false} if it was dropped
   */
  public boolean notify(NotificationEvent event) {
    if (event == null) {
      return false;
    }
    if (closed) {
      logger.log(Level.WARNING, "Notification bridge closed, dropping {0}", event.subject());
      return false;
    }
    if (!queue.offer(event)) {
      metrics.incrementNotificationDropped();
      logger.log(Level.WARNING, "Notification queue full, dropping {0}", event.subject());
      return false;
    }
    ensureSender();
    return true;
  }

  private synchronized void ensureSender() {
    if (sender != null || closed) {
      return;
    }
    sender = Executors.newSingleThreadExecutor(new DaemonThreadFactory("shortcast-notify-"));
    sender.execute(this::drainLoop);
  }

  private void drainLoop() {
    while (!closed || !queue.isEmpty()) {
      NotificationEvent event;
      try {
        event = queue.poll(100, TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      }
      if (event != null) {
        deliver(event);
      }
    }
  }

  private void deliver(NotificationEvent event) {
    try {
      transport.send(event, recipients);
    } catch (Throwable t) {
      logger.log(Level.WARNING, "Failed to deliver notification: " + event.subject(), t);
    }
  }

  /** Number of events waiting for delivery. */
  public int pending() {
    return queue.size();
  }

  /**
   * Stops accepting events and waits up to the drain timeout for queued ones to be delivered.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (sender == null) {
      if (!queue.isEmpty()) {
        logger.log(Level.WARNING, "Discarding {0} undelivered notifications", queue.size());
        queue.clear();
      }
      return;
    }
    sender.shutdown();
    try {
      if (!sender.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Notification drain timed out, {0} events undelivered", queue.size());
        sender.shutdownNow();
      }
    } catch (InterruptedException e) {
      sender.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link NotificationBridge}. */
  public static final class Builder {
    private NotificationTransport transport;
    private List<String> recipients;
    private int queueCapacity = 256;
    private long drainTimeoutMs = 5000;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the delivery transport.
     *
     * <p>Optional. Defaults to {@link LoggingNotificationTransport}.
     *
     * @param transport the transport
     * @return this builder
     */
    public Builder transport(NotificationTransport transport) {
      this.transport = transport;
      return this;
    }

    /**
     * Sets the recipients passed to the transport with every event.
     *
     * <p>Optional. Defaults to no recipients.
     *
     * @param recipients the recipients
     * @return this builder
     */
    public Builder recipients(List<String> recipients) {
      this.recipients = recipients;
      return this;
    }

    /**
     * Sets the capacity of the pending-event queue.
     *
     * <p>Optional. Defaults to {@code 256}. Must be &gt; 0.
     *
     * @param queueCapacity maximum number of undelivered events
     * @return this builder
     */
    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    /**
     * Sets how long {@link NotificationBridge#close()} waits for pending events.
     *
     * <p>Optional. Defaults to {@code 5000} ms. Must be &ge; 0.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Sets the metrics exporter used to count dropped events.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public NotificationBridge build() {
      return new NotificationBridge(this);
    }
  }
}
