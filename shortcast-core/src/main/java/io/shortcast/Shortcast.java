package io.shortcast;

import io.shortcast.config.PublisherConfig;
import io.shortcast.cycle.FetchCycle;
import io.shortcast.cycle.FetchOutcome;
import io.shortcast.cycle.PublishCycle;
import io.shortcast.fanout.FanoutCoordinator;
import io.shortcast.model.CycleReport;
import io.shortcast.notify.NotificationBridge;
import io.shortcast.registry.PublisherRegistry;
import io.shortcast.schedule.JobScheduler;
import io.shortcast.select.ItemSelector;
import io.shortcast.spi.CredentialHealth;
import io.shortcast.spi.DiscoveryClient;
import io.shortcast.spi.ItemQueue;
import io.shortcast.spi.MediaGenerator;
import io.shortcast.spi.MetricsExporter;
import io.shortcast.spi.NotificationTransport;
import io.shortcast.spi.StateStore;
import io.shortcast.store.InMemoryItemQueue;
import io.shortcast.store.InMemoryStateStore;
import io.shortcast.util.Durations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires a {@link FetchCycle}, a {@link PublishCycle}, a
 * {@link JobScheduler} and a {@link NotificationBridge} into a single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Shortcast shortcast = Shortcast.builder()
 *     .config(config)
 *     .discovery(discovery)
 *     .generator(generator)
 *     .publishers(new DefaultPublisherRegistry().register(youtube).register(tiktok))
 *     .stateStore(stateStore)
 *     .queue(queue)
 *     .build()) {
 *   shortcast.run(RunMode.CONTINUOUS, false);
 *   shortcast.awaitTermination();
 * }
 * }</pre>
 *
 * @see RunMode
 */
public final class Shortcast implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Shortcast.class.getName());

  private final PublisherConfig config;
  private final PublisherRegistry publishers;
  private final JobScheduler scheduler;
  private final NotificationBridge notifications;
  private final MetricsExporter metrics;
  private final Clock clock;

  private Shortcast(Builder builder) {
    this.config = Objects.requireNonNull(builder.config, "config");
    this.publishers = Objects.requireNonNull(builder.publishers, "publishers");
    DiscoveryClient discovery = Objects.requireNonNull(builder.discovery, "discovery");
    MediaGenerator generator = Objects.requireNonNull(builder.generator, "generator");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();

    ItemQueue queue = builder.queue;
    StateStore stateStore = builder.stateStore;
    if (queue == null) {
      queue = new InMemoryItemQueue();
    }
    if (stateStore == null) {
      stateStore = new InMemoryStateStore(queue instanceof InMemoryItemQueue q ? q : null);
    }

    this.notifications = NotificationBridge.builder()
        .transport(builder.notificationTransport)
        .recipients(builder.recipients)
        .queueCapacity(builder.notificationQueueCapacity)
        .metrics(metrics)
        .build();

    FanoutCoordinator fanout = FanoutCoordinator.builder()
        .channels(FanoutCoordinator.bind(config, publishers))
        .generator(generator)
        .notifications(notifications)
        .metrics(metrics)
        .clock(clock)
        .build();

    FetchCycle fetchCycle = FetchCycle.builder()
        .stateStore(stateStore)
        .queue(queue)
        .discovery(discovery)
        .fetchIntervalHours(config.timing().fetchIntervalHours())
        .notifications(notifications)
        .metrics(metrics)
        .clock(clock)
        .build();

    PublishCycle publishCycle = PublishCycle.builder()
        .stateStore(stateStore)
        .queue(queue)
        .selector(new ItemSelector(config.ordering()))
        .fanout(fanout)
        .discovery(discovery)
        .refillOnEmpty(config.refillOnEmpty())
        .notifications(notifications)
        .metrics(metrics)
        .clock(clock)
        .build();

    this.scheduler = JobScheduler.builder()
        .fetchCycle(fetchCycle)
        .publishCycle(publishCycle)
        .timing(config.timing())
        .metrics(metrics)
        .clock(clock)
        .build();

    if (fanout.channelCount() == 0) {
      logger.log(Level.WARNING, "No enabled channels configured; publish cycles will not upload anything");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Runs the orchestrator in the given mode. {@link RunMode#FETCH_ONLY} and
   * {@link RunMode#RUN_ONCE} complete synchronously; {@link RunMode#CONTINUOUS} starts the
   * scheduler thread and returns. Use {@link #awaitTermination()} to block.
   *
   * @param mode       the run mode
   * @param forceFetch bypass the fetch cooldown for this invocation only
   */
  public void run(RunMode mode, boolean forceFetch) {
    Objects.requireNonNull(mode, "mode");
    switch (mode) {
      case FETCH_ONLY -> fetchOnly(forceFetch);
      case RUN_ONCE -> runOnce(forceFetch);
      case CONTINUOUS -> startContinuous(forceFetch);
    }
  }

  /**
   * Runs one fetch cycle. Credentials are not inspected in this mode.
   *
   * @param force bypass the cooldown
   * @return the fetch outcome, empty if another cycle was running
   */
  public Optional<FetchOutcome> fetchOnly(boolean force) {
    return scheduler.runFetchOnly(force);
  }

  /**
   * Inspects credentials, then runs one fetch cycle followed by one publish cycle.
   *
   * @param force bypass the fetch cooldown
   * @return the publish cycle report, empty if another cycle was running
   */
  public Optional<CycleReport> runOnce(boolean force) {
    Instant start = clock.instant();
    checkCredentials();
    Optional<CycleReport> report = scheduler.runOnce(force);
    logger.log(Level.INFO, "Run-once finished in {0}", Durations.format(Duration.between(start, clock.instant())));
    return report;
  }

  /**
   * Inspects credentials and starts continuous scheduling. With {@code force}, one fetch
   * runs immediately, bypassing the cooldown; scheduled fetches stay cooldown-gated.
   *
   * @param force run one forced fetch before scheduling starts
   */
  public void startContinuous(boolean force) {
    checkCredentials();
    if (force) {
      scheduler.runFetchOnly(true);
    }
    scheduler.start();
  }

  /**
   * Inspects the credentials of every enabled channel.
   *
   * @return health per channel id, for channels whose publisher reported something
   */
  public Map<String, CredentialHealth> checkCredentials() {
    return CredentialCheck.run(config, publishers, notifications, clock);
  }

  public PublisherConfig config() {
    return config;
  }

  public JobScheduler scheduler() {
    return scheduler;
  }

  /**
   * Blocks until {@link #close()} is called.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public void awaitTermination() throws InterruptedException {
    scheduler.awaitTermination();
  }

  /**
   * Shuts down components in order: scheduler, notification bridge, metrics exporter.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      scheduler.close();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      notifications.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link Shortcast}. */
  public static final class Builder {
    private PublisherConfig config;
    private PublisherRegistry publishers;
    private DiscoveryClient discovery;
    private MediaGenerator generator;
    private StateStore stateStore;
    private ItemQueue queue;
    private NotificationTransport notificationTransport;
    private List<String> recipients;
    private int notificationQueueCapacity = 256;
    private MetricsExporter metrics;
    private Clock clock;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /**
     * Sets the validated configuration.
     *
     * <p><b>Required.</b>
     *
     * @param config the configuration
     * @return this builder
     */
    public Builder config(PublisherConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Sets the publisher registry. Every enabled channel's platform kind must have a publisher.
     *
     * <p><b>Required.</b>
     *
     * @param publishers the publisher registry
     * @return this builder
     */
    public Builder publishers(PublisherRegistry publishers) {
      this.publishers = publishers;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @param discovery the discovery collaborator
     * @return this builder
     */
    public Builder discovery(DiscoveryClient discovery) {
      this.discovery = discovery;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @param generator the media generator
     * @return this builder
     */
    public Builder generator(MediaGenerator generator) {
      this.generator = generator;
      return this;
    }

    /**
     * Sets the state store.
     *
     * <p>Optional. Defaults to an {@link InMemoryStateStore}, which does not survive restarts.
     *
     * @param stateStore the state store
     * @return this builder
     */
    public Builder stateStore(StateStore stateStore) {
      this.stateStore = stateStore;
      return this;
    }

    /**
     * Sets the item queue.
     *
     * <p>Optional. Defaults to an {@link InMemoryItemQueue}.
     *
     * @param queue the item queue
     * @return this builder
     */
    public Builder queue(ItemQueue queue) {
      this.queue = queue;
      return this;
    }

    /**
     * Sets the notification transport.
     *
     * <p>Optional. Defaults to {@link io.shortcast.notify.LoggingNotificationTransport}.
     *
     * @param notificationTransport the transport
     * @return this builder
     */
    public Builder notificationTransport(NotificationTransport notificationTransport) {
      this.notificationTransport = notificationTransport;
      return this;
    }

    public Builder recipients(List<String> recipients) {
      this.recipients = recipients;
      return this;
    }

    /**
     * Optional. Defaults to {@code 256}. Must be &gt; 0.
     *
     * @param notificationQueueCapacity maximum number of undelivered notifications
     * @return this builder
     */
    public Builder notificationQueueCapacity(int notificationQueueCapacity) {
      this.notificationQueueCapacity = notificationQueueCapacity;
      return this;
    }

    /**
     * Sets the metrics exporter. An exporter that implements {@link AutoCloseable} is closed
     * with the orchestrator.
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

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Wires the orchestrator.
     *
     * @return a new {@link Shortcast}
     * @throws NullPointerException if a required component is missing
     * @throws io.shortcast.config.ConfigInvalidException if an enabled channel has no publisher
     * @throws IllegalStateException if build() was already called
     */
    public Shortcast build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      return new Shortcast(this);
    }
  }
}
