package io.shortcast.schedule;

import io.shortcast.config.TimingPolicy;
import io.shortcast.cycle.FetchCycle;
import io.shortcast.cycle.FetchOutcome;
import io.shortcast.cycle.PublishCycle;
import io.shortcast.model.CycleReport;
import io.shortcast.spi.MetricsExporter;
import io.shortcast.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Triggers fetch and publish cycles from the timing policy.
 *
 * <p>Three modes of operation:
 * <ul>
 *   <li><b>Continuous</b> ({@link #start()}): a single daemon thread sleeps until the earliest
 *       of the next publish trigger and the next daily fetch trigger, runs what is due, then
 *       re-arms from the current time. Triggers that pass while a cycle runs are dropped.</li>
 *   <li><b>Fetch-only</b> ({@link #runFetchOnly(boolean)}): one synchronous fetch.</li>
 *   <li><b>Run-once</b> ({@link #runOnce(boolean)}): one synchronous fetch followed by one
 *       publish cycle that never refills an empty queue.</li>
 * </ul>
 *
 * <p>At most one cycle runs at a time. A trigger that arrives while a cycle is in flight is
 * dropped, not queued.
 *
 * <p>This class is thread-safe. {@link #start()} is synchronized; {@link #close()} waits for
 * the scheduler thread outside the lock.
 */
public final class JobScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(JobScheduler.class.getName());

  private final FetchCycle fetchCycle;
  private final PublishCycle publishCycle;
  private final TimingPolicy timing;
  private final MetricsExporter metrics;
  private final Clock clock;

  private final AtomicBoolean cycleInFlight = new AtomicBoolean();
  private final CountDownLatch terminated = new CountDownLatch(1);

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> armedTask;
  private volatile Instant armedFor;
  private volatile boolean fetchArmed;
  private volatile boolean publishArmed;
  private volatile boolean closed;

  private JobScheduler(Builder builder) {
    this.fetchCycle = Objects.requireNonNull(builder.fetchCycle, "fetchCycle");
    this.publishCycle = Objects.requireNonNull(builder.publishCycle, "publishCycle");
    this.timing = Objects.requireNonNull(builder.timing, "timing");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts continuous scheduling. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("JobScheduler has been closed");
    }
    if (scheduler != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("shortcast-scheduler-"));
    logger.log(Level.INFO, "Scheduler started. Fetch job at {0}, publish jobs at {1} ({2})",
        new Object[]{timing.fetchTime(), timing.publishTimes(), timing.zone()});
    arm(clock.instant());
  }

  /**
   * Runs one fetch cycle synchronously.
   *
   * @param force bypass the cooldown for this invocation
   * @return the fetch outcome, or empty if another cycle was in flight
   */
  public Optional<FetchOutcome> runFetchOnly(boolean force) {
    if (!cycleInFlight.compareAndSet(false, true)) {
      dropped("fetch");
      return Optional.empty();
    }
    try {
      return Optional.of(fetchCycle.run(force));
    } finally {
      cycleInFlight.set(false);
    }
  }

  /**
   * Runs one fetch cycle immediately followed by one publish cycle, synchronously. The
   * publish cycle does not refill an empty queue.
   *
   * @param force bypass the fetch cooldown for this invocation
   * @return the publish cycle report, or empty if another cycle was in flight
   */
  public Optional<CycleReport> runOnce(boolean force) {
    if (!cycleInFlight.compareAndSet(false, true)) {
      dropped("run-once");
      return Optional.empty();
    }
    try {
      fetchCycle.run(force);
      return Optional.of(publishCycle.run(false));
    } finally {
      cycleInFlight.set(false);
    }
  }

  /**
   * Runs one publish cycle now, unless a cycle is already in flight.
   *
   * @return the cycle report, or empty if the trigger was dropped
   */
  public Optional<CycleReport> triggerPublish() {
    if (!cycleInFlight.compareAndSet(false, true)) {
      dropped("publish");
      return Optional.empty();
    }
    try {
      return Optional.of(publishCycle.run(true));
    } finally {
      cycleInFlight.set(false);
    }
  }

  /**
   * Runs the cooldown-gated fetch now, unless a cycle is already in flight.
   *
   * @return the fetch outcome, or empty if the trigger was dropped
   */
  public Optional<FetchOutcome> triggerFetch() {
    return runFetchOnly(false);
  }

  /** Whether a cycle is currently running. */
  public boolean isCycleInFlight() {
    return cycleInFlight.get();
  }

  /** The instant the scheduler thread will wake up next, empty when not scheduling. */
  public Optional<Instant> nextWakeUp() {
    return Optional.ofNullable(armedFor);
  }

  private void dropped(String kind) {
    metrics.incrementTriggerDropped();
    logger.log(Level.WARNING, "Dropping {0} trigger: a cycle is still running", kind);
  }

  private synchronized void arm(Instant from) {
    if (closed) {
      return;
    }
    Instant nextPublish = TriggerCalculator.nextTrigger(from, timing.zone(), timing.publishTimes());
    Instant nextFetch = TriggerCalculator.nextTrigger(from, timing.zone(), List.of(timing.fetchTime()));
    Instant wakeUp = nextPublish.isBefore(nextFetch) ? nextPublish : nextFetch;
    publishArmed = nextPublish.equals(wakeUp);
    fetchArmed = nextFetch.equals(wakeUp);
    armedFor = wakeUp;
    long delayMs = Math.max(0L, Duration.between(clock.instant(), wakeUp).toMillis());
    armedTask = scheduler.schedule(this::tick, delayMs, TimeUnit.MILLISECONDS);
    logger.log(Level.FINE, "Next wake-up at {0} (fetch={1}, publish={2})",
        new Object[]{wakeUp, fetchArmed, publishArmed});
  }

  private void tick() {
    Instant due = armedFor;
    try {
      runDue(due, fetchArmed, publishArmed);
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Scheduled run failed", t);
    } finally {
      if (!closed) {
        Instant now = clock.instant();
        countPassedTriggers(due, now);
        arm(now.isAfter(due) ? now : due);
      }
    }
  }

  /**
   * Runs the jobs due at one wake-up: the fetch first, then the publish cycle.
   */
  void runDue(Instant due, boolean fetchDue, boolean publishDue) {
    if (fetchDue) {
      logger.log(Level.INFO, "Daily fetch trigger at {0}", due);
      triggerFetch();
    }
    if (publishDue) {
      logger.log(Level.INFO, "Publish trigger at {0}", due);
      triggerPublish();
    }
  }

  /**
   * Counts publish triggers in {@code (due, now]} as dropped; they passed while the
   * previous run was busy.
   */
  int countPassedTriggers(Instant due, Instant now) {
    if (!now.isAfter(due)) {
      return 0;
    }
    List<Instant> passed = TriggerCalculator.triggersBetween(due.plusNanos(1), now.plusNanos(1),
        timing.zone(), timing.publishTimes());
    for (Instant ignored : passed) {
      metrics.incrementTriggerDropped();
    }
    if (!passed.isEmpty()) {
      logger.log(Level.WARNING, "Dropped {0} publish trigger(s) that passed while a cycle was running: {1}",
          new Object[]{passed.size(), passed});
    }
    return passed.size();
  }

  /**
   * Blocks until {@link #close()} is called or the timeout elapses.
   *
   * @param timeout maximum time to wait
   * @return {@code true} if the scheduler was closed
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  /** Blocks until {@link #close()} is called. */
  public void awaitTermination() throws InterruptedException {
    terminated.await();
  }

  /**
   * Cancels the schedule and shuts down the scheduler thread. A cycle in flight is
   * interrupted.
   */
  @Override
  public void close() {
    ExecutorService stopping;
    synchronized (this) {
      if (closed) {
        return;
      }
      closed = true;
      armedFor = null;
      if (armedTask != null) {
        armedTask.cancel(false);
        armedTask = null;
      }
      stopping = scheduler;
      if (stopping != null) {
        stopping.shutdownNow();
      }
    }
    // wait outside the monitor: a finishing tick() still enters arm() and returns
    if (stopping != null) {
      try {
        stopping.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    terminated.countDown();
  }

  /**
   * Builder for {@link JobScheduler}.
   */
  public static final class Builder {
    private FetchCycle fetchCycle;
    private PublishCycle publishCycle;
    private TimingPolicy timing;
    private MetricsExporter metrics;
    private Clock clock;

    private Builder() {}

    /**
     * <p><b>Required.</b>
     *
     * @param fetchCycle the fetch workflow
     * @return this builder
     */
    public Builder fetchCycle(FetchCycle fetchCycle) {
      this.fetchCycle = fetchCycle;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @param publishCycle the publish workflow
     * @return this builder
     */
    public Builder publishCycle(PublishCycle publishCycle) {
      this.publishCycle = publishCycle;
      return this;
    }

    /**
     * Sets the publish times, the daily fetch time and their zone.
     *
     * <p><b>Required.</b>
     *
     * @param timing the timing policy
     * @return this builder
     */
    public Builder timing(TimingPolicy timing) {
      this.timing = timing;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the clock used to compute wake-up delays.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public JobScheduler build() {
      return new JobScheduler(this);
    }
  }
}
