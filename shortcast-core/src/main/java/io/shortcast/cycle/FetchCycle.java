package io.shortcast.cycle;

import io.shortcast.cooldown.CooldownGate;
import io.shortcast.model.SchedulerState;
import io.shortcast.notify.NotificationBridge;
import io.shortcast.notify.NotificationEvent;
import io.shortcast.spi.DiscoveryClient;
import io.shortcast.spi.ItemQueue;
import io.shortcast.spi.MetricsExporter;
import io.shortcast.spi.StateStore;
import io.shortcast.util.Durations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The fetch workflow: consult the cooldown, run discovery, record the fetch time.
 *
 * <p>The fetch time is written only after discovery returned normally, so a failed fetch
 * does not push back the next one. The recorded value is the instant the workflow started.
 * {@link #run(boolean)} never throws.
 */
public final class FetchCycle {
    private static final Logger logger = Logger.getLogger(FetchCycle.class.getName());

    private final StateStore stateStore;
    private final ItemQueue queue;
    private final DiscoveryClient discovery;
    private final int fetchIntervalHours;
    private final NotificationBridge notifications;
    private final MetricsExporter metrics;
    private final Clock clock;

    private FetchCycle(Builder builder) {
        this.stateStore = Objects.requireNonNull(builder.stateStore, "stateStore");
        this.queue = Objects.requireNonNull(builder.queue, "queue");
        this.discovery = Objects.requireNonNull(builder.discovery, "discovery");
        if (builder.fetchIntervalHours <= 0) {
            throw new IllegalArgumentException("fetchIntervalHours must be > 0");
        }
        this.fetchIntervalHours = builder.fetchIntervalHours;
        this.notifications = builder.notifications;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs the fetch workflow once.
     *
     * @param force bypass the cooldown for this invocation; nothing about the override is persisted
     * @return what happened
     */
    public FetchOutcome run(boolean force) {
        Instant startedAt = clock.instant();
        try {
            SchedulerState state = stateStore.load();
            if (!CooldownGate.shouldFetch(startedAt, state.lastFetchTime(), fetchIntervalHours, force)) {
                Duration remaining = CooldownGate.remaining(startedAt, state.lastFetchTime(), fetchIntervalHours);
                logger.log(Level.INFO, "Skipping fetch: last fetch was at {0}. Next allowed fetch in {1}.",
                        new Object[]{state.lastFetchTime().get(), Durations.formatHoursMinutes(remaining)});
                metrics.incrementFetchSkipped();
                return new FetchOutcome.Skipped(remaining);
            }
            if (force) {
                logger.log(Level.INFO, "Forced fetch, cooldown bypassed");
            }

            int queued = discovery.fetchAndQueueItems(queue);
            stateStore.recordFetch(startedAt);
            metrics.incrementFetchRan(queued);
            metrics.recordQueueDepth(queue.countQueued());
            logger.log(Level.INFO, "Fetch completed, {0} item(s) queued, timestamp updated to {1}. Finished in {2}",
                    new Object[]{queued, startedAt, Durations.format(Duration.between(startedAt, clock.instant()))});
            return new FetchOutcome.Ran(queued);
        } catch (Throwable t) {
            if (t instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            logger.log(Level.SEVERE, "Fetch failed, cooldown not advanced", t);
            metrics.incrementFetchFailed();
            if (notifications != null) {
                String message = t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
                notifications.notify(new NotificationEvent.FatalPipelineError("fetch", null,
                        message, clock.instant()));
            }
            return new FetchOutcome.Failed(t);
        }
    }

    /**
     * Builder for {@link FetchCycle}.
     */
    public static final class Builder {
        private StateStore stateStore;
        private ItemQueue queue;
        private DiscoveryClient discovery;
        private int fetchIntervalHours = 24;
        private NotificationBridge notifications;
        private MetricsExporter metrics;
        private Clock clock;

        private Builder() {
        }

        /**
         * <p><b>Required.</b>
         *
         * @param stateStore the state store holding the last fetch time
         * @return this builder
         */
        public Builder stateStore(StateStore stateStore) {
            this.stateStore = stateStore;
            return this;
        }

        /**
         * <p><b>Required.</b>
         *
         * @param queue the queue discovery writes into
         * @return this builder
         */
        public Builder queue(ItemQueue queue) {
            this.queue = queue;
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
         * Sets the fetch cooldown.
         *
         * <p>Optional. Defaults to {@code 24}. Must be &gt; 0.
         *
         * @param fetchIntervalHours cooldown in hours
         * @return this builder
         */
        public Builder fetchIntervalHours(int fetchIntervalHours) {
            this.fetchIntervalHours = fetchIntervalHours;
            return this;
        }

        public Builder notifications(NotificationBridge notifications) {
            this.notifications = notifications;
            return this;
        }

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public FetchCycle build() {
            return new FetchCycle(this);
        }
    }
}
