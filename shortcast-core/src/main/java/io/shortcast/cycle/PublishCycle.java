package io.shortcast.cycle;

import io.shortcast.fanout.ArtifactGenerationFailedException;
import io.shortcast.fanout.FanoutCoordinator;
import io.shortcast.model.ChannelOutcome;
import io.shortcast.model.CycleReport;
import io.shortcast.model.QueueItem;
import io.shortcast.model.SchedulerState;
import io.shortcast.notify.NotificationBridge;
import io.shortcast.notify.NotificationEvent;
import io.shortcast.select.ItemSelector;
import io.shortcast.select.Selection;
import io.shortcast.spi.DiscoveryClient;
import io.shortcast.spi.ItemQueue;
import io.shortcast.spi.MetricsExporter;
import io.shortcast.spi.StateStore;
import io.shortcast.util.Durations;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The select, generate and publish workflow.
 *
 * <p>Selects the next eligible item from a fresh queue snapshot, fans it out to every
 * channel, and marks it consumed only when at least one channel succeeded. An empty queue
 * yields an empty report. A cycle-fatal error (the shared narration could not be generated,
 * a store failure) yields an aborted report and a {@code FatalPipelineError} notification.
 * {@link #run(boolean)} never throws, so the scheduler keeps triggering normally afterwards.
 *
 * <p>With {@link Builder#refillOnEmpty(boolean)} enabled and a discovery collaborator set,
 * an empty queue is refilled once by calling discovery directly. The refill does not
 * record a fetch time, so it never delays the cooldown-gated fetch.
 */
public final class PublishCycle {
    private static final Logger logger = Logger.getLogger(PublishCycle.class.getName());

    private final StateStore stateStore;
    private final ItemQueue queue;
    private final ItemSelector selector;
    private final FanoutCoordinator fanout;
    private final DiscoveryClient refillDiscovery;
    private final NotificationBridge notifications;
    private final MetricsExporter metrics;
    private final Clock clock;

    private PublishCycle(Builder builder) {
        this.stateStore = Objects.requireNonNull(builder.stateStore, "stateStore");
        this.queue = Objects.requireNonNull(builder.queue, "queue");
        this.selector = Objects.requireNonNull(builder.selector, "selector");
        this.fanout = Objects.requireNonNull(builder.fanout, "fanout");
        this.refillDiscovery = builder.refillOnEmpty ? builder.discovery : null;
        this.notifications = builder.notifications;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs one publish cycle.
     *
     * @param allowRefill whether an empty queue may be refilled through discovery in this run
     * @return the cycle report
     */
    public CycleReport run(boolean allowRefill) {
        Instant startedAt = clock.instant();
        QueueItem item = null;
        try {
            logger.log(Level.INFO, "Pipeline stage 1/4: selecting next item");
            Selection selection = select();
            if (selection instanceof Selection.NoItemAvailable && allowRefill && refillDiscovery != null) {
                selection = refillAndSelect();
            }
            if (!(selection instanceof Selection.Selected selected)) {
                logger.log(Level.WARNING, "No eligible item in the queue, skipping this cycle");
                metrics.incrementCycleEmpty();
                return CycleReport.nothingToPublish(startedAt, clock.instant());
            }
            item = selected.item();
            logger.log(Level.INFO, "Pipeline stage 1/4: selected item {0} (score={1}, title={2})",
                    new Object[]{item.id(), item.score(), item.title()});

            List<ChannelOutcome> outcomes = fanout.publish(item);
            Instant finishedAt = clock.instant();
            CycleReport report = CycleReport.completed(item.id(), outcomes, startedAt, finishedAt);
            if (report.anySuccess()) {
                stateStore.markConsumed(item, finishedAt);
                logger.log(Level.INFO, "Marked {0} consumed after {1} successful upload(s)",
                        new Object[]{item.id(), report.successCount()});
            } else if (!outcomes.isEmpty()) {
                logger.log(Level.WARNING, "No successful uploads for {0}; keeping it queued for retry",
                        item.id());
            }
            metrics.incrementCycleCompleted();
            metrics.recordQueueDepth(queue.countQueued());
            metrics.recordCycleDurationMs(Math.max(0L, report.elapsed().toMillis()));
            logger.log(Level.INFO, "Pipeline stage 4/4: complete in {0}", Durations.format(report.elapsed()));
            return report;
        } catch (ArtifactGenerationFailedException e) {
            return abort(item, startedAt, "Shared artifact generation failed, no channel attempted", e);
        } catch (Throwable t) {
            return abort(item, startedAt, "Publish cycle aborted", t);
        }
    }

    private Selection select() {
        SchedulerState state = stateStore.load();
        return selector.selectNext(queue.snapshot(), state.consumedItemIds());
    }

    private Selection refillAndSelect() {
        logger.log(Level.INFO, "Queue is empty, fetching new items before publishing");
        try {
            int queued = refillDiscovery.fetchAndQueueItems(queue);
            logger.log(Level.INFO, "Refill queued {0} item(s)", queued);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            logger.log(Level.WARNING, "Queue refill failed", e);
            return Selection.NONE;
        }
        return select();
    }

    private CycleReport abort(QueueItem item, Instant startedAt, String reason, Throwable cause) {
        if (cause instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        String itemId = item == null ? null : item.id();
        String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        logger.log(Level.SEVERE, reason + (itemId == null ? "" : " for item " + itemId), cause);
        metrics.incrementCycleAborted();
        if (notifications != null) {
            notifications.notify(new NotificationEvent.FatalPipelineError("publish", itemId, message,
                    clock.instant()));
        }
        return CycleReport.aborted(itemId, message, startedAt, clock.instant());
    }

    /**
     * Builder for {@link PublishCycle}.
     */
    public static final class Builder {
        private StateStore stateStore;
        private ItemQueue queue;
        private ItemSelector selector;
        private FanoutCoordinator fanout;
        private DiscoveryClient discovery;
        private boolean refillOnEmpty = true;
        private NotificationBridge notifications;
        private MetricsExporter metrics;
        private Clock clock;

        private Builder() {
        }

        /**
         * <p><b>Required.</b>
         *
         * @param stateStore the state store
         * @return this builder
         */
        public Builder stateStore(StateStore stateStore) {
            this.stateStore = stateStore;
            return this;
        }

        /**
         * <p><b>Required.</b>
         *
         * @param queue the item queue
         * @return this builder
         */
        public Builder queue(ItemQueue queue) {
            this.queue = queue;
            return this;
        }

        /**
         * <p><b>Required.</b>
         *
         * @param selector the item selector
         * @return this builder
         */
        public Builder selector(ItemSelector selector) {
            this.selector = selector;
            return this;
        }

        /**
         * <p><b>Required.</b>
         *
         * @param fanout the fan-out coordinator
         * @return this builder
         */
        public Builder fanout(FanoutCoordinator fanout) {
            this.fanout = fanout;
            return this;
        }

        /**
         * Sets the discovery collaborator used to refill an empty queue.
         *
         * <p>Optional. Without one, an empty queue always ends the cycle.
         *
         * @param discovery the discovery collaborator
         * @return this builder
         */
        public Builder discovery(DiscoveryClient discovery) {
            this.discovery = discovery;
            return this;
        }

        /**
         * Optional. Defaults to {@code true}.
         *
         * @param refillOnEmpty whether an empty queue is refilled through discovery
         * @return this builder
         */
        public Builder refillOnEmpty(boolean refillOnEmpty) {
            this.refillOnEmpty = refillOnEmpty;
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

        public PublishCycle build() {
            return new PublishCycle(this);
        }
    }
}
